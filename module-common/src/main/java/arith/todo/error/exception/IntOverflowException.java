package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.ClientBaseException;

/** Sum 결과가 32비트 부호 있는 정수 범위를 벗어나는 경우 */
public class IntOverflowException extends ClientBaseException {

  public IntOverflowException() {
    super(CommonErrorCode.INT_OVERFLOW);
  }
}
