package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.ClientBaseException;

/** Sum의 두 피연산자가 모두 0인 경우 (임의로 정한 비즈니스 규칙) */
public class TwoZeroesException extends ClientBaseException {

  public TwoZeroesException() {
    super(CommonErrorCode.TWO_ZEROES);
  }
}
