package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.ClientBaseException;

/** Concat 결과가 최대 길이를 초과하는 경우 */
public class MaxSizeExceededException extends ClientBaseException {

  public MaxSizeExceededException() {
    super(CommonErrorCode.MAX_SIZE_EXCEEDED);
  }
}
