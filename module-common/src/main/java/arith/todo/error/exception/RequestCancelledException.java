package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.ServerBaseException;

/** 요청 deadline이 지났거나 처리 스레드가 인터럽트된 경우 */
public class RequestCancelledException extends ServerBaseException {

  public RequestCancelledException() {
    super(CommonErrorCode.REQUEST_CANCELLED);
  }
}
