package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.ServerBaseException;

/** 저장소 호출 실패 (연결 불가, 쿼리 실패 등) */
public class ToDoStoreException extends ServerBaseException {

  public ToDoStoreException(String detail, Throwable cause) {
    super(CommonErrorCode.STORE_FAILURE, cause, detail);
  }
}
