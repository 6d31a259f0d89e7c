package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.BaseException;

/** 요청/응답 본문을 해석할 수 없는 경우. 메시지는 파서가 보고한 원인을 그대로 사용합니다. */
public class RequestDecodeException extends BaseException {

  public RequestDecodeException(String detail, Throwable cause) {
    super(CommonErrorCode.DECODE_ERROR, cause, detail);
  }
}
