package arith.todo.error.exception.base;

import arith.todo.error.ErrorCode;
import arith.todo.error.exception.marker.CircuitBreakerIgnoreMarker;

/**
 * ClientBaseException: 호출자가 입력을 고쳐서 해결할 수 있는 '비즈니스 예외' 4xx 계열의 에러를 처리하며, 실패 원인을 응답 본문에 그대로 전달하는 것이
 * 목적입니다.
 *
 * <p>비즈니스 예외는 서비스 장애가 아니므로 서킷브레이커 실패로 집계하지 않습니다.
 */
public abstract class ClientBaseException extends BaseException
    implements CircuitBreakerIgnoreMarker {

  protected ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
