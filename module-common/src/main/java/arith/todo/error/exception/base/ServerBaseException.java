package arith.todo.error.exception.base;

import arith.todo.error.ErrorCode;
import arith.todo.error.exception.marker.CircuitBreakerRecordMarker;

/**
 * ServerBaseException: 저장소 장애, 원격 호출 실패 등 인프라 측 '서버 예외' 5xx 계열의 에러를 처리하며, 장애 회고를 위한 상세 로그를 남기는 것이 주
 * 목적입니다.
 */
public abstract class ServerBaseException extends BaseException
    implements CircuitBreakerRecordMarker {

  protected ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  protected ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)를 포함하여 디버깅 정보 확보
  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
