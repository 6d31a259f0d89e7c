package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.BaseException;
import arith.todo.error.exception.marker.CircuitBreakerIgnoreMarker;
import lombok.Getter;

/**
 * Rate Limit 초과 예외 (Admission Control)
 *
 * <p>토큰 버킷이 비어 있으면 대기하지 않고 즉시 발생합니다. 하위 서비스 장애가 아니므로 {@link CircuitBreakerIgnoreMarker}를 구현해
 * 서킷브레이커 실패 카운트에서 제외합니다.
 *
 * <h4>응답 예시</h4>
 *
 * <pre>
 * HTTP/1.1 429 Too Many Requests
 *
 * {"error": "rate limit exceeded"}
 * </pre>
 */
@Getter
public class RateLimitExceededException extends BaseException
    implements CircuitBreakerIgnoreMarker {

  /** 제한에 걸린 operation 이름 (로그용) */
  private final String operation;

  public RateLimitExceededException(String operation) {
    super(CommonErrorCode.RATE_LIMITED);
    this.operation = operation;
  }
}
