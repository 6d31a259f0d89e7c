package arith.todo.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 에러 종류(kind)별 코드 정의
 *
 * <p>HTTP 상태 코드는 예외 인스턴스가 아니라 이 enum 값으로 결정됩니다. 새로운 비즈니스 에러는 상수 하나를 추가하는 것으로 충분하며, 기존 매핑
 * 코드를 건드릴 필요가 없습니다.
 *
 * <h3>코드 체계</h3>
 *
 * <ul>
 *   <li>B: 비즈니스 검증 실패 (4xx, 호출자가 수정 가능)
 *   <li>A: Admission Control (Rate Limit, Circuit Breaker)
 *   <li>T: Transport (decode/encode, 원격 호출)
 *   <li>S: 서버/인프라 (저장소, 식별자)
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Business Errors (4xx) ===
  TWO_ZEROES("B001", "can't sum two zeroes", HttpStatus.BAD_REQUEST),
  INT_OVERFLOW("B002", "integer overflow", HttpStatus.BAD_REQUEST),
  MAX_SIZE_EXCEEDED("B003", "result exceeds maximum size", HttpStatus.BAD_REQUEST),

  // === Admission Control ===
  RATE_LIMITED("A001", "rate limit exceeded", HttpStatus.TOO_MANY_REQUESTS),
  CIRCUIT_OPEN("A002", "circuit breaker is open", HttpStatus.SERVICE_UNAVAILABLE),

  // === Transport ===
  DECODE_ERROR("T001", "%s", HttpStatus.INTERNAL_SERVER_ERROR),
  REMOTE_CALL_FAILED("T002", "%s", HttpStatus.INTERNAL_SERVER_ERROR),
  REMOTE_REJECTED("T003", "%s", HttpStatus.BAD_REQUEST),
  ROUTE_NOT_FOUND("T004", "no route for %s %s", HttpStatus.NOT_FOUND),
  METHOD_NOT_ALLOWED("T005", "method %s not allowed on %s", HttpStatus.METHOD_NOT_ALLOWED),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "internal server error", HttpStatus.INTERNAL_SERVER_ERROR),
  STORE_FAILURE("S002", "%s", HttpStatus.INTERNAL_SERVER_ERROR),
  INVALID_TASK_ID("S003", "%s", HttpStatus.INTERNAL_SERVER_ERROR),
  REQUEST_CANCELLED(
      "S004", "request cancelled or deadline exceeded", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
