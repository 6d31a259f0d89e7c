package arith.todo.core.context;

import arith.todo.error.exception.RequestCancelledException;
import io.opentelemetry.context.Context;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 요청 단위 실행 컨텍스트 (Value Object)
 *
 * <p>트레이스 컨텍스트와 요청 deadline을 endpoint 체인, 서비스, 저장소 호출까지 전달합니다. 불변이며, 트레이싱 미들웨어가 자식 span을
 * 시작하면 {@link #withTraceContext(Context)}로 새 인스턴스를 만들어 안쪽 endpoint에 넘깁니다.
 *
 * @param traceContext OpenTelemetry 컨텍스트 (span이 없으면 {@link Context#root()})
 * @param deadline 요청 만료 시각, 제한이 없으면 {@code null}
 */
public record CallContext(Context traceContext, Instant deadline) {

  public CallContext {
    Objects.requireNonNull(traceContext, "traceContext cannot be null");
  }

  /** 트레이스도 deadline도 없는 최상위 컨텍스트 */
  public static CallContext background() {
    return new CallContext(Context.root(), null);
  }

  /** 지금부터 {@code timeout} 뒤에 만료되는 컨텍스트 */
  public static CallContext withTimeout(Context traceContext, Duration timeout) {
    return new CallContext(traceContext, Instant.now().plus(timeout));
  }

  public CallContext withTraceContext(Context newTraceContext) {
    return new CallContext(newTraceContext, deadline);
  }

  public boolean hasDeadline() {
    return deadline != null;
  }

  /**
   * deadline까지 남은 시간
   *
   * @return 남은 시간 (음수가 되지 않음), deadline이 없으면 {@code fallback}
   */
  public Duration remainingOr(Duration fallback) {
    if (deadline == null) {
      return fallback;
    }
    Duration left = Duration.between(Instant.now(), deadline);
    return left.isNegative() ? Duration.ZERO : left;
  }

  public boolean isExpired() {
    return deadline != null && !Instant.now().isBefore(deadline);
  }

  /**
   * 블로킹 호출 전후에 취소 여부를 확인합니다.
   *
   * @throws RequestCancelledException deadline이 지났거나 현재 스레드가 인터럽트된 경우
   */
  public void ensureActive() {
    if (isExpired() || Thread.currentThread().isInterrupted()) {
      throw new RequestCancelledException();
    }
  }
}
