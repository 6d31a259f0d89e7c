package arith.todo.infrastructure.endpoint.middleware;

import arith.todo.error.exception.RateLimitExceededException;
import arith.todo.infrastructure.endpoint.Endpoint;
import arith.todo.infrastructure.endpoint.EndpointMiddleware;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.TimeMeter;
import io.github.bucket4j.local.LocalBucketBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * 토큰 버킷 기반 Admission Control (Bucket4j, 로컬 버킷)
 *
 * <h4>동작</h4>
 *
 * <ul>
 *   <li>호출마다 토큰 1개 소비. 버킷은 {@code burst} 용량으로 시작하고 {@code period}마다 {@code rate}개씩 Greedy Refill
 *   <li>버킷이 비면 대기 없이 즉시 {@link RateLimitExceededException}
 *   <li>버킷은 동시 호출 간에 공유되며 Bucket4j가 lock-free로 갱신
 * </ul>
 *
 * <p>클라이언트 측처럼 여러 operation이 하나의 버킷을 공유해야 하면 같은 {@link Bucket}으로 operation마다 인스턴스를 만듭니다.
 */
@Slf4j
public class RateLimitingMiddleware<Req, Res> implements EndpointMiddleware<Req, Res> {

  private final String operation;
  private final Bucket bucket;
  private final MeterRegistry meterRegistry;

  public RateLimitingMiddleware(String operation, Bucket bucket, MeterRegistry meterRegistry) {
    this.operation = operation;
    this.bucket = bucket;
    this.meterRegistry = meterRegistry;
  }

  /** 시스템 시계를 쓰는 버킷 */
  public static Bucket newBucket(long rate, Duration period, long burst) {
    return newBucket(rate, period, burst, null);
  }

  /**
   * 버킷 생성
   *
   * @param timeMeter 테스트용 시계, {@code null}이면 시스템 시계
   */
  public static Bucket newBucket(long rate, Duration period, long burst, TimeMeter timeMeter) {
    Bandwidth bandwidth = Bandwidth.builder().capacity(burst).refillGreedy(rate, period).build();
    LocalBucketBuilder builder = Bucket.builder().addLimit(bandwidth);
    if (timeMeter != null) {
      builder.withCustomTimePrecision(timeMeter);
    }
    return builder.build();
  }

  @Override
  public Endpoint<Req, Res> wrap(Endpoint<Req, Res> next) {
    return (ctx, request) -> {
      boolean consumed = bucket.tryConsume(1);
      recordMetrics(consumed);
      if (!consumed) {
        log.debug("[RateLimit:{}] bucket empty, rejecting", operation);
        throw new RateLimitExceededException(operation);
      }
      return next.handle(ctx, request);
    };
  }

  private void recordMetrics(boolean consumed) {
    String result = consumed ? "allowed" : "denied";
    meterRegistry.counter("ratelimit.consume", "method", operation, "result", result).increment();
  }
}
