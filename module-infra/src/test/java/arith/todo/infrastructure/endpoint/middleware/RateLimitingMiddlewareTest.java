package arith.todo.infrastructure.endpoint.middleware;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import arith.todo.core.context.CallContext;
import arith.todo.error.exception.RateLimitExceededException;
import arith.todo.infrastructure.endpoint.Endpoint;
import arith.todo.infrastructure.endpoint.Outcome;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.TimeMeter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("RateLimitingMiddleware 테스트")
class RateLimitingMiddlewareTest {

  /** 수동으로 진행시키는 시계 */
  static final class ManualTimeMeter implements TimeMeter {
    private long nanos;

    void advance(Duration duration) {
      nanos += duration.toNanos();
    }

    @Override
    public long currentTimeNanos() {
      return nanos;
    }

    @Override
    public boolean isWallClockBased() {
      return false;
    }
  }

  private final CallContext ctx = CallContext.background();
  private ManualTimeMeter clock;
  private SimpleMeterRegistry registry;
  private AtomicInteger calls;
  private Endpoint<String, String> limited;

  @BeforeEach
  void setUp() {
    clock = new ManualTimeMeter();
    registry = new SimpleMeterRegistry();
    calls = new AtomicInteger();
    Bucket bucket = RateLimitingMiddleware.newBucket(1, Duration.ofSeconds(1), 1, clock);
    Endpoint<String, String> core =
        (c, request) -> {
          calls.incrementAndGet();
          return Outcome.success(request);
        };
    limited = new RateLimitingMiddleware<String, String>("Sum", bucket, registry).wrap(core);
  }

  @Test
  @DisplayName("burst=1: 연속 두 번째 호출은 대기 없이 RateLimited, 안쪽 endpoint 미호출")
  void second_call_rejected() {
    assertThat(limited.handle(ctx, "a").value()).isEqualTo("a");

    assertThatThrownBy(() -> limited.handle(ctx, "b"))
        .isInstanceOf(RateLimitExceededException.class)
        .hasMessage("rate limit exceeded");
    assertThat(calls).hasValue(1);
  }

  @Test
  @DisplayName("1초 경과 후 토큰이 다시 채워짐")
  void refills_after_period() {
    limited.handle(ctx, "a");
    clock.advance(Duration.ofSeconds(1));

    assertThat(limited.handle(ctx, "b").value()).isEqualTo("b");
    assertThat(calls).hasValue(2);
  }

  @Test
  @DisplayName("허용/거부 결과를 ratelimit.consume 카운터로 기록")
  void records_metrics() {
    limited.handle(ctx, "a");
    assertThatThrownBy(() -> limited.handle(ctx, "b"));

    assertThat(consumeCount("allowed")).isEqualTo(1.0);
    assertThat(consumeCount("denied")).isEqualTo(1.0);
  }

  private double consumeCount(String result) {
    return registry
        .get("ratelimit.consume")
        .tags("method", "Sum", "result", result)
        .counter()
        .count();
  }

  @Test
  @DisplayName("공유 버킷은 operation 사이에서 토큰을 함께 소모")
  void shared_bucket_across_operations() {
    Bucket shared = RateLimitingMiddleware.newBucket(1, Duration.ofSeconds(1), 2, clock);
    Endpoint<String, String> a =
        new RateLimitingMiddleware<String, String>("A", shared, registry)
            .wrap((c, r) -> Outcome.success(r));
    Endpoint<Integer, Integer> b =
        new RateLimitingMiddleware<Integer, Integer>("B", shared, registry)
            .wrap((c, r) -> Outcome.success(r));

    a.handle(ctx, "x");
    b.handle(ctx, 1);

    assertThatThrownBy(() -> a.handle(ctx, "y")).isInstanceOf(RateLimitExceededException.class);
  }
}
