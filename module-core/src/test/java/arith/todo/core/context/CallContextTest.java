package arith.todo.core.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

import arith.todo.error.exception.RequestCancelledException;
import io.opentelemetry.context.Context;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("CallContext 취소 전파 테스트")
class CallContextTest {

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  @DisplayName("deadline 없는 컨텍스트는 항상 활성")
  void background_is_active() {
    CallContext ctx = CallContext.background();

    assertThat(ctx.hasDeadline()).isFalse();
    assertThat(ctx.remainingOr(Duration.ofSeconds(3))).isEqualTo(Duration.ofSeconds(3));
    assertThatCode(ctx::ensureActive).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("지난 deadline은 RequestCancelledException")
  void expired_deadline() {
    CallContext ctx = new CallContext(Context.root(), Instant.now().minusSeconds(1));

    assertThat(ctx.remainingOr(Duration.ofSeconds(3))).isEqualTo(Duration.ZERO);
    assertThatThrownBy(ctx::ensureActive)
        .isInstanceOf(RequestCancelledException.class)
        .hasMessage("request cancelled or deadline exceeded");
  }

  @Test
  @DisplayName("인터럽트된 스레드는 취소로 간주")
  void interrupted_thread() {
    CallContext ctx = CallContext.withTimeout(Context.root(), Duration.ofMinutes(1));
    Thread.currentThread().interrupt();

    assertThatThrownBy(ctx::ensureActive).isInstanceOf(RequestCancelledException.class);
  }

  @Test
  @DisplayName("trace 컨텍스트 교체 시 deadline 유지")
  void with_trace_context_keeps_deadline() {
    CallContext ctx = CallContext.withTimeout(Context.root(), Duration.ofMinutes(1));

    CallContext replaced = ctx.withTraceContext(Context.current());

    assertThat(replaced.deadline()).isEqualTo(ctx.deadline());
  }
}
