package arith.todo.endpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import arith.todo.config.EndpointProperties;
import arith.todo.config.EndpointProperties.CircuitBreakerPolicy;
import arith.todo.config.EndpointProperties.OperationPolicy;
import arith.todo.config.EndpointProperties.RateLimit;
import arith.todo.core.context.CallContext;
import arith.todo.core.service.ArithmeticToDoService;
import arith.todo.endpoint.dto.CompleteToDoRequest;
import arith.todo.endpoint.dto.ConcatRequest;
import arith.todo.endpoint.dto.DeleteToDoRequest;
import arith.todo.endpoint.dto.SumRequest;
import arith.todo.error.exception.CircuitOpenException;
import arith.todo.error.exception.InvalidTaskIdException;
import arith.todo.error.exception.MaxSizeExceededException;
import arith.todo.error.exception.RateLimitExceededException;
import arith.todo.error.exception.ToDoStoreException;
import arith.todo.infrastructure.endpoint.Outcome;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("ServerEndpointFactory 조립 테스트")
class ServerEndpointFactoryTest {

  private static final int THRESHOLD = 2;
  private static final String VALID_ID = "65f0c0ffee00000000000001";

  private final ArithmeticToDoService service = mock(ArithmeticToDoService.class);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final CircuitBreakerRegistry breakers = CircuitBreakerRegistry.ofDefaults();
  private final CallContext ctx = CallContext.background();

  private ArithmeticToDoEndpoints endpoints;

  @BeforeEach
  void setUp() {
    CircuitBreakerPolicy breaker = new CircuitBreakerPolicy(THRESHOLD, Duration.ofMinutes(1), 1);
    OperationPolicy defaults =
        new OperationPolicy(new RateLimit(1, Duration.ofSeconds(1), 100), breaker);
    // 소문자 키로도 Sum 설정을 찾아야 함
    OperationPolicy sumPolicy =
        new OperationPolicy(new RateLimit(1, Duration.ofHours(1), 1), breaker);
    EndpointProperties properties = new EndpointProperties(defaults, Map.of("sum", sumPolicy));

    endpoints =
        new ServerEndpointFactory(
                properties,
                meterRegistry,
                OpenTelemetry.noop().getTracer("test"),
                breakers)
            .create(service);
  }

  @Test
  @DisplayName("operation별 버킷: Sum 버킷이 비어도 Concat은 통과")
  void per_operation_rate_limit() {
    // given
    given(service.sum(any(), anyLong(), anyLong())).willReturn(3);
    given(service.concat(any(), anyString(), anyString())).willReturn("ab");

    // when & then
    assertThat(endpoints.getSumEndpoint().handle(ctx, new SumRequest(1, 2)).value().v())
        .isEqualTo(3);
    assertThatThrownBy(() -> endpoints.getSumEndpoint().handle(ctx, new SumRequest(1, 2)))
        .isInstanceOf(RateLimitExceededException.class);
    assertThat(endpoints.getConcatEndpoint().handle(ctx, new ConcatRequest("a", "b")).failed())
        .isFalse();
  }

  @Test
  @DisplayName("비즈니스 실패는 서킷 브레이커를 열지 않음")
  void business_failures_do_not_open_breaker() {
    // given
    given(service.concat(any(), anyString(), anyString()))
        .willThrow(new MaxSizeExceededException());

    // when
    for (int i = 0; i < THRESHOLD * 2; i++) {
      Outcome<?> outcome = endpoints.getConcatEndpoint().handle(ctx, new ConcatRequest("a", "b"));
      assertThat(outcome.failure()).isInstanceOf(MaxSizeExceededException.class);
    }

    // then
    assertThat(breakers.circuitBreaker("Concat").getState())
        .isEqualTo(CircuitBreaker.State.CLOSED);
  }

  @Test
  @DisplayName("연속 인프라 실패는 서킷 브레이커를 열고 이후 호출은 즉시 거부")
  void store_failures_open_breaker() {
    // given
    given(service.deleteToDo(any(), eq("id")))
        .willThrow(new ToDoStoreException("connection refused", null));

    // when
    for (int i = 0; i < THRESHOLD; i++) {
      assertThatThrownBy(
              () -> endpoints.getDeleteToDoEndpoint().handle(ctx, new DeleteToDoRequest("id")))
          .isInstanceOf(ToDoStoreException.class);
    }

    // then
    assertThatThrownBy(
            () -> endpoints.getDeleteToDoEndpoint().handle(ctx, new DeleteToDoRequest("id")))
        .isInstanceOf(CircuitOpenException.class);
    verify(service, times(THRESHOLD)).deleteToDo(any(), eq("id"));
  }

  @Test
  @DisplayName("잘못된 식별자가 반복되어도 브레이커는 닫힌 채 정상 호출을 통과")
  void malformed_ids_do_not_open_breaker() {
    // given
    given(service.completeToDo(any(), eq("not-an-id")))
        .willThrow(
            new InvalidTaskIdException(
                "not-an-id", new IllegalArgumentException("invalid hexadecimal representation")));
    given(service.completeToDo(any(), eq(VALID_ID))).willReturn(VALID_ID);

    // when
    for (int i = 0; i < THRESHOLD * 3; i++) {
      assertThatThrownBy(
              () ->
                  endpoints
                      .getCompleteToDoEndpoint()
                      .handle(ctx, new CompleteToDoRequest("not-an-id")))
          .isInstanceOf(InvalidTaskIdException.class);
    }

    // then
    assertThat(breakers.circuitBreaker("CompleteToDo").getState())
        .isEqualTo(CircuitBreaker.State.CLOSED);
    assertThat(
            endpoints
                .getCompleteToDoEndpoint()
                .handle(ctx, new CompleteToDoRequest(VALID_ID))
                .value()
                .taskId())
        .isEqualTo(VALID_ID);
  }

  @Test
  @DisplayName("Sum 결과와 Concat 길이를 카운터에 누적")
  void counters() {
    // given
    given(service.sum(any(), anyLong(), anyLong())).willReturn(-5);
    given(service.concat(any(), anyString(), anyString())).willReturn("abcd");

    // when
    endpoints.getSumEndpoint().handle(ctx, new SumRequest(-2, -3));
    endpoints.getConcatEndpoint().handle(ctx, new ConcatRequest("ab", "cd"));

    // then
    assertThat(meterRegistry.get(ServerEndpointFactory.SUM_INTEGERS).counter().count())
        .isEqualTo(5.0);
    assertThat(meterRegistry.get(ServerEndpointFactory.CONCAT_CHARACTERS).counter().count())
        .isEqualTo(4.0);
  }
}
