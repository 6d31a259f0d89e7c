package arith.todo.endpoint;

import arith.todo.config.EndpointProperties;
import arith.todo.config.EndpointProperties.CircuitBreakerPolicy;
import arith.todo.config.EndpointProperties.OperationPolicy;
import arith.todo.config.EndpointProperties.RateLimit;
import arith.todo.core.service.ArithmeticToDoService;
import arith.todo.endpoint.dto.ConcatResponse;
import arith.todo.endpoint.dto.SumResponse;
import arith.todo.infrastructure.endpoint.Endpoint;
import arith.todo.infrastructure.endpoint.EndpointChain;
import arith.todo.infrastructure.endpoint.middleware.CircuitBreakerMiddleware;
import arith.todo.infrastructure.endpoint.middleware.InstrumentingMiddleware;
import arith.todo.infrastructure.endpoint.middleware.LoggingMiddleware;
import arith.todo.infrastructure.endpoint.middleware.RateLimitingMiddleware;
import arith.todo.infrastructure.endpoint.middleware.TracingMiddleware;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 서버 측 endpoint 묶음 조립
 *
 * <p>operation마다 독립된 미들웨어 인스턴스(버킷, 서킷 브레이커)를 만들어 바깥쪽 → 안쪽 순서로 감쌉니다.
 *
 * <pre>
 * tracing → logging → instrumenting → circuit breaker → rate limiter → operation
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServerEndpointFactory {

  static final String SUM_INTEGERS = "endpoint.sum.integers";
  static final String CONCAT_CHARACTERS = "endpoint.concat.characters";

  private final EndpointProperties properties;
  private final MeterRegistry meterRegistry;
  private final Tracer tracer;
  private final CircuitBreakerRegistry circuitBreakerRegistry;

  public ArithmeticToDoEndpoints create(ArithmeticToDoService service) {
    ArithmeticToDoEndpoints core = ArithmeticToDoEndpoints.fromService(service);
    return ArithmeticToDoEndpoints.builder()
        .sumEndpoint(
            decorate(
                Operation.SUM,
                core.getSumEndpoint(),
                m -> m.counting(SUM_INTEGERS, SumResponse::v)))
        .concatEndpoint(
            decorate(
                Operation.CONCAT,
                core.getConcatEndpoint(),
                m -> m.counting(CONCAT_CHARACTERS, r -> r.v().length())))
        .pingEndpoint(decorate(Operation.PING, core.getPingEndpoint()))
        .addToDoEndpoint(decorate(Operation.ADD_TO_DO, core.getAddToDoEndpoint()))
        .completeToDoEndpoint(decorate(Operation.COMPLETE_TO_DO, core.getCompleteToDoEndpoint()))
        .unDoToDoEndpoint(decorate(Operation.UN_DO_TO_DO, core.getUnDoToDoEndpoint()))
        .deleteToDoEndpoint(decorate(Operation.DELETE_TO_DO, core.getDeleteToDoEndpoint()))
        .getAllToDoEndpoint(decorate(Operation.GET_ALL_TO_DO, core.getGetAllToDoEndpoint()))
        .build();
  }

  private <Req, Res> Endpoint<Req, Res> decorate(Operation operation, Endpoint<Req, Res> core) {
    return decorate(operation, core, UnaryOperator.identity());
  }

  private <Req, Res> Endpoint<Req, Res> decorate(
      Operation operation,
      Endpoint<Req, Res> core,
      UnaryOperator<InstrumentingMiddleware<Req, Res>> counters) {
    String name = operation.getOperationName();
    OperationPolicy policy = properties.policyFor(name);
    RateLimit rateLimit = policy.rateLimit();
    CircuitBreakerPolicy breaker = policy.circuitBreaker();

    CircuitBreaker circuitBreaker =
        circuitBreakerRegistry.circuitBreaker(
            name,
            CircuitBreakerMiddleware.consecutiveFailuresConfig(
                breaker.failureThreshold(),
                breaker.waitDuration(),
                breaker.permittedCallsInHalfOpen()));

    log.info(
        "[Endpoint:{}] {} {} rate={}/{} burst={} breakerThreshold={} breakerOpen={}",
        name,
        operation.getHttpMethod(),
        operation.getPath(),
        rateLimit.rate(),
        rateLimit.period(),
        rateLimit.burst(),
        breaker.failureThreshold(),
        breaker.waitDuration());

    return EndpointChain.<Req, Res>builder()
        .then(TracingMiddleware.server(name, tracer))
        .then(new LoggingMiddleware<>(name))
        .then(counters.apply(new InstrumentingMiddleware<>(name, meterRegistry)))
        .then(new CircuitBreakerMiddleware<>(circuitBreaker))
        .then(
            new RateLimitingMiddleware<>(
                name,
                RateLimitingMiddleware.newBucket(
                    rateLimit.rate(), rateLimit.period(), rateLimit.burst()),
                meterRegistry))
        .build()
        .decorate(core);
  }
}
