package arith.todo.transport.http.client;

import arith.todo.config.ClientProperties;
import arith.todo.config.EndpointProperties.CircuitBreakerPolicy;
import arith.todo.config.EndpointProperties.RateLimit;
import arith.todo.endpoint.ArithmeticToDoEndpoints;
import arith.todo.endpoint.Operation;
import arith.todo.endpoint.dto.AddToDoResponse;
import arith.todo.endpoint.dto.CompleteToDoResponse;
import arith.todo.endpoint.dto.ConcatResponse;
import arith.todo.endpoint.dto.DeleteToDoResponse;
import arith.todo.endpoint.dto.GetAllToDoResponse;
import arith.todo.endpoint.dto.PingResponse;
import arith.todo.endpoint.dto.SumResponse;
import arith.todo.endpoint.dto.UnDoToDoResponse;
import arith.todo.infrastructure.endpoint.Endpoint;
import arith.todo.infrastructure.endpoint.EndpointChain;
import arith.todo.infrastructure.endpoint.middleware.CircuitBreakerMiddleware;
import arith.todo.infrastructure.endpoint.middleware.RateLimitingMiddleware;
import arith.todo.infrastructure.endpoint.middleware.TracingMiddleware;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.bucket4j.Bucket;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 원격 인스턴스를 로컬 서비스처럼 쓰게 해 주는 클라이언트 트랜스포트
 *
 * <p>operation마다 체인을 따로 조립하며, 각 체인은 자기 operation의 원격 endpoint만 감쌉니다.
 *
 * <pre>
 * circuit breaker(operation별) → rate limiter(공유 버킷) → tracing(CLIENT) → remote call
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpClientTransport {

  static final String BREAKER_PREFIX = "client.";

  private final WebClient.Builder webClientBuilder;
  private final ObjectMapper objectMapper;
  private final OpenTelemetry openTelemetry;
  private final Tracer tracer;
  private final MeterRegistry meterRegistry;
  private final CircuitBreakerRegistry circuitBreakerRegistry;
  private final ClientProperties properties;

  /** {@code todo.client.instance}에 연결 */
  public ArithmeticToDoEndpoints connect() {
    return connect(properties.instance());
  }

  public ArithmeticToDoEndpoints connect(String instance) {
    String baseUrl = InstanceUrl.normalize(instance);
    WebClient webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
    RateLimit rateLimit = properties.rateLimit();
    Bucket shared =
        RateLimitingMiddleware.newBucket(rateLimit.rate(), rateLimit.period(), rateLimit.burst());
    log.info("[HttpClient] connected: instance={} timeout={}", baseUrl, properties.timeout());

    return ArithmeticToDoEndpoints.builder()
        .sumEndpoint(
            client(Operation.SUM, remote(webClient, Operation.SUM, SumResponse.class), shared))
        .concatEndpoint(
            client(
                Operation.CONCAT,
                remote(webClient, Operation.CONCAT, ConcatResponse.class),
                shared))
        .pingEndpoint(
            client(Operation.PING, remote(webClient, Operation.PING, PingResponse.class), shared))
        .addToDoEndpoint(
            client(
                Operation.ADD_TO_DO,
                remote(webClient, Operation.ADD_TO_DO, AddToDoResponse.class),
                shared))
        .completeToDoEndpoint(
            client(
                Operation.COMPLETE_TO_DO,
                remote(webClient, Operation.COMPLETE_TO_DO, CompleteToDoResponse.class),
                shared))
        .unDoToDoEndpoint(
            client(
                Operation.UN_DO_TO_DO,
                remote(webClient, Operation.UN_DO_TO_DO, UnDoToDoResponse.class),
                shared))
        .deleteToDoEndpoint(
            client(
                Operation.DELETE_TO_DO,
                remote(webClient, Operation.DELETE_TO_DO, DeleteToDoResponse.class),
                shared))
        .getAllToDoEndpoint(
            client(
                Operation.GET_ALL_TO_DO,
                remote(webClient, Operation.GET_ALL_TO_DO, GetAllToDoResponse.class),
                shared))
        .build();
  }

  private <Req, Res> RemoteEndpoint<Req, Res> remote(
      WebClient webClient, Operation operation, Class<Res> responseType) {
    return new RemoteEndpoint<>(
        webClient,
        operation,
        responseType,
        objectMapper,
        openTelemetry.getPropagators().getTextMapPropagator(),
        properties.timeout());
  }

  private <Req, Res> Endpoint<Req, Res> client(
      Operation operation, Endpoint<Req, Res> remote, Bucket sharedBucket) {
    String name = operation.getOperationName();
    CircuitBreakerPolicy breaker = properties.circuitBreakerFor(name);
    return EndpointChain.<Req, Res>builder()
        .then(
            new CircuitBreakerMiddleware<>(
                circuitBreakerRegistry.circuitBreaker(
                    BREAKER_PREFIX + name,
                    CircuitBreakerMiddleware.consecutiveFailuresConfig(
                        breaker.failureThreshold(),
                        breaker.waitDuration(),
                        breaker.permittedCallsInHalfOpen()))))
        .then(new RateLimitingMiddleware<>(BREAKER_PREFIX + name, sharedBucket, meterRegistry))
        .then(TracingMiddleware.client(name, tracer))
        .build()
        .decorate(remote);
  }
}
