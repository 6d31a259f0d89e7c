package arith.todo.transport.http;

import arith.todo.core.context.CallContext;
import arith.todo.error.exception.RequestDecodeException;
import arith.todo.infrastructure.endpoint.Endpoint;
import arith.todo.infrastructure.endpoint.Outcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.HandlerFunction;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * 하나의 route를 처리하는 핸들러: decode → endpoint 호출 → encode
 *
 * <ul>
 *   <li>들어온 {@code traceparent}를 추출해 {@link CallContext}에 담고 요청 deadline을 붙임
 *   <li>decode 실패는 endpoint에 도달하지 않으므로 여기서 WARN 로그와 {@value #DECODE_FAILURES} 카운터로 남김
 *   <li>성공 응답은 200 JSON, {@link Outcome} 실패와 던져진 예외는 {@link HttpErrorEncoder}가 에러 envelope으로 변환
 *   <li>요청 하나에 정확히 하나의 응답
 * </ul>
 */
@Slf4j
public class EndpointHttpHandler<Req, Res> implements HandlerFunction<ServerResponse> {

  public static final String DECODE_FAILURES = "endpoint.decode.failures";

  static final TextMapGetter<ServerRequest> HEADER_GETTER =
      new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(ServerRequest carrier) {
          return carrier.headers().asHttpHeaders().keySet();
        }

        @Override
        public String get(ServerRequest carrier, String key) {
          return carrier == null ? null : carrier.headers().firstHeader(key);
        }
      };

  private final String operation;
  private final RequestDecoder<Req> decoder;
  private final Endpoint<Req, Res> endpoint;
  private final HttpErrorEncoder errorEncoder;
  private final TextMapPropagator propagator;
  private final Duration requestTimeout;
  private final Counter decodeFailures;

  public EndpointHttpHandler(
      String operation,
      RequestDecoder<Req> decoder,
      Endpoint<Req, Res> endpoint,
      HttpErrorEncoder errorEncoder,
      TextMapPropagator propagator,
      Duration requestTimeout,
      MeterRegistry meterRegistry) {
    this.operation = operation;
    this.decoder = decoder;
    this.endpoint = endpoint;
    this.errorEncoder = errorEncoder;
    this.propagator = propagator;
    this.requestTimeout = requestTimeout;
    this.decodeFailures =
        Counter.builder(DECODE_FAILURES)
            .tag("method", operation)
            .tag("error", "true")
            .register(meterRegistry);
  }

  @Override
  public ServerResponse handle(ServerRequest request) {
    Req decoded;
    try {
      decoded = decoder.decode(request);
    } catch (RequestDecodeException e) {
      decodeFailures.increment();
      log.warn("[HttpTransport] {} {} decode failed: {}", operation, request.path(), e.getMessage());
      return errorEncoder.encode(e);
    }
    try {
      Context incoming = propagator.extract(Context.root(), request, HEADER_GETTER);
      CallContext ctx = CallContext.withTimeout(incoming, requestTimeout);

      Outcome<Res> outcome = endpoint.handle(ctx, decoded);
      if (outcome.failed()) {
        return errorEncoder.encode(outcome.failure());
      }
      return ServerResponse.ok().contentType(MediaType.APPLICATION_JSON).body(outcome.value());
    } catch (RuntimeException e) {
      log.debug("[HttpTransport] {} failed: {}", operation, e.getMessage());
      return errorEncoder.encode(e);
    }
  }
}
