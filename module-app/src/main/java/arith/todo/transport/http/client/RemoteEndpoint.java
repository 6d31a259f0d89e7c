package arith.todo.transport.http.client;

import arith.todo.core.context.CallContext;
import arith.todo.endpoint.Operation;
import arith.todo.error.dto.ErrorResponse;
import arith.todo.error.exception.RemoteBusinessException;
import arith.todo.error.exception.RemoteServiceException;
import arith.todo.error.exception.RequestDecodeException;
import arith.todo.infrastructure.endpoint.Endpoint;
import arith.todo.infrastructure.endpoint.Outcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.context.propagation.TextMapPropagator;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

/**
 * 원격 인스턴스의 operation 하나를 호출하는 endpoint (체인의 가장 안쪽)
 *
 * <ul>
 *   <li>요청을 JSON 본문으로 보내고 현재 트레이스 컨텍스트를 {@code traceparent} 헤더로 주입
 *   <li>200: 응답 타입으로 decode
 *   <li>4xx: 에러 envelope 메시지를 담은 {@link RemoteBusinessException}을 {@link Outcome} 실패로 반환
 *   <li>그 외: {@link RemoteServiceException}을 던짐 (서킷 브레이커 실패로 집계)
 * </ul>
 */
@Slf4j
public class RemoteEndpoint<Req, Res> implements Endpoint<Req, Res> {

  private final WebClient webClient;
  private final Operation operation;
  private final Class<Res> responseType;
  private final ObjectMapper objectMapper;
  private final TextMapPropagator propagator;
  private final Duration timeout;

  public RemoteEndpoint(
      WebClient webClient,
      Operation operation,
      Class<Res> responseType,
      ObjectMapper objectMapper,
      TextMapPropagator propagator,
      Duration timeout) {
    this.webClient = webClient;
    this.operation = operation;
    this.responseType = responseType;
    this.objectMapper = objectMapper;
    this.propagator = propagator;
    this.timeout = timeout;
  }

  @Override
  public Outcome<Res> handle(CallContext ctx, Req request) {
    ctx.ensureActive();
    Duration remaining = ctx.remainingOr(timeout);
    Duration budget = remaining.compareTo(timeout) < 0 ? remaining : timeout;

    WebClient.RequestBodySpec spec =
        webClient
            .method(operation.getHttpMethod())
            .uri(operation.getPath())
            .headers(h -> propagator.inject(ctx.traceContext(), h, HttpHeaders::set));
    WebClient.RequestHeadersSpec<?> call =
        operation.hasRequestBody()
            ? spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request)
            : spec;

    ResponseEntity<String> response;
    try {
      response =
          call.exchangeToMono(r -> r.toEntity(String.class))
              .timeout(
                  budget,
                  Mono.error(
                      () ->
                          new RemoteServiceException(
                              operation.getPath() + ": no response within " + budget, null)))
              .block();
    } catch (WebClientException e) {
      log.warn(
          "[HttpClient] {} {} failed: {}",
          operation.getHttpMethod(),
          operation.getPath(),
          e.getMessage());
      throw new RemoteServiceException(e.getMessage(), e);
    }
    return decode(response);
  }

  Outcome<Res> decode(ResponseEntity<String> response) {
    if (response == null) {
      throw new RemoteServiceException(operation.getPath() + ": empty response", null);
    }
    HttpStatusCode status = response.getStatusCode();
    String body = response.getBody();
    if (status.value() == 200) {
      try {
        return Outcome.success(objectMapper.readValue(body == null ? "" : body, responseType));
      } catch (JsonProcessingException e) {
        throw new RequestDecodeException(e.getOriginalMessage(), e);
      }
    }

    String message = errorMessage(status, body);
    if (status.is4xxClientError()) {
      return Outcome.failure(new RemoteBusinessException(status.value(), message));
    }
    throw new RemoteServiceException(status.value(), message);
  }

  private String errorMessage(HttpStatusCode status, String body) {
    if (body != null && !body.isBlank()) {
      try {
        ErrorResponse envelope = objectMapper.readValue(body, ErrorResponse.class);
        if (envelope.error() != null) {
          return envelope.error();
        }
      } catch (JsonProcessingException e) {
        log.debug("[HttpClient] non-envelope error body from {}: {}", operation.getPath(), body);
      }
    }
    return "remote returned status " + status.value();
  }
}
