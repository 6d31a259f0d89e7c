package arith.todo.transport.http;

import arith.todo.config.TransportProperties;
import arith.todo.endpoint.ArithmeticToDoEndpoints;
import arith.todo.endpoint.Operation;
import arith.todo.endpoint.dto.AddToDoRequest;
import arith.todo.endpoint.dto.CompleteToDoRequest;
import arith.todo.endpoint.dto.ConcatRequest;
import arith.todo.endpoint.dto.DeleteToDoRequest;
import arith.todo.endpoint.dto.GetAllToDoRequest;
import arith.todo.endpoint.dto.PingRequest;
import arith.todo.endpoint.dto.SumRequest;
import arith.todo.endpoint.dto.UnDoToDoRequest;
import arith.todo.error.exception.UnknownRouteException;
import arith.todo.infrastructure.endpoint.Endpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RequestPredicates;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * operation마다 하나의 route 등록 (WebMvc functional routing)
 *
 * <pre>
 * POST   /sum            PUT    /completeToDo
 * POST   /concat         PUT    /unDoToDo
 * GET    /ping           DELETE /deleteToDo
 * POST   /addToDo        GET    /getAllToDo
 * </pre>
 *
 * <p>어느 route에도 맞지 않는 요청은 에러 envelope으로 응답합니다. 알려진 경로에 다른 메서드면 405, 그 외는 404.
 */
@Configuration
@RequiredArgsConstructor
public class HttpServerRoutes {

  private final ObjectMapper objectMapper;
  private final HttpErrorEncoder errorEncoder;
  private final OpenTelemetry openTelemetry;
  private final TransportProperties transportProperties;
  private final MeterRegistry meterRegistry;

  @Bean
  public RouterFunction<ServerResponse> endpointRoutes(ArithmeticToDoEndpoints serverEndpoints) {
    RouterFunctions.Builder routes = RouterFunctions.route();
    route(routes, Operation.SUM, json(SumRequest.class), serverEndpoints.getSumEndpoint());
    route(
        routes, Operation.CONCAT, json(ConcatRequest.class), serverEndpoints.getConcatEndpoint());
    route(
        routes,
        Operation.PING,
        RequestDecoder.ignoringBody(PingRequest::new),
        serverEndpoints.getPingEndpoint());
    route(
        routes,
        Operation.ADD_TO_DO,
        json(AddToDoRequest.class),
        serverEndpoints.getAddToDoEndpoint());
    route(
        routes,
        Operation.COMPLETE_TO_DO,
        json(CompleteToDoRequest.class),
        serverEndpoints.getCompleteToDoEndpoint());
    route(
        routes,
        Operation.UN_DO_TO_DO,
        json(UnDoToDoRequest.class),
        serverEndpoints.getUnDoToDoEndpoint());
    route(
        routes,
        Operation.DELETE_TO_DO,
        json(DeleteToDoRequest.class),
        serverEndpoints.getDeleteToDoEndpoint());
    route(
        routes,
        Operation.GET_ALL_TO_DO,
        RequestDecoder.ignoringBody(GetAllToDoRequest::new),
        serverEndpoints.getGetAllToDoEndpoint());
    routes.route(RequestPredicates.all(), this::unmatched);
    return routes.build();
  }

  private ServerResponse unmatched(ServerRequest request) {
    String method = request.method().name();
    String path = request.path();
    boolean knownPath =
        Arrays.stream(Operation.values()).anyMatch(op -> op.getPath().equals(path));
    return errorEncoder.encode(
        knownPath
            ? UnknownRouteException.methodNotAllowed(method, path)
            : UnknownRouteException.notFound(method, path));
  }

  private <Req> RequestDecoder<Req> json(Class<Req> type) {
    return RequestDecoder.json(objectMapper, type);
  }

  private <Req, Res> void route(
      RouterFunctions.Builder routes,
      Operation operation,
      RequestDecoder<Req> decoder,
      Endpoint<Req, Res> endpoint) {
    routes.route(
        RequestPredicates.method(operation.getHttpMethod())
            .and(RequestPredicates.path(operation.getPath())),
        new EndpointHttpHandler<>(
            operation.getOperationName(),
            decoder,
            endpoint,
            errorEncoder,
            openTelemetry.getPropagators().getTextMapPropagator(),
            transportProperties.requestTimeout(),
            meterRegistry));
  }
}
