package arith.todo.infrastructure.endpoint.middleware;

import arith.todo.core.context.CallContext;
import arith.todo.infrastructure.endpoint.Endpoint;
import arith.todo.infrastructure.endpoint.EndpointMiddleware;
import arith.todo.infrastructure.endpoint.Outcome;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.MDC;

/**
 * operation 이름으로 span을 열고 닫는 미들웨어 (OpenTelemetry)
 *
 * <ul>
 *   <li>부모: {@link CallContext#traceContext()}. 서버는 트랜스포트가 헤더에서 추출한 컨텍스트, 클라이언트는 호출부 컨텍스트
 *   <li>안쪽 endpoint에는 새 span을 담은 컨텍스트를 전달하므로 원격 호출 어댑터가 이를 헤더로 주입할 수 있음
 *   <li>트랜스포트 실패와 비즈니스 실패 모두 span 상태 ERROR
 *   <li>span이 유효하면 trace id를 MDC에 두어 안쪽 로그에 함께 찍힘
 * </ul>
 */
public class TracingMiddleware<Req, Res> implements EndpointMiddleware<Req, Res> {

  static final String ATTR_BUSINESS_ERROR = "endpoint.business_error";

  /** 로그 패턴의 {@code %X{trace_id}} */
  public static final String MDC_TRACE_ID = "trace_id";

  private final String operation;
  private final Tracer tracer;
  private final SpanKind spanKind;

  public TracingMiddleware(String operation, Tracer tracer, SpanKind spanKind) {
    this.operation = operation;
    this.tracer = tracer;
    this.spanKind = spanKind;
  }

  public static <Req, Res> TracingMiddleware<Req, Res> server(String operation, Tracer tracer) {
    return new TracingMiddleware<>(operation, tracer, SpanKind.SERVER);
  }

  public static <Req, Res> TracingMiddleware<Req, Res> client(String operation, Tracer tracer) {
    return new TracingMiddleware<>(operation, tracer, SpanKind.CLIENT);
  }

  @Override
  public Endpoint<Req, Res> wrap(Endpoint<Req, Res> next) {
    return (ctx, request) -> {
      Span span =
          tracer
              .spanBuilder(operation)
              .setParent(ctx.traceContext())
              .setSpanKind(spanKind)
              .startSpan();
      CallContext inner = ctx.withTraceContext(ctx.traceContext().with(span));
      String previousTraceId = MDC.get(MDC_TRACE_ID);
      if (span.getSpanContext().isValid()) {
        MDC.put(MDC_TRACE_ID, span.getSpanContext().getTraceId());
      }
      try (Scope ignored = span.makeCurrent()) {
        Outcome<Res> outcome = next.handle(inner, request);
        if (outcome.failed()) {
          span.setAttribute(ATTR_BUSINESS_ERROR, outcome.failure().getMessage());
          span.setStatus(StatusCode.ERROR, outcome.failure().getMessage());
        }
        return outcome;
      } catch (RuntimeException | Error e) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
        throw e;
      } finally {
        span.end();
        restoreTraceId(previousTraceId);
      }
    };
  }

  private static void restoreTraceId(String previous) {
    if (previous == null) {
      MDC.remove(MDC_TRACE_ID);
    } else {
      MDC.put(MDC_TRACE_ID, previous);
    }
  }
}
