package arith.todo.infrastructure.endpoint.middleware;

import arith.todo.infrastructure.endpoint.Endpoint;
import arith.todo.infrastructure.endpoint.EndpointMiddleware;
import arith.todo.infrastructure.endpoint.Outcome;
import lombok.extern.slf4j.Slf4j;

/**
 * 호출 완료 후 정확히 한 줄을 남기는 미들웨어.
 *
 * <p>성공은 INFO, 비즈니스 실패와 트랜스포트 실패는 WARN. 트랜스포트 실패는 예외를 함께 기록한 뒤 그대로 전파합니다.
 */
@Slf4j
public class LoggingMiddleware<Req, Res> implements EndpointMiddleware<Req, Res> {

  private final String operation;

  public LoggingMiddleware(String operation) {
    this.operation = operation;
  }

  @Override
  public Endpoint<Req, Res> wrap(Endpoint<Req, Res> next) {
    return (ctx, request) -> {
      long start = System.nanoTime();
      Outcome<Res> outcome;
      try {
        outcome = next.handle(ctx, request);
      } catch (RuntimeException | Error e) {
        log.warn(
            "[Endpoint:{}] request={} error={} took={}ms",
            operation,
            request,
            e.getMessage(),
            elapsedMillis(start),
            e);
        throw e;
      }
      if (outcome.failed()) {
        log.warn(
            "[Endpoint:{}] request={} error={} took={}ms",
            operation,
            request,
            outcome.failure().getMessage(),
            elapsedMillis(start));
      } else {
        log.info(
            "[Endpoint:{}] request={} response={} took={}ms",
            operation,
            request,
            outcome.value(),
            elapsedMillis(start));
      }
      return outcome;
    };
  }

  private static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
