package arith.todo.infrastructure.endpoint.middleware;

import arith.todo.error.exception.CircuitOpenException;
import arith.todo.error.exception.marker.CircuitBreakerIgnoreMarker;
import arith.todo.error.exception.marker.CircuitBreakerRecordMarker;
import arith.todo.infrastructure.endpoint.Endpoint;
import arith.todo.infrastructure.endpoint.EndpointMiddleware;
import arith.todo.infrastructure.endpoint.Outcome;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * operation별 서킷 브레이커 (Resilience4j)
 *
 * <h3>실패 분류</h3>
 *
 * <ul>
 *   <li>던져진 예외: 실패로 기록. 단 {@link CircuitBreakerIgnoreMarker} 구현체(비즈니스 에러, Rate Limit, 잘못된 식별자)는
 *       무시
 *   <li>{@link Outcome} 실패: {@link CircuitBreakerRecordMarker} 구현체만 실패, 나머지 비즈니스 실패는 성공으로 기록
 *   <li>두 마커를 모두 구현하면 무시가 우선
 * </ul>
 *
 * <p>OPEN 상태(또는 HALF_OPEN 시험 호출 소진)에서는 안쪽 endpoint를 호출하지 않고 {@link CircuitOpenException}을
 * 던집니다.
 */
@Slf4j
public class CircuitBreakerMiddleware<Req, Res> implements EndpointMiddleware<Req, Res> {

  private final CircuitBreaker circuitBreaker;

  public CircuitBreakerMiddleware(CircuitBreaker circuitBreaker) {
    this.circuitBreaker = circuitBreaker;
    circuitBreaker
        .getEventPublisher()
        .onStateTransition(
            event ->
                log.info(
                    "[CircuitBreaker:{}] state transition {}",
                    event.getCircuitBreakerName(),
                    event.getStateTransition()));
  }

  /**
   * 연속 실패 {@code failureThreshold}회에 OPEN되는 설정.
   *
   * <p>COUNT_BASED 윈도우 크기와 최소 호출 수를 임계값과 같게 두고 실패율 100%를 요구하므로, 최근 N번이 모두 실패해야 열립니다.
   */
  public static CircuitBreakerConfig consecutiveFailuresConfig(
      int failureThreshold, Duration waitDurationInOpenState, int permittedCallsInHalfOpen) {
    return CircuitBreakerConfig.custom()
        .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
        .slidingWindowSize(failureThreshold)
        .minimumNumberOfCalls(failureThreshold)
        .failureRateThreshold(100)
        .waitDurationInOpenState(waitDurationInOpenState)
        .permittedNumberOfCallsInHalfOpenState(permittedCallsInHalfOpen)
        .ignoreException(t -> t instanceof CircuitBreakerIgnoreMarker)
        .build();
  }

  @Override
  public Endpoint<Req, Res> wrap(Endpoint<Req, Res> next) {
    return (ctx, request) -> {
      if (!circuitBreaker.tryAcquirePermission()) {
        throw new CircuitOpenException(circuitBreaker.getName());
      }
      long start = System.nanoTime();
      Outcome<Res> outcome;
      try {
        outcome = next.handle(ctx, request);
      } catch (RuntimeException | Error e) {
        if (e instanceof CircuitBreakerIgnoreMarker) {
          circuitBreaker.releasePermission();
        } else {
          circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
        }
        throw e;
      }
      long elapsed = System.nanoTime() - start;
      if (outcome.failed() && recorded(outcome.failure())) {
        circuitBreaker.onError(elapsed, TimeUnit.NANOSECONDS, outcome.failure());
      } else {
        circuitBreaker.onSuccess(elapsed, TimeUnit.NANOSECONDS);
      }
      return outcome;
    };
  }

  private static boolean recorded(Throwable failure) {
    return failure instanceof CircuitBreakerRecordMarker
        && !(failure instanceof CircuitBreakerIgnoreMarker);
  }

  public CircuitBreaker.State state() {
    return circuitBreaker.getState();
  }
}
