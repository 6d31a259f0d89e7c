package arith.todo.infrastructure.endpoint.middleware;

import arith.todo.infrastructure.endpoint.Endpoint;
import arith.todo.infrastructure.endpoint.EndpointMiddleware;
import arith.todo.infrastructure.endpoint.Outcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

/**
 * 호출 단위 메트릭 미들웨어 (Micrometer)
 *
 * <ul>
 *   <li>{@code endpoint.request.duration}: 호출 시작부터 반환까지, 태그 {@code method}, {@code error}
 *   <li>선택적 카운터: 성공 응답에서 값을 뽑아 누적 (예: 합산된 정수 총량, 연결된 문자 수)
 * </ul>
 *
 * <p>호출당 정확히 한 번 기록합니다.
 */
public class InstrumentingMiddleware<Req, Res> implements EndpointMiddleware<Req, Res> {

  public static final String REQUEST_DURATION = "endpoint.request.duration";

  private record Contribution<R>(Counter counter, ToDoubleFunction<R> amount) {}

  private final String operation;
  private final MeterRegistry meterRegistry;
  private final List<Contribution<Res>> contributions = new ArrayList<>();

  public InstrumentingMiddleware(String operation, MeterRegistry meterRegistry) {
    this.operation = operation;
    this.meterRegistry = meterRegistry;
  }

  /**
   * 성공 응답마다 {@code amount}만큼 증가하는 카운터를 추가합니다.
   *
   * <p>카운터는 감소할 수 없으므로 음수 기여는 절대값으로 누적합니다.
   */
  public InstrumentingMiddleware<Req, Res> counting(
      String counterName, ToDoubleFunction<Res> amount) {
    Counter counter = Counter.builder(counterName).tag("method", operation).register(meterRegistry);
    contributions.add(new Contribution<>(counter, amount));
    return this;
  }

  @Override
  public Endpoint<Req, Res> wrap(Endpoint<Req, Res> next) {
    return (ctx, request) -> {
      long start = System.nanoTime();
      boolean error = true;
      try {
        Outcome<Res> outcome = next.handle(ctx, request);
        error = outcome.failed();
        if (!error) {
          for (Contribution<Res> c : contributions) {
            c.counter().increment(Math.abs(c.amount().applyAsDouble(outcome.value())));
          }
        }
        return outcome;
      } finally {
        Timer.builder(REQUEST_DURATION)
            .tag("method", operation)
            .tag("error", Boolean.toString(error))
            .publishPercentileHistogram()
            .register(meterRegistry)
            .record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
      }
    };
  }
}
