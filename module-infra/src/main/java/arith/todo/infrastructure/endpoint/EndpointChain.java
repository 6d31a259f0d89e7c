package arith.todo.infrastructure.endpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 미들웨어를 순서대로 보관하는 불변 체인.
 *
 * <h3>순서 규칙</h3>
 *
 * <ul>
 *   <li>등록 순서 = 바깥쪽 → 안쪽 (첫 번째 미들웨어가 가장 먼저 요청을 받음)
 *   <li>{@link #decorate(Endpoint)}는 안쪽부터 접어 올리며, 조립 시점에 한 번만 수행됩니다.
 * </ul>
 *
 * <pre>{@code
 * Endpoint<SumRequest, SumResponse> sum =
 *     EndpointChain.<SumRequest, SumResponse>builder()
 *         .then(tracing)
 *         .then(logging)
 *         .then(instrumenting)
 *         .then(circuitBreaker)
 *         .then(rateLimiting)
 *         .build()
 *         .decorate(core);
 * }</pre>
 */
public final class EndpointChain<Req, Res> {

  private final List<EndpointMiddleware<Req, Res>> middlewares;

  public EndpointChain(List<EndpointMiddleware<Req, Res>> middlewares) {
    Objects.requireNonNull(middlewares, "middlewares must not be null");
    for (int i = 0; i < middlewares.size(); i++) {
      Objects.requireNonNull(middlewares.get(i), "middlewares[" + i + "] is null");
    }
    this.middlewares = List.copyOf(middlewares);
  }

  public static <Req, Res> Builder<Req, Res> builder() {
    return new Builder<>();
  }

  public Endpoint<Req, Res> decorate(Endpoint<Req, Res> core) {
    Objects.requireNonNull(core, "core endpoint must not be null");
    Endpoint<Req, Res> current = core;
    for (int i = middlewares.size() - 1; i >= 0; i--) {
      current = Objects.requireNonNull(middlewares.get(i).wrap(current), "wrap() returned null");
    }
    return current;
  }

  public int size() {
    return middlewares.size();
  }

  public static final class Builder<Req, Res> {

    private final List<EndpointMiddleware<Req, Res>> middlewares = new ArrayList<>();

    private Builder() {}

    /** 현재 체인의 안쪽에 미들웨어를 추가합니다. */
    public Builder<Req, Res> then(EndpointMiddleware<Req, Res> middleware) {
      middlewares.add(middleware);
      return this;
    }

    public EndpointChain<Req, Res> build() {
      return new EndpointChain<>(middlewares);
    }
  }
}
