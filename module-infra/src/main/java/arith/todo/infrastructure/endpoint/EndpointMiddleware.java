package arith.todo.infrastructure.endpoint;

/**
 * Endpoint 데코레이터: 같은 입출력 형태의 endpoint를 돌려주므로 임의 순서로 쌓을 수 있습니다.
 *
 * <p>바깥쪽 미들웨어는 안쪽 미들웨어가 만든 실패를 관찰합니다.
 */
@FunctionalInterface
public interface EndpointMiddleware<Req, Res> {

  Endpoint<Req, Res> wrap(Endpoint<Req, Res> next);
}
