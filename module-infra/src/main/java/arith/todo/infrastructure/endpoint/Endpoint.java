package arith.todo.infrastructure.endpoint;

import arith.todo.core.context.CallContext;
import arith.todo.error.exception.base.ClientBaseException;
import java.util.function.BiFunction;

/**
 * 하나의 operation을 감싸는 단일 호출 계약.
 *
 * <p>실패 채널은 두 가지입니다.
 *
 * <ul>
 *   <li><b>트랜스포트 실패</b>: {@code handle}이 던지는 예외. endpoint 조립/호출 자체의 실패(Rate Limit, Circuit Open, 저장소
 *       장애, decode 실패)이며 Operation Core 도달 전에 단락될 수 있습니다.
 *   <li><b>비즈니스 실패</b>: {@link Outcome#failure()}. 요청을 검증한 결과 처리할 수 없다고 판단된 경우이며 호출자에게 그대로
 *       전달됩니다.
 * </ul>
 *
 * @param <Req> operation 요청 타입
 * @param <Res> operation 응답 타입
 */
@FunctionalInterface
public interface Endpoint<Req, Res> {

  Outcome<Res> handle(CallContext ctx, Req request);

  /**
   * 서비스 메서드를 endpoint로 변환합니다.
   *
   * <p>{@link ClientBaseException}(비즈니스 에러)은 {@link Outcome} 실패로 회수하고, 그 밖의 예외는 트랜스포트 실패로 전파합니다.
   */
  static <Req, Res> Endpoint<Req, Res> fromOperation(
      BiFunction<CallContext, Req, Res> operation) {
    return (ctx, request) -> {
      try {
        return Outcome.success(operation.apply(ctx, request));
      } catch (ClientBaseException e) {
        return Outcome.failure(e);
      }
    };
  }
}
