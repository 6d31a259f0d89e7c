package arith.todo.infrastructure.endpoint;

import arith.todo.error.exception.base.BaseException;
import java.util.function.Function;

/**
 * Endpoint 호출 결과: 응답 값 또는 비즈니스 실패 중 정확히 하나를 담습니다.
 *
 * <p>비즈니스 실패는 트랜스포트 계층이 응답 본문의 에러 envelope으로 직렬화합니다. 미들웨어 자체 실패(Rate Limit, Circuit Open)나 인프라
 * 실패는 여기에 담기지 않고 {@link Endpoint#handle} 에서 예외로 던져집니다.
 *
 * @param value 성공 시 응답 값
 * @param failure 비즈니스 실패, 성공이면 {@code null}
 */
public record Outcome<V>(V value, BaseException failure) {

  public Outcome {
    if (value != null && failure != null) {
      throw new IllegalArgumentException("Outcome cannot carry both a value and a failure");
    }
  }

  public static <V> Outcome<V> success(V value) {
    return new Outcome<>(value, null);
  }

  public static <V> Outcome<V> failure(BaseException failure) {
    if (failure == null) {
      throw new IllegalArgumentException("failure cannot be null");
    }
    return new Outcome<>(null, failure);
  }

  public boolean failed() {
    return failure != null;
  }

  /** 성공 값을 반환하고, 실패면 담긴 예외를 던집니다. */
  public V orElseThrow() {
    if (failure != null) {
      throw failure;
    }
    return value;
  }

  public <U> Outcome<U> map(Function<? super V, ? extends U> mapper) {
    if (failure != null) {
      return Outcome.failure(failure);
    }
    return Outcome.success(mapper.apply(value));
  }
}
