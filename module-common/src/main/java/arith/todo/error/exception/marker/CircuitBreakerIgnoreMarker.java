package arith.todo.error.exception.marker;

/**
 * 서킷브레이커 실패 카운트에서 제외되는 예외를 표시합니다.
 *
 * <p>비즈니스 검증 실패, Rate Limit 초과처럼 하위 서비스의 건강 상태와 무관한 실패가 대상입니다.
 */
public interface CircuitBreakerIgnoreMarker {}
