package arith.todo.error.exception.marker;

/** 서킷브레이커 실패 카운트에 포함되는 예외를 표시합니다 (저장소 장애, 원격 호출 실패 등). */
public interface CircuitBreakerRecordMarker {}
