package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.BaseException;
import lombok.Getter;

/**
 * 서킷이 OPEN(또는 HALF_OPEN 시험 호출 소진) 상태라 호출이 거부된 경우
 *
 * <p>하위 endpoint는 호출되지 않습니다.
 */
@Getter
public class CircuitOpenException extends BaseException {

  private final String operation;

  public CircuitOpenException(String operation) {
    super(CommonErrorCode.CIRCUIT_OPEN);
    this.operation = operation;
  }
}
