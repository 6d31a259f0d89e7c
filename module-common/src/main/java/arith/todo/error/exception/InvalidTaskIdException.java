package arith.todo.error.exception;

import arith.todo.error.CommonErrorCode;
import arith.todo.error.exception.base.ServerBaseException;
import arith.todo.error.exception.marker.CircuitBreakerIgnoreMarker;
import lombok.Getter;

/**
 * 저장소가 해석할 수 없는 task ID. 메시지는 식별자 파서의 원인 메시지입니다.
 *
 * <p>응답은 500이지만 호출자 입력 문제이므로 서킷 브레이커 실패로 집계하지 않습니다.
 */
@Getter
public class InvalidTaskIdException extends ServerBaseException
    implements CircuitBreakerIgnoreMarker {

  private final String taskId;

  public InvalidTaskIdException(String taskId, Throwable cause) {
    super(CommonErrorCode.INVALID_TASK_ID, cause, cause.getMessage());
    this.taskId = taskId;
  }
}
