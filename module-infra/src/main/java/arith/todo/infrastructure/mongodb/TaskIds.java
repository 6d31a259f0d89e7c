package arith.todo.infrastructure.mongodb;

import arith.todo.error.exception.InvalidTaskIdException;
import org.bson.types.ObjectId;

/** task ID(24자리 hex 문자열) ↔ {@link ObjectId} 변환 */
final class TaskIds {

  private TaskIds() {}

  /**
   * @throws InvalidTaskIdException hex 문자열이 ObjectId 형식이 아닌 경우 (드라이버 파서 메시지 유지)
   */
  static ObjectId parse(String taskId) {
    try {
      return new ObjectId(taskId);
    } catch (IllegalArgumentException e) {
      throw new InvalidTaskIdException(taskId, e);
    }
  }
}
