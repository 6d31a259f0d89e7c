package arith.todo.domain.model.todo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * To-do 항목
 *
 * <p>식별자는 저장소가 부여하므로 저장 전에는 {@code null}이며, 직렬화 시 생략됩니다.
 *
 * @param id 저장소가 부여한 불투명 식별자 (wire 필드명 {@code _id})
 * @param task 할 일 설명
 * @param status 완료 여부
 */
public record ToDoItem(
    @JsonProperty("_id") @JsonInclude(JsonInclude.Include.NON_NULL) String id,
    @JsonProperty("task") String task,
    @JsonProperty("status") boolean status) {

  /** 아직 저장되지 않은 항목 */
  public static ToDoItem unsaved(String task, boolean status) {
    return new ToDoItem(null, task, status);
  }

  public ToDoItem withId(String newId) {
    return new ToDoItem(newId, task, status);
  }

  public ToDoItem withStatus(boolean newStatus) {
    return new ToDoItem(id, task, newStatus);
  }
}
