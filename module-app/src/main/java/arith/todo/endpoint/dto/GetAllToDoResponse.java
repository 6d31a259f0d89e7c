package arith.todo.endpoint.dto;

import arith.todo.domain.model.todo.ToDoItem;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** {@code {"todos": [{"_id", "task", "status"}]}} */
public record GetAllToDoResponse(@JsonProperty("todos") List<ToDoItem> todos) {

  public GetAllToDoResponse {
    todos = todos == null ? List.of() : List.copyOf(todos);
  }
}
