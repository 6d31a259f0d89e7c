package arith.todo.infrastructure.mongodb;

import arith.todo.domain.model.todo.ToDoItem;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * To-do 컬렉션 문서: {@code {_id: ObjectId, task: string, status: bool}}
 *
 * <p>컬렉션 이름은 설정값이므로 {@code @Document}로 고정하지 않고 {@link MongoToDoStore}가 호출마다 지정합니다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ToDoDocument {

  @Id private ObjectId id;

  @Field("task")
  private String task;

  @Field("status")
  private boolean status;

  public static ToDoDocument from(ToDoItem item) {
    return new ToDoDocument(null, item.task(), item.status());
  }

  public ToDoItem toItem() {
    return new ToDoItem(id != null ? id.toHexString() : null, task, status);
  }
}
