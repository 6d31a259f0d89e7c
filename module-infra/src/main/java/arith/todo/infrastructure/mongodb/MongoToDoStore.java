package arith.todo.infrastructure.mongodb;

import arith.todo.core.context.CallContext;
import arith.todo.core.port.out.ToDoStore;
import arith.todo.domain.model.todo.ToDoItem;
import arith.todo.error.exception.RequestCancelledException;
import arith.todo.error.exception.ToDoStoreException;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/**
 * MongoDB 기반 {@link ToDoStore}
 *
 * <h3>규칙</h3>
 *
 * <ul>
 *   <li>ID는 24자리 hex ObjectId. Complete/UnDo/Delete는 ID 파싱부터 수행하며 잘못된 ID는 {@link
 *       arith.todo.error.exception.InvalidTaskIdException}
 *   <li>형식은 맞지만 존재하지 않는 ID도 성공으로 간주하고 ID를 그대로 반환
 *   <li>모든 호출 전후로 {@link CallContext#ensureActive()} 확인, 조회는 남은 deadline을 {@code maxTime}으로 전달
 *   <li>Spring {@link DataAccessException}은 {@link ToDoStoreException}으로 변환
 * </ul>
 */
@Slf4j
public class MongoToDoStore implements ToDoStore {

  static final String FIELD_ID = "_id";
  static final String FIELD_STATUS = "status";

  private static final Duration NO_DEADLINE_MAX_TIME = Duration.ofSeconds(30);

  private final MongoTemplate mongoTemplate;
  private final String collection;

  public MongoToDoStore(MongoTemplate mongoTemplate, String collection) {
    this.mongoTemplate = mongoTemplate;
    this.collection = collection;
  }

  @Override
  public void ping(CallContext ctx) {
    execute(ctx, "Ping", () -> mongoTemplate.executeCommand(new Document("ping", 1)));
  }

  @Override
  public String insertToDo(CallContext ctx, ToDoItem item) {
    ToDoDocument saved =
        execute(ctx, "Insert", () -> mongoTemplate.insert(ToDoDocument.from(item), collection));
    return saved.getId().toHexString();
  }

  @Override
  public String completeToDo(CallContext ctx, String id) {
    return updateStatus(ctx, id, true);
  }

  @Override
  public String unDoToDo(CallContext ctx, String id) {
    return updateStatus(ctx, id, false);
  }

  @Override
  public String deleteToDo(CallContext ctx, String id) {
    ObjectId objectId = TaskIds.parse(id);
    execute(ctx, "Delete", () -> mongoTemplate.remove(byId(objectId), collection));
    return id;
  }

  @Override
  public List<ToDoItem> getAllToDo(CallContext ctx) {
    List<ToDoDocument> documents =
        execute(
            ctx,
            "FindAll",
            () -> {
              Query query = new Query().maxTime(ctx.remainingOr(NO_DEADLINE_MAX_TIME));
              return mongoTemplate.find(query, ToDoDocument.class, collection);
            });
    return documents.stream().map(ToDoDocument::toItem).toList();
  }

  private String updateStatus(CallContext ctx, String id, boolean status) {
    ObjectId objectId = TaskIds.parse(id);
    execute(
        ctx,
        status ? "Complete" : "UnDo",
        () ->
            mongoTemplate.updateFirst(
                byId(objectId), Update.update(FIELD_STATUS, status), collection));
    return id;
  }

  private static Query byId(ObjectId objectId) {
    return Query.query(Criteria.where(FIELD_ID).is(objectId));
  }

  private <T> T execute(CallContext ctx, String action, Supplier<T> command) {
    ctx.ensureActive();
    T result;
    try {
      result = command.get();
    } catch (QueryTimeoutException e) {
      log.warn("[ToDoStore] {} exceeded deadline: collection={}", action, collection);
      throw new RequestCancelledException();
    } catch (DataAccessException e) {
      log.error("[ToDoStore] {} failed: collection={}", action, collection, e);
      throw new ToDoStoreException(e.getMessage(), e);
    }
    ctx.ensureActive();
    return result;
  }

  String collection() {
    return collection;
  }
}
