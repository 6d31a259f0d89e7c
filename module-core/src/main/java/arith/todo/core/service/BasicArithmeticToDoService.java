package arith.todo.core.service;

import arith.todo.core.context.CallContext;
import arith.todo.core.port.out.ToDoStore;
import arith.todo.domain.model.todo.ToDoItem;
import arith.todo.error.exception.IntOverflowException;
import arith.todo.error.exception.MaxSizeExceededException;
import arith.todo.error.exception.TwoZeroesException;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * 기본 서비스 구현
 *
 * <p>연산 규칙만 담당하며 트랜스포트/횡단 관심사는 모릅니다. To-do 연산은 저장소 호출을 그대로 위임하고 저장소 예외도 변환 없이 전파합니다.
 */
@Slf4j
public class BasicArithmeticToDoService implements ArithmeticToDoService {

  /** Concat 결과 최대 길이 */
  public static final int MAX_CONCAT_LENGTH = 10;

  static final String STATUS_UP = "up";
  static final String STATUS_DOWN = "down";

  private final ToDoStore store;

  public BasicArithmeticToDoService(ToDoStore store) {
    this.store = Objects.requireNonNull(store, "store cannot be null");
  }

  @Override
  public int sum(CallContext ctx, long a, long b) {
    if (a == 0 && b == 0) {
      throw new TwoZeroesException();
    }
    try {
      return Math.toIntExact(Math.addExact(a, b));
    } catch (ArithmeticException e) {
      throw new IntOverflowException();
    }
  }

  @Override
  public String concat(CallContext ctx, String a, String b) {
    String left = a != null ? a : "";
    String right = b != null ? b : "";
    if (left.length() + right.length() > MAX_CONCAT_LENGTH) {
      throw new MaxSizeExceededException();
    }
    return left + right;
  }

  @Override
  public String ping(CallContext ctx) {
    try {
      store.ping(ctx);
      return STATUS_UP;
    } catch (RuntimeException e) {
      log.warn("[Ping] store unreachable: {}", e.getMessage());
      return STATUS_DOWN;
    }
  }

  @Override
  public String addToDo(CallContext ctx, ToDoItem item) {
    return store.insertToDo(ctx, ToDoItem.unsaved(item.task(), item.status()));
  }

  @Override
  public String completeToDo(CallContext ctx, String taskId) {
    return store.completeToDo(ctx, taskId);
  }

  @Override
  public String unDoToDo(CallContext ctx, String taskId) {
    return store.unDoToDo(ctx, taskId);
  }

  @Override
  public String deleteToDo(CallContext ctx, String taskId) {
    return store.deleteToDo(ctx, taskId);
  }

  @Override
  public List<ToDoItem> getAllToDo(CallContext ctx) {
    return store.getAllToDo(ctx);
  }
}
