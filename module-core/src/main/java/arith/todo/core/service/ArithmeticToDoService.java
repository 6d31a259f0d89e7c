package arith.todo.core.service;

import arith.todo.core.context.CallContext;
import arith.todo.domain.model.todo.ToDoItem;
import java.util.List;

/**
 * 연산 + To-do 서비스 계약
 *
 * <p>로컬 구현({@link BasicArithmeticToDoService})과 원격 endpoint 묶음이 같은 계약을 구현하므로, 호출부는 어느 쪽을
 * 사용하는지 알 필요가 없습니다.
 *
 * <p>비즈니스 검증 실패는 {@link arith.todo.error.exception.base.ClientBaseException}, 인프라 실패는 {@link
 * arith.todo.error.exception.base.ServerBaseException}으로 던집니다.
 */
public interface ArithmeticToDoService {

  /** 피연산자는 64비트로 받고, 합이 32비트 범위를 벗어나면 {@link arith.todo.error.exception.IntOverflowException}. */
  int sum(CallContext ctx, long a, long b);

  String concat(CallContext ctx, String a, String b);

  /** 저장소 상태. 예외를 던지지 않고 {@code "up"} 또는 {@code "down"}을 반환합니다. */
  String ping(CallContext ctx);

  String addToDo(CallContext ctx, ToDoItem item);

  String completeToDo(CallContext ctx, String taskId);

  String unDoToDo(CallContext ctx, String taskId);

  String deleteToDo(CallContext ctx, String taskId);

  List<ToDoItem> getAllToDo(CallContext ctx);
}
