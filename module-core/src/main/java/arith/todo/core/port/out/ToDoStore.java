package arith.todo.core.port.out;

import arith.todo.core.context.CallContext;
import arith.todo.domain.model.todo.ToDoItem;
import java.util.List;

/**
 * To-do 항목 영속화 포트
 *
 * <p>항목의 정본은 저장소가 소유하며, 서비스는 요청 처리 동안만 사본을 다룹니다. 구현체는 {@link CallContext#ensureActive()}로
 * 취소를 확인하고 블로킹 호출을 deadline 안에서 끝내야 합니다.
 *
 * <p>모든 메서드는 실패 시 {@link arith.todo.error.exception.base.BaseException} 계열 예외를 던집니다.
 */
public interface ToDoStore {

  /** 저장소 연결 확인. 도달할 수 없으면 예외를 던집니다. */
  void ping(CallContext ctx);

  /**
   * 새 항목 저장
   *
   * @return 저장소가 부여한 식별자
   */
  String insertToDo(CallContext ctx, ToDoItem item);

  /** 항목을 완료 상태로 변경하고 식별자를 그대로 반환 */
  String completeToDo(CallContext ctx, String id);

  /** 항목을 미완료 상태로 되돌리고 식별자를 그대로 반환 */
  String unDoToDo(CallContext ctx, String id);

  String deleteToDo(CallContext ctx, String id);

  List<ToDoItem> getAllToDo(CallContext ctx);
}
