package arith.todo.endpoint;

import arith.todo.core.context.CallContext;
import arith.todo.core.service.ArithmeticToDoService;
import arith.todo.domain.model.todo.ToDoItem;
import arith.todo.endpoint.dto.AddToDoRequest;
import arith.todo.endpoint.dto.AddToDoResponse;
import arith.todo.endpoint.dto.CompleteToDoRequest;
import arith.todo.endpoint.dto.CompleteToDoResponse;
import arith.todo.endpoint.dto.ConcatRequest;
import arith.todo.endpoint.dto.ConcatResponse;
import arith.todo.endpoint.dto.DeleteToDoRequest;
import arith.todo.endpoint.dto.DeleteToDoResponse;
import arith.todo.endpoint.dto.GetAllToDoRequest;
import arith.todo.endpoint.dto.GetAllToDoResponse;
import arith.todo.endpoint.dto.PingRequest;
import arith.todo.endpoint.dto.PingResponse;
import arith.todo.endpoint.dto.SumRequest;
import arith.todo.endpoint.dto.SumResponse;
import arith.todo.endpoint.dto.UnDoToDoRequest;
import arith.todo.endpoint.dto.UnDoToDoResponse;
import arith.todo.infrastructure.endpoint.Endpoint;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * operation별 endpoint 묶음
 *
 * <p>서비스 계약도 함께 구현하므로, 원격 endpoint로 만든 묶음은 로컬 서비스를 그대로 대체합니다. {@link
 * arith.todo.infrastructure.endpoint.Outcome} 실패는 서비스 메서드에서 다시 예외로 던집니다.
 */
@Getter
@Builder(toBuilder = true)
public class ArithmeticToDoEndpoints implements ArithmeticToDoService {

  @NonNull private final Endpoint<SumRequest, SumResponse> sumEndpoint;
  @NonNull private final Endpoint<ConcatRequest, ConcatResponse> concatEndpoint;
  @NonNull private final Endpoint<PingRequest, PingResponse> pingEndpoint;
  @NonNull private final Endpoint<AddToDoRequest, AddToDoResponse> addToDoEndpoint;
  @NonNull private final Endpoint<CompleteToDoRequest, CompleteToDoResponse> completeToDoEndpoint;
  @NonNull private final Endpoint<UnDoToDoRequest, UnDoToDoResponse> unDoToDoEndpoint;
  @NonNull private final Endpoint<DeleteToDoRequest, DeleteToDoResponse> deleteToDoEndpoint;
  @NonNull private final Endpoint<GetAllToDoRequest, GetAllToDoResponse> getAllToDoEndpoint;

  /** 서비스 메서드를 그대로 감싼 (미들웨어 없는) endpoint 묶음 */
  public static ArithmeticToDoEndpoints fromService(ArithmeticToDoService service) {
    return ArithmeticToDoEndpoints.builder()
        .sumEndpoint(
            Endpoint.fromOperation(
                (ctx, req) -> new SumResponse(service.sum(ctx, req.a(), req.b()))))
        .concatEndpoint(
            Endpoint.fromOperation(
                (ctx, req) -> new ConcatResponse(service.concat(ctx, req.a(), req.b()))))
        .pingEndpoint(Endpoint.fromOperation((ctx, req) -> new PingResponse(service.ping(ctx))))
        .addToDoEndpoint(
            Endpoint.fromOperation(
                (ctx, req) ->
                    new AddToDoResponse(
                        service.addToDo(ctx, ToDoItem.unsaved(req.task(), req.status())))))
        .completeToDoEndpoint(
            Endpoint.fromOperation(
                (ctx, req) -> new CompleteToDoResponse(service.completeToDo(ctx, req.taskId()))))
        .unDoToDoEndpoint(
            Endpoint.fromOperation(
                (ctx, req) -> new UnDoToDoResponse(service.unDoToDo(ctx, req.taskId()))))
        .deleteToDoEndpoint(
            Endpoint.fromOperation(
                (ctx, req) -> new DeleteToDoResponse(service.deleteToDo(ctx, req.taskId()))))
        .getAllToDoEndpoint(
            Endpoint.fromOperation(
                (ctx, req) -> new GetAllToDoResponse(service.getAllToDo(ctx))))
        .build();
  }

  @Override
  public int sum(CallContext ctx, long a, long b) {
    return sumEndpoint.handle(ctx, new SumRequest(a, b)).orElseThrow().v();
  }

  @Override
  public String concat(CallContext ctx, String a, String b) {
    return concatEndpoint.handle(ctx, new ConcatRequest(a, b)).orElseThrow().v();
  }

  @Override
  public String ping(CallContext ctx) {
    return pingEndpoint.handle(ctx, new PingRequest()).orElseThrow().v();
  }

  @Override
  public String addToDo(CallContext ctx, ToDoItem item) {
    return addToDoEndpoint
        .handle(ctx, new AddToDoRequest(item.task(), item.status()))
        .orElseThrow()
        .taskId();
  }

  @Override
  public String completeToDo(CallContext ctx, String taskId) {
    return completeToDoEndpoint.handle(ctx, new CompleteToDoRequest(taskId)).orElseThrow().taskId();
  }

  @Override
  public String unDoToDo(CallContext ctx, String taskId) {
    return unDoToDoEndpoint.handle(ctx, new UnDoToDoRequest(taskId)).orElseThrow().taskId();
  }

  @Override
  public String deleteToDo(CallContext ctx, String taskId) {
    return deleteToDoEndpoint.handle(ctx, new DeleteToDoRequest(taskId)).orElseThrow().taskId();
  }

  @Override
  public List<ToDoItem> getAllToDo(CallContext ctx) {
    return getAllToDoEndpoint.handle(ctx, new GetAllToDoRequest()).orElseThrow().todos();
  }
}
