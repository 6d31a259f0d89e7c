package arith.todo.endpoint;

import lombok.AccessLevel;
import lombok.Getter;
import org.springframework.http.HttpMethod;

/**
 * 노출되는 operation 목록 (빌드 시점에 고정)
 *
 * <p>이름은 로그 태그, 메트릭 {@code method} 태그, span 이름, 설정 키({@code todo.endpoint.operations.<name>})로
 * 쓰입니다.
 */
@Getter
public enum Operation {
  SUM("Sum", HttpMethod.POST, "/sum", true),
  CONCAT("Concat", HttpMethod.POST, "/concat", true),
  PING("Ping", HttpMethod.GET, "/ping", false),
  ADD_TO_DO("AddToDo", HttpMethod.POST, "/addToDo", true),
  COMPLETE_TO_DO("CompleteToDo", HttpMethod.PUT, "/completeToDo", true),
  UN_DO_TO_DO("UnDoToDo", HttpMethod.PUT, "/unDoToDo", true),
  DELETE_TO_DO("DeleteToDo", HttpMethod.DELETE, "/deleteToDo", true),
  GET_ALL_TO_DO("GetAllToDo", HttpMethod.GET, "/getAllToDo", false);

  private final String operationName;
  private final HttpMethod httpMethod;
  private final String path;

  /** false면 요청 본문을 보내지도 읽지도 않음 */
  @Getter(AccessLevel.NONE)
  private final boolean requestBody;

  Operation(String operationName, HttpMethod httpMethod, String path, boolean requestBody) {
    this.operationName = operationName;
    this.httpMethod = httpMethod;
    this.path = path;
    this.requestBody = requestBody;
  }

  public boolean hasRequestBody() {
    return requestBody;
  }
}
