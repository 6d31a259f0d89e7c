package arith.todo.error.dto;

import arith.todo.error.exception.base.BaseException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 에러 envelope: {@code {"error": "<message>"}}
 *
 * <p>non-200 응답의 유일한 본문 형식이며, 서버 encode와 클라이언트 decode 양쪽에서 사용합니다.
 */
public record ErrorResponse(@JsonProperty("error") String error) {

  public static ErrorResponse from(BaseException e) {
    return new ErrorResponse(e.getMessage());
  }

  public static ErrorResponse from(Throwable t) {
    String message = t.getMessage();
    return new ErrorResponse(message != null ? message : t.getClass().getSimpleName());
  }
}
