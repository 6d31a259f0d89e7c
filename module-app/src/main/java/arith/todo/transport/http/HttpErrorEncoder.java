package arith.todo.transport.http;

import arith.todo.error.dto.ErrorResponse;
import arith.todo.error.exception.base.BaseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * 실패 → 에러 envelope 응답 변환
 *
 * <p>상태 코드는 예외 인스턴스가 아닌 에러 종류({@link arith.todo.error.ErrorCode})로 결정되며, {@link BaseException}이
 * 아닌 예외는 모두 500입니다. 본문은 항상 {@code {"error": "<message>"}}.
 */
@Slf4j
@Component
public class HttpErrorEncoder {

  public static HttpStatus statusOf(Throwable error) {
    if (error instanceof BaseException be) {
      return be.getErrorCode().getStatus();
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  public ServerResponse encode(Throwable error) {
    HttpStatus status = statusOf(error);
    if (!(error instanceof BaseException)) {
      log.error("[HttpTransport] unclassified failure mapped to {}", status.value(), error);
    }
    return ServerResponse.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(ErrorResponse.from(error));
  }
}
