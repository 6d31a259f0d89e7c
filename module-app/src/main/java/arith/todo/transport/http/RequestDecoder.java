package arith.todo.transport.http;

import arith.todo.error.exception.RequestDecodeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletException;
import java.io.IOException;
import java.util.function.Supplier;
import org.springframework.web.servlet.function.ServerRequest;

/**
 * HTTP 요청 → operation 요청 타입 변환
 *
 * @throws RequestDecodeException 본문을 읽거나 해석할 수 없는 경우, 본문이 JSON {@code null}인 경우
 */
@FunctionalInterface
public interface RequestDecoder<Req> {

  Req decode(ServerRequest request);

  /** JSON 본문을 {@code type}으로 해석. 파서 메시지를 그대로 에러 메시지로 사용합니다. */
  static <Req> RequestDecoder<Req> json(ObjectMapper objectMapper, Class<Req> type) {
    return request -> {
      byte[] body;
      try {
        body = request.body(byte[].class);
      } catch (IOException | ServletException e) {
        throw new RequestDecodeException(e.getMessage(), e);
      }
      Req decoded;
      try {
        decoded = objectMapper.readValue(body, type);
      } catch (JsonProcessingException e) {
        throw new RequestDecodeException(e.getOriginalMessage(), e);
      } catch (IOException e) {
        throw new RequestDecodeException(e.getMessage(), e);
      }
      if (decoded == null) {
        throw new RequestDecodeException("request body must be a JSON object", null);
      }
      return decoded;
    };
  }

  /** 본문이 없는 operation: 본문은 읽지 않고 빈 요청을 만듭니다. */
  static <Req> RequestDecoder<Req> ignoringBody(Supplier<Req> emptyRequest) {
    return request -> emptyRequest.get();
  }
}
