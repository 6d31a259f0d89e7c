package arith.todo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import arith.todo.core.context.CallContext;
import arith.todo.domain.model.todo.ToDoItem;
import arith.todo.endpoint.ArithmeticToDoEndpoints;
import arith.todo.error.exception.RemoteBusinessException;
import arith.todo.error.exception.RemoteServiceException;
import arith.todo.support.InMemoryStoreConfig;
import arith.todo.support.InMemoryToDoStore;
import arith.todo.transport.http.client.HttpClientTransport;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

/** 실제 HTTP 서버 + HTTP 클라이언트 트랜스포트로 왕복하는 시나리오 */
@Tag("integration")
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "todo.endpoint.operations.Sum.rate-limit.burst=100")
@Import(InMemoryStoreConfig.class)
@DisplayName("서버/클라이언트 왕복 E2E 테스트")
class ArithmeticToDoE2ETest {

  @LocalServerPort private int port;

  @Autowired private HttpClientTransport clientTransport;
  @Autowired private WebTestClient webTestClient;
  @Autowired private InMemoryToDoStore store;

  private ArithmeticToDoEndpoints client;

  @BeforeEach
  void setUp() {
    store.clear();
    client = clientTransport.connect("localhost:" + port);
  }

  @Nested
  @DisplayName("클라이언트 경유")
  class ViaClient {

    @Test
    @DisplayName("sum/concat/ping")
    void arithmetic() {
      CallContext ctx = CallContext.background();

      assertThat(client.sum(ctx, 2, 3)).isEqualTo(5);
      assertThat(client.concat(ctx, "ab", "cd")).isEqualTo("abcd");
      assertThat(client.ping(ctx)).isEqualTo("up");
    }

    @Test
    @DisplayName("0 + 0은 원격 비즈니스 에러")
    void two_zeroes() {
      assertThatThrownBy(() -> client.sum(CallContext.background(), 0, 0))
          .isInstanceOf(RemoteBusinessException.class)
          .hasMessage("can't sum two zeroes");
    }

    @Test
    @DisplayName("add → complete → getAll → unDo")
    void todo_lifecycle() {
      CallContext ctx = CallContext.background();

      // when
      String id = client.addToDo(ctx, ToDoItem.unsaved("write tests", false));
      assertThat(client.completeToDo(ctx, id)).isEqualTo(id);

      // then
      assertThat(id).matches("[0-9a-f]{24}");
      List<ToDoItem> todos = client.getAllToDo(ctx);
      assertThat(todos).containsExactly(new ToDoItem(id, "write tests", true));

      client.unDoToDo(ctx, id);
      assertThat(client.getAllToDo(ctx)).extracting(ToDoItem::status).containsExactly(false);
    }

    @Test
    @DisplayName("delete 후 목록에서 사라짐")
    void delete() {
      CallContext ctx = CallContext.background();
      String id = client.addToDo(ctx, ToDoItem.unsaved("temp", false));

      assertThat(client.deleteToDo(ctx, id)).isEqualTo(id);
      assertThat(client.getAllToDo(ctx)).isEmpty();
    }

    @Test
    @DisplayName("잘못된 식별자는 원격 서버 에러 (500)")
    void malformed_id() {
      assertThatThrownBy(() -> client.deleteToDo(CallContext.background(), "not-an-id"))
          .isInstanceOf(RemoteServiceException.class)
          .hasMessageContaining("invalid hexadecimal representation")
          .extracting("remoteStatus")
          .isEqualTo(500);
    }
  }

  @Nested
  @DisplayName("HTTP 직접 호출")
  class RawHttp {

    @Test
    @DisplayName("POST /sum 0,0 → 400 에러 envelope")
    void sum_two_zeroes() {
      webTestClient
          .post()
          .uri("/sum")
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue("{\"A\":0,\"B\":0}")
          .exchange()
          .expectStatus()
          .isBadRequest()
          .expectBody()
          .jsonPath("$.error")
          .isEqualTo("can't sum two zeroes");
    }

    @Test
    @DisplayName("소문자 필드명 허용")
    void sum_lower_case_fields() {
      webTestClient
          .post()
          .uri("/sum")
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue("{\"a\":2,\"b\":3}")
          .exchange()
          .expectStatus()
          .isOk()
          .expectBody()
          .jsonPath("$.v")
          .isEqualTo(5);
    }

    @Test
    @DisplayName("깨진 JSON → 500 에러 envelope")
    void malformed_json() {
      webTestClient
          .post()
          .uri("/concat")
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue("{\"a\":")
          .exchange()
          .expectStatus()
          .is5xxServerError()
          .expectBody()
          .jsonPath("$.error")
          .isNotEmpty();
    }

    @Test
    @DisplayName("10자를 넘는 concat → 400")
    void concat_too_long() {
      webTestClient
          .post()
          .uri("/concat")
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue("{\"a\":\"abcdef\",\"b\":\"ghijk\"}")
          .exchange()
          .expectStatus()
          .isBadRequest();
    }

    @Test
    @DisplayName("32비트를 넘는 피연산자도 합이 범위 안이면 200")
    void sum_wide_operands() {
      webTestClient
          .post()
          .uri("/sum")
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue("{\"A\":3000000000,\"B\":-1000000000}")
          .exchange()
          .expectStatus()
          .isOk()
          .expectBody()
          .jsonPath("$.v")
          .isEqualTo(2000000000);
    }

    @Test
    @DisplayName("null 본문이 반복돼도 브레이커가 열리지 않음")
    void null_body_does_not_open_breaker() {
      for (int i = 0; i < 10; i++) {
        webTestClient
            .post()
            .uri("/addToDo")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("null")
            .exchange()
            .expectStatus()
            .is5xxServerError()
            .expectBody()
            .jsonPath("$.error")
            .isEqualTo("request body must be a JSON object");
      }

      webTestClient
          .post()
          .uri("/addToDo")
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue("{\"task\":\"after nulls\",\"status\":false}")
          .exchange()
          .expectStatus()
          .isOk();
    }

    @Test
    @DisplayName("알려진 경로에 다른 메서드 → 405 에러 envelope")
    void wrong_method() {
      webTestClient
          .post()
          .uri("/ping")
          .exchange()
          .expectStatus()
          .isEqualTo(405)
          .expectBody()
          .jsonPath("$.error")
          .isEqualTo("method POST not allowed on /ping");
    }

    @Test
    @DisplayName("없는 경로 → 404 에러 envelope")
    void unknown_path() {
      webTestClient
          .get()
          .uri("/nope")
          .exchange()
          .expectStatus()
          .isNotFound()
          .expectBody()
          .jsonPath("$.error")
          .isEqualTo("no route for GET /nope");
    }

    @Test
    @DisplayName("GET /getAllToDo는 빈 목록을 todos 배열로 반환")
    void get_all_empty() {
      webTestClient
          .get()
          .uri("/getAllToDo")
          .exchange()
          .expectStatus()
          .isOk()
          .expectBody()
          .jsonPath("$.todos")
          .isArray();
    }
  }
}
