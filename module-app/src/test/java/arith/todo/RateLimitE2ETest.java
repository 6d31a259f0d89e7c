package arith.todo;

import arith.todo.support.InMemoryStoreConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

@Tag("integration")
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
      "todo.endpoint.operations.Concat.rate-limit.burst=1",
      "todo.endpoint.operations.Concat.rate-limit.rate=1",
      "todo.endpoint.operations.Concat.rate-limit.period=1h"
    })
@Import(InMemoryStoreConfig.class)
@DisplayName("서버 Rate Limit E2E 테스트")
class RateLimitE2ETest {

  @Autowired private WebTestClient webTestClient;

  private WebTestClient.ResponseSpec concat() {
    return webTestClient
        .post()
        .uri("/concat")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("{\"a\":\"x\",\"b\":\"y\"}")
        .exchange();
  }

  @Test
  @DisplayName("버스트를 넘는 호출은 429 + 에러 envelope")
  void second_call_is_rejected() {
    concat().expectStatus().isOk().expectBody().jsonPath("$.v").isEqualTo("xy");

    concat()
        .expectStatus()
        .isEqualTo(429)
        .expectBody()
        .jsonPath("$.error")
        .isEqualTo("rate limit exceeded");
  }

  @Test
  @DisplayName("다른 operation은 영향을 받지 않음")
  void other_operations_unaffected() {
    webTestClient.get().uri("/ping").exchange().expectStatus().isOk();
    webTestClient.get().uri("/ping").exchange().expectStatus().isOk();
  }
}
