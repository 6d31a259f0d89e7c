package arith.todo.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/** MongoDB 없이 애플리케이션을 띄우기 위한 저장소 교체 */
@TestConfiguration
public class InMemoryStoreConfig {

  @Bean
  @Primary
  public InMemoryToDoStore inMemoryToDoStore() {
    return new InMemoryToDoStore();
  }
}
