package arith.todo.config;

import arith.todo.core.port.out.ToDoStore;
import arith.todo.core.service.ArithmeticToDoService;
import arith.todo.core.service.BasicArithmeticToDoService;
import arith.todo.endpoint.ArithmeticToDoEndpoints;
import arith.todo.endpoint.ServerEndpointFactory;
import arith.todo.infrastructure.mongodb.MongoToDoStore;
import arith.todo.infrastructure.mongodb.ToDoStoreHealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * 저장소 → 서비스 → 서버 endpoint 묶음 조립
 *
 * <p>{@link ArithmeticToDoEndpoints}도 서비스 계약을 구현하므로 로컬 서비스 빈을 {@code @Primary}로 둡니다.
 */
@Configuration
public class ServiceConfig {

  @Bean
  public MongoToDoStore mongoToDoStore(MongoTemplate mongoTemplate, StoreProperties properties) {
    return new MongoToDoStore(mongoTemplate, properties.collection());
  }

  @Bean
  public ToDoStoreHealthIndicator toDoStoreHealthIndicator(MongoToDoStore mongoToDoStore) {
    return new ToDoStoreHealthIndicator(mongoToDoStore);
  }

  @Bean
  @Primary
  public ArithmeticToDoService arithmeticToDoService(ToDoStore toDoStore) {
    return new BasicArithmeticToDoService(toDoStore);
  }

  @Bean
  public ArithmeticToDoEndpoints serverEndpoints(
      ArithmeticToDoService arithmeticToDoService, ServerEndpointFactory factory) {
    return factory.create(arithmeticToDoService);
  }
}
