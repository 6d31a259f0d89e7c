package arith.todo.infrastructure.mongodb;

import arith.todo.core.context.CallContext;
import arith.todo.error.exception.base.BaseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * To-do 저장소 Health Check (Actuator {@code /actuator/health})
 *
 * <p>Ping operation과 같은 경로로 저장소 도달 가능 여부를 확인합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class ToDoStoreHealthIndicator implements HealthIndicator {

  private final MongoToDoStore store;

  @Override
  public Health health() {
    try {
      store.ping(CallContext.background());
      return Health.up()
          .withDetail("collection", store.collection())
          .withDetail("status", "connected")
          .build();
    } catch (BaseException e) {
      log.warn("[ToDoStore] health check failed: {}", e.getMessage());
      return Health.down()
          .withDetail("collection", store.collection())
          .withDetail("status", "disconnected")
          .withDetail("error", e.getMessage())
          .build();
    }
  }
}
