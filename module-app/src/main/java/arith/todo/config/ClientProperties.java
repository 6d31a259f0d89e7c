package arith.todo.config;

import arith.todo.config.EndpointProperties.CircuitBreakerPolicy;
import arith.todo.config.EndpointProperties.RateLimit;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 원격 인스턴스 호출 설정
 *
 * <p>Rate Limit은 모든 operation이 하나의 버킷을 공유하고, 서킷 브레이커는 operation마다 따로 둡니다.
 *
 * @param instance 기본 원격 인스턴스 주소 (scheme 생략 가능)
 * @param timeout 호출 하나의 최대 대기 시간
 * @param rateLimit 공유 버킷 설정
 * @param circuitBreaker {@code operations}에 없는 operation의 브레이커 설정
 * @param operations operation 이름별 브레이커 설정
 */
@Validated
@ConfigurationProperties(prefix = "todo.client")
public record ClientProperties(
    String instance,
    @DefaultValue("5s") @NotNull Duration timeout,
    @DefaultValue @Valid @NotNull RateLimit rateLimit,
    @DefaultValue @Valid @NotNull CircuitBreakerPolicy circuitBreaker,
    Map<String, @Valid CircuitBreakerPolicy> operations) {

  public ClientProperties {
    operations = operations == null ? Map.of() : Map.copyOf(operations);
  }

  public CircuitBreakerPolicy circuitBreakerFor(String operationName) {
    return EndpointProperties.lookup(operations, operationName, circuitBreaker);
  }
}
