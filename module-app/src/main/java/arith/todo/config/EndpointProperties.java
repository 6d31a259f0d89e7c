package arith.todo.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 서버 endpoint 미들웨어 설정
 *
 * <h3>application.yml 설정 예시</h3>
 *
 * <pre>
 * todo:
 *   endpoint:
 *     defaults:
 *       rate-limit: { rate: 1, period: 1s, burst: 100 }
 *       circuit-breaker: { failure-threshold: 6, wait-duration: 60s, permitted-calls-in-half-open: 1 }
 *     operations:
 *       Sum:
 *         rate-limit: { rate: 1, period: 1s, burst: 1 }
 * </pre>
 *
 * @param defaults {@code operations}에 없는 operation에 적용
 * @param operations operation 이름별 설정
 */
@Validated
@ConfigurationProperties(prefix = "todo.endpoint")
public record EndpointProperties(
    @DefaultValue @Valid @NotNull OperationPolicy defaults,
    Map<String, @Valid OperationPolicy> operations) {

  public EndpointProperties {
    operations = operations == null ? Map.of() : Map.copyOf(operations);
  }

  /** operation 이름은 대소문자를 구분하지 않습니다. */
  public OperationPolicy policyFor(String operationName) {
    return lookup(operations, operationName, defaults);
  }

  static <T> T lookup(Map<String, T> byName, String operationName, T fallback) {
    T exact = byName.get(operationName);
    if (exact != null) {
      return exact;
    }
    return byName.entrySet().stream()
        .filter(e -> e.getKey().equalsIgnoreCase(operationName))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(fallback);
  }

  public record OperationPolicy(
      @DefaultValue @Valid @NotNull RateLimit rateLimit,
      @DefaultValue @Valid @NotNull CircuitBreakerPolicy circuitBreaker) {}

  /**
   * 토큰 버킷 설정
   *
   * @param rate {@code period}마다 채워지는 토큰 수
   * @param period 리필 주기
   * @param burst 버킷 용량
   */
  public record RateLimit(
      @DefaultValue("1") @Min(1) long rate,
      @DefaultValue("1s") @NotNull Duration period,
      @DefaultValue("100") @Min(1) long burst) {}

  /**
   * @param failureThreshold 이 횟수만큼 연속 실패하면 OPEN
   * @param waitDuration OPEN 유지 시간
   * @param permittedCallsInHalfOpen HALF_OPEN에서 허용하는 시험 호출 수
   */
  public record CircuitBreakerPolicy(
      @DefaultValue("6") @Min(1) int failureThreshold,
      @DefaultValue("60s") @NotNull Duration waitDuration,
      @DefaultValue("1") @Min(1) int permittedCallsInHalfOpen) {}
}
