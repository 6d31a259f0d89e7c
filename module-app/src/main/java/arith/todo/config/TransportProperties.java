package arith.todo.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * HTTP 서버 트랜스포트 설정
 *
 * @param requestTimeout 요청마다 {@link arith.todo.core.context.CallContext}에 붙는 deadline
 */
@Validated
@ConfigurationProperties(prefix = "todo.transport")
public record TransportProperties(@DefaultValue("10s") @NotNull Duration requestTimeout) {}
