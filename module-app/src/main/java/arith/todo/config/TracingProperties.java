package arith.todo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param enabled false면 span을 만들지 않고 컨텍스트 전파만 수행
 * @param serviceName span resource의 {@code service.name}
 */
@ConfigurationProperties(prefix = "todo.tracing")
public record TracingProperties(
    @DefaultValue("false") boolean enabled, @DefaultValue("arith-todo") String serviceName) {}
