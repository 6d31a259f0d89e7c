package arith.todo.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenTelemetry 설정
 *
 * <h3>트레이싱 설정</h3>
 *
 * <ul>
 *   <li>{@code todo.tracing.enabled=true}: SDK + LoggingSpanExporter (span을 로그로 출력)
 *   <li>false: span은 no-op, W3C {@code traceparent} 전파만 유지
 * </ul>
 */
@Slf4j
@Configuration
public class OpenTelemetryConfig {

  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

  @Bean
  public OpenTelemetry openTelemetry(TracingProperties properties) {
    ContextPropagators propagators =
        ContextPropagators.create(W3CTraceContextPropagator.getInstance());
    if (!properties.enabled()) {
      log.info("[OpenTelemetry] tracing disabled, propagating context only");
      return OpenTelemetry.propagating(propagators);
    }

    log.info("[OpenTelemetry] tracing enabled: service={}", properties.serviceName());
    Resource resource =
        Resource.getDefault()
            .merge(Resource.create(Attributes.of(SERVICE_NAME, properties.serviceName())));
    SdkTracerProvider tracerProvider =
        SdkTracerProvider.builder()
            .setResource(resource)
            .addSpanProcessor(SimpleSpanProcessor.create(LoggingSpanExporter.create()))
            .build();
    return OpenTelemetrySdk.builder()
        .setTracerProvider(tracerProvider)
        .setPropagators(propagators)
        .build();
  }

  @Bean
  public Tracer endpointTracer(OpenTelemetry openTelemetry, TracingProperties properties) {
    return openTelemetry.getTracer(properties.serviceName());
  }
}
