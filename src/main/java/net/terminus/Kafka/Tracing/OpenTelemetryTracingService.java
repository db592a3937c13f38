package net.terminus.Kafka.Tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapSetter;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.nio.charset.StandardCharsets;

/**
 * OpenTelemetry implementation of TracingService.
 *
 * Only instantiated when opentelemetry-api is on the classpath, so the rest of
 * the library never loads OpenTelemetry types directly.
 */
public class OpenTelemetryTracingService implements TracingService {

    private static final Logger logger = LoggerFactory.getLogger(OpenTelemetryTracingService.class);
    private static final String INSTRUMENTATION_NAME = "net.terminus.kafka";

    private static final TextMapSetter<Headers> HEADER_SETTER = (headers, key, value) -> {
        if (headers != null) {
            headers.remove(key);
            headers.add(key, value.getBytes(StandardCharsets.UTF_8));
        }
    };

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME, "0.1.0");
        logger.info("OpenTelemetryTracingService initialized - distributed tracing enabled");
    }

    @Override
    public TracingSpan startRedeliverySpan(String topic, @Nullable String messageId, int redeliveryCount, long delayMs) {
        Span span = tracer.spanBuilder("terminus.redelivery")
            .setSpanKind(SpanKind.INTERNAL)
            .startSpan();

        span.setAttribute("messaging.system", "kafka");
        span.setAttribute("messaging.destination", topic);
        span.setAttribute("terminus.component", "delivery-transport");
        span.setAttribute("terminus.redelivery.count", redeliveryCount);
        span.setAttribute("terminus.redelivery.delay_ms", delayMs);

        if (messageId != null) {
            span.setAttribute("terminus.message_id", messageId);
        }

        return new OpenTelemetryTracingSpan(span);
    }

    @Override
    public TracingSpan startDLQSpan(String originalTopic, String dlqTopic, @Nullable String messageId,
                                    int redeliveryCount, String reason) {
        Span span = tracer.spanBuilder("terminus.dlq.route")
            .setSpanKind(SpanKind.PRODUCER)
            .startSpan();

        span.setAttribute("messaging.system", "kafka");
        span.setAttribute("messaging.source_destination", originalTopic);
        span.setAttribute("messaging.destination", dlqTopic);
        span.setAttribute("terminus.component", "dead-letter-router");
        span.setAttribute("terminus.dlq.redelivery_count", redeliveryCount);
        span.setAttribute("terminus.dlq.reason", reason);

        if (messageId != null) {
            span.setAttribute("terminus.message_id", messageId);
        }

        return new OpenTelemetryTracingSpan(span);
    }

    @Override
    public void injectContext(Headers headers) {
        openTelemetry.getPropagators()
            .getTextMapPropagator()
            .inject(Context.current(), headers, HEADER_SETTER);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
