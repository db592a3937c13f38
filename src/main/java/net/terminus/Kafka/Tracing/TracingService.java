package net.terminus.Kafka.Tracing;

import org.apache.kafka.common.header.Headers;
import org.springframework.lang.Nullable;

/**
 * Interface for tracing operations in the terminus library.
 *
 * This interface allows OpenTelemetry to be an optional dependency.
 * When OpenTelemetry is on the classpath, the real implementation (OpenTelemetryTracingService)
 * is used. When OpenTelemetry is absent, a no-op implementation (NoOpTracingService) is used.
 *
 * All span objects are wrapped in TracingSpan to avoid exposing OpenTelemetry types
 * in the interface.
 */
public interface TracingService {

    /**
     * Creates a new span for scheduling a redelivery.
     *
     * @param topic           the source topic
     * @param messageId       the message id (optional)
     * @param redeliveryCount the redelivery count after the nack
     * @param delayMs         the redelivery delay in milliseconds
     * @return a TracingSpan wrapper
     */
    TracingSpan startRedeliverySpan(String topic, @Nullable String messageId, int redeliveryCount, long delayMs);

    /**
     * Creates a new span for dead-letter routing.
     *
     * @param originalTopic   the source topic
     * @param dlqTopic        the dead-letter topic
     * @param messageId       the message id (optional)
     * @param redeliveryCount the redelivery count at routing time
     * @param reason          the reason for routing
     * @return a TracingSpan wrapper
     */
    TracingSpan startDLQSpan(String originalTopic, String dlqTopic, @Nullable String messageId,
                             int redeliveryCount, String reason);

    /**
     * Injects the current trace context into Kafka headers.
     *
     * @param headers the Kafka headers to inject into
     */
    void injectContext(Headers headers);

    /**
     * Checks if tracing is enabled (i.e., OpenTelemetry is available).
     *
     * @return true if tracing is enabled, false for no-op implementation
     */
    boolean isEnabled();
}
