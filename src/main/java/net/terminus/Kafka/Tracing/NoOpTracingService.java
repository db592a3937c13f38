package net.terminus.Kafka.Tracing;

import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * No-op implementation of TracingService used when OpenTelemetry is not available
 * or tracing is switched off.
 */
public class NoOpTracingService implements TracingService {

    private static final Logger logger = LoggerFactory.getLogger(NoOpTracingService.class);

    public NoOpTracingService() {
        logger.info("tracing disabled - set terminus.kafka.tracing.enabled=true and add opentelemetry-api to enable it");
    }

    @Override
    public TracingSpan startRedeliverySpan(String topic, @Nullable String messageId, int redeliveryCount, long delayMs) {
        return NoOpTracingSpan.INSTANCE;
    }

    @Override
    public TracingSpan startDLQSpan(String originalTopic, String dlqTopic, @Nullable String messageId,
                                    int redeliveryCount, String reason) {
        return NoOpTracingSpan.INSTANCE;
    }

    @Override
    public void injectContext(Headers headers) {
        // No-op
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
