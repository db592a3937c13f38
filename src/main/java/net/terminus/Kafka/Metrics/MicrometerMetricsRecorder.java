package net.terminus.Kafka.Metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import net.terminus.Kafka.CustomObject.ConsumerSettings;
import net.terminus.Kafka.CustomObject.DeadLetterReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Micrometer-based implementation of MetricsRecorder.
 * Every counter is tagged with client, tenant, namespace and topic.
 */
public class MicrometerMetricsRecorder implements MetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetricsRecorder.class);
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordAck(ConsumerSettings consumer) {
        try {
            counter(CONSUMER_ACKS, consumer, Tags.empty()).increment();
        } catch (Exception e) {
            logger.warn("failed to record ack metrics for topic {}: {}", consumer.getTopic(), e.getMessage());
        }
    }

    @Override
    public void recordRedelivery(ConsumerSettings consumer, int redeliveryCount) {
        try {
            counter(CONSUMER_REDELIVERIES, consumer, Tags.empty()).increment();
        } catch (Exception e) {
            logger.warn("failed to record redelivery metrics for topic {}: {}", consumer.getTopic(), e.getMessage());
        }
    }

    @Override
    public void recordTerm(ConsumerSettings consumer) {
        try {
            counter(CONSUMER_TERMS, consumer, Tags.empty()).increment();
        } catch (Exception e) {
            logger.warn("failed to record term metrics for topic {}: {}", consumer.getTopic(), e.getMessage());
        }
    }

    @Override
    public void recordDeadLetter(ConsumerSettings consumer, DeadLetterReason reason) {
        try {
            counter(CONSUMER_DLQ_MESSAGES, consumer, Tags.of("reason", reason.name())).increment();
        } catch (Exception e) {
            logger.warn("failed to record dlq metrics for topic {}: {}", consumer.getTopic(), e.getMessage());
        }
    }

    @Override
    public void recordRoutingFailure(ConsumerSettings consumer, Exception exception) {
        try {
            counter(CONSUMER_DLQ_ROUTING_FAILURES, consumer,
                    Tags.of("exception", exception.getClass().getSimpleName())).increment();
        } catch (Exception e) {
            logger.warn("failed to record routing failure metrics for topic {}: {}", consumer.getTopic(), e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private Counter counter(String name, ConsumerSettings consumer, Tags extra) {
        return Counter.builder(name)
                .tag("client", consumer.getClientId())
                .tag("tenant", consumer.getTenant())
                .tag("namespace", consumer.getNamespace())
                .tag("topic", consumer.getTopic())
                .tags(extra)
                .register(meterRegistry);
    }
}
