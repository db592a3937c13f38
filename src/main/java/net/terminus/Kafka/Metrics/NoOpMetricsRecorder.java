package net.terminus.Kafka.Metrics;

import net.terminus.Kafka.CustomObject.ConsumerSettings;
import net.terminus.Kafka.CustomObject.DeadLetterReason;

/**
 * No-Op implementation of MetricsRecorder.
 * Used when Micrometer is not available to avoid overhead and dependency
 * issues.
 */
public class NoOpMetricsRecorder implements MetricsRecorder {

    @Override
    public void recordAck(ConsumerSettings consumer) {
        // No-Op
    }

    @Override
    public void recordRedelivery(ConsumerSettings consumer, int redeliveryCount) {
        // No-Op
    }

    @Override
    public void recordTerm(ConsumerSettings consumer) {
        // No-Op
    }

    @Override
    public void recordDeadLetter(ConsumerSettings consumer, DeadLetterReason reason) {
        // No-Op
    }

    @Override
    public void recordRoutingFailure(ConsumerSettings consumer, Exception exception) {
        // No-Op
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
