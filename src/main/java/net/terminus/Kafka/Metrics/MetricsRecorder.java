package net.terminus.Kafka.Metrics;

import net.terminus.Kafka.CustomObject.ConsumerSettings;
import net.terminus.Kafka.CustomObject.DeadLetterReason;

/**
 * Interface responsible for recording consumer metrics.
 * Decouples the library from specific metrics implementations like Micrometer.
 */
public interface MetricsRecorder {

    String CONSUMER_TERMS = "consumer_terms";
    String CONSUMER_DLQ_MESSAGES = "consumer_dlq_messages";
    String CONSUMER_REDELIVERIES = "consumer_redeliveries";
    String CONSUMER_ACKS = "consumer_acks";
    String CONSUMER_DLQ_ROUTING_FAILURES = "consumer_dlq_routing_failures";

    /**
     * Records a natural acknowledgment.
     *
     * @param consumer the consumer that acked
     */
    void recordAck(ConsumerSettings consumer);

    /**
     * Records a nack that scheduled a redelivery.
     *
     * @param consumer        the consumer that nacked
     * @param redeliveryCount the redelivery count after the nack
     */
    void recordRedelivery(ConsumerSettings consumer, int redeliveryCount);

    /**
     * Records a successful term call. Called once per term, after routing succeeded.
     *
     * @param consumer the consumer that called term
     */
    void recordTerm(ConsumerSettings consumer);

    /**
     * Records a message routed to the dead-letter topic.
     *
     * @param consumer the consumer that routed it
     * @param reason   why it was routed
     */
    void recordDeadLetter(ConsumerSettings consumer, DeadLetterReason reason);

    /**
     * Records a dead-letter routing attempt that left the message pending.
     *
     * @param consumer  the consumer that attempted routing
     * @param exception the failure
     */
    void recordRoutingFailure(ConsumerSettings consumer, Exception exception);

    /**
     * Checks if metrics recording is available.
     *
     * @return true if metrics recording is enabled and available
     */
    boolean isAvailable();
}
