package net.terminus.Kafka.DeadLetter;

import net.terminus.Kafka.CustomObject.DeadLetterEnvelope;
import net.terminus.Kafka.CustomObject.TrackedMessage;

import java.time.Duration;

/**
 * Writes a dead letter to its destination and blocks until the broker confirms it.
 */
public interface DeadLetterProducer {

    /**
     * @param destination the dead-letter topic
     * @param message     the message being dead-lettered
     * @param envelope    the value and routing metadata to write
     * @param timeout     upper bound for the call
     * @throws net.terminus.Kafka.Errors.TransientDeliveryException if the write failed but may succeed on retry
     * @throws net.terminus.Kafka.Errors.DeliveryException if the write can never succeed
     * @throws net.terminus.Kafka.Errors.RoutingCancelledException if the calling thread was interrupted
     */
    void produce(String destination, TrackedMessage message, DeadLetterEnvelope<?> envelope, Duration timeout);
}
