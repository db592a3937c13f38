package net.terminus.Kafka.Transport;

import net.terminus.Kafka.CustomObject.TrackedMessage;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * The consumer's link to the broker: turns records into tracked messages,
 * acknowledges them and hands them back for delayed redelivery.
 */
public interface DeliveryTransport {

    /**
     * Wraps a delivered record, reading the redelivery metadata it carries.
     *
     * @param record         the delivered record
     * @param acknowledgment the listener container's ack handle, null when the container auto-commits
     * @return the tracked message
     */
    TrackedMessage receive(ConsumerRecord<?, ?> record, @Nullable Acknowledgment acknowledgment);

    /**
     * Acknowledges the source record so the broker will not redeliver it.
     *
     * @param message the message to acknowledge
     * @throws net.terminus.Kafka.Errors.TransientDeliveryException if the acknowledgment fails
     */
    void sendAck(TrackedMessage message);

    /**
     * Schedules the message for redelivery after the given delay.
     *
     * @param message         the message to redeliver
     * @param redeliveryCount the count the redelivered copy should carry
     * @param delay           how long to wait before redelivering
     */
    void sendNack(TrackedMessage message, int redeliveryCount, Duration delay);
}
