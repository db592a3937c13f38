package net.terminus.Kafka.Dispatcher;

import net.terminus.Kafka.CustomObject.CancellationToken;
import net.terminus.Kafka.CustomObject.ConsumerSettings;
import net.terminus.Kafka.CustomObject.MessageRecord;
import net.terminus.Kafka.CustomObject.TrackedMessage;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * Application-facing side of a consumer. Every delivered message must end in
 * exactly one of {@link #ack}, {@link #nack} or {@link #term}.
 *
 * <pre>
 * &#64;KafkaListener(topics = "orders")
 * public void listen(ConsumerRecord&lt;String, Object&gt; record, Acknowledgment ack) {
 *     consumer.receive(record, ack).ifPresent(message -&gt; {
 *         try {
 *             process(message.getValue());
 *             consumer.ack(message);
 *         } catch (PoisonMessageException e) {
 *             consumer.term(message);
 *         } catch (Exception e) {
 *             consumer.nack(message);
 *         }
 *     });
 * }
 * </pre>
 */
public interface MessageConsumer {

    /**
     * Wraps and records a delivered Kafka record.
     *
     * @return the message to process, or empty when it duplicates a message
     *         that was already finalized (the duplicate has been acknowledged)
     */
    Optional<TrackedMessage> receive(ConsumerRecord<?, ?> record, @Nullable Acknowledgment acknowledgment);

    /**
     * Records a delivery of an already wrapped message.
     *
     * @return the message's record, or empty for a duplicate of a finalized message
     */
    Optional<MessageRecord> receive(TrackedMessage message);

    /**
     * Processing succeeded: finalize and acknowledge.
     */
    AckOutcome ack(TrackedMessage message);

    /**
     * Processing failed: schedule a redelivery, or dead-letter the message
     * once the redelivery maximum is exhausted.
     */
    default AckOutcome nack(TrackedMessage message) {
        return nack(message, CancellationToken.none());
    }

    AckOutcome nack(TrackedMessage message, CancellationToken token);

    /**
     * The message can never be processed: dead-letter it now, regardless of
     * how many redeliveries remain.
     *
     * @throws net.terminus.Kafka.Errors.InvalidConfigurationException if the consumer has no dead-letter topic
     */
    default AckOutcome term(TrackedMessage message) {
        return term(message, CancellationToken.none());
    }

    AckOutcome term(TrackedMessage message, CancellationToken token);

    ConsumerSettings getSettings();
}
