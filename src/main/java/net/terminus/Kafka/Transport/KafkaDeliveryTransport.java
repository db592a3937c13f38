package net.terminus.Kafka.Transport;

import net.terminus.Kafka.CustomObject.ConsumerSettings;
import net.terminus.Kafka.CustomObject.DLQPolicy;
import net.terminus.Kafka.CustomObject.TrackedMessage;
import net.terminus.Kafka.Errors.TransientDeliveryException;
import net.terminus.Kafka.Tracing.TracingService;
import net.terminus.Kafka.Tracing.TracingSpan;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Kafka has no per-message nack, so a redelivery is a republish: after the
 * delay the value is sent again with the redelivery headers and the source
 * record is acknowledged once the broker has the copy.
 */
public class KafkaDeliveryTransport implements DeliveryTransport {

    private static final Logger logger = LoggerFactory.getLogger(KafkaDeliveryTransport.class);

    private final ConsumerSettings settings;
    private final KafkaTemplate<Object, Object> kafkaTemplate;
    private final TaskScheduler taskScheduler;
    private final TracingService tracingService;

    @SuppressWarnings("unchecked")
    public KafkaDeliveryTransport(ConsumerSettings settings,
                                  KafkaTemplate<?, ?> kafkaTemplate,
                                  TaskScheduler taskScheduler,
                                  TracingService tracingService) {
        this.settings = settings;
        this.kafkaTemplate = (KafkaTemplate<Object, Object>) kafkaTemplate;
        this.taskScheduler = taskScheduler;
        this.tracingService = tracingService;
    }

    @Override
    public TrackedMessage receive(ConsumerRecord<?, ?> record, @Nullable Acknowledgment acknowledgment) {
        return TrackedMessage.builder()
                .messageId(HeaderUtils.messageIdOf(record))
                .topic(record.topic())
                .partition(record.partition())
                .offset(record.offset())
                .key(record.key())
                .value(record.value())
                .headers(record.headers())
                .brokerRedeliveryCount(HeaderUtils.redeliveryCountOf(record.headers()))
                .receivedAt(Instant.now())
                .acknowledgment(acknowledgment)
                .build();
    }

    @Override
    public void sendAck(TrackedMessage message) {
        Acknowledgment acknowledgment = message.getAcknowledgment();
        if (acknowledgment == null) {
            logger.debug("no acknowledgment handle for message {}, relying on container commit", message.getMessageId());
            return;
        }
        try {
            acknowledgment.acknowledge();
            logger.debug("acknowledged message {} at {}-{}@{}", message.getMessageId(),
                    message.getTopic(), message.getPartition(), message.getOffset());
        } catch (RuntimeException e) {
            throw new TransientDeliveryException(message.getMessageId(),
                    "failed to acknowledge message " + message.getMessageId(), e);
        }
    }

    @Override
    public void sendNack(TrackedMessage message, int redeliveryCount, Duration delay) {
        String destination = redeliveryTopic();
        TracingSpan span = tracingService.startRedeliverySpan(message.getTopic(),
                message.getMessageId().value(), redeliveryCount, delay.toMillis());
        try {
            Headers headers = HeaderUtils.buildRedeliveryHeaders(message.getHeaders(), message.getMessageId(),
                    message.getTopic(), redeliveryCount);
            tracingService.injectContext(headers);

            taskScheduler.schedule(() -> republish(message, destination, headers, delay),
                    Instant.now().plus(delay));
            span.setAttribute("terminus.redelivery.topic", destination);
            span.setSuccess();

            logger.info("scheduled redelivery {} of message {} to topic: {} in {} ms",
                    redeliveryCount, message.getMessageId(), destination, delay.toMillis());
        } catch (RuntimeException e) {
            span.recordException(e);
            throw new TransientDeliveryException(message.getMessageId(),
                    "failed to schedule redelivery of message " + message.getMessageId(), e);
        } finally {
            span.end();
        }
    }

    /**
     * Sends the copy, then acks the source record. A failed send is
     * rescheduled with the same delay; the source stays unacked until a copy lands.
     */
    void republish(TrackedMessage message, String destination, Headers headers, Duration delay) {
        ProducerRecord<Object, Object> record = new ProducerRecord<>(destination, null, null,
                message.getKey(), message.getValue(), headers);
        try {
            kafkaTemplate.send(record).whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("republished message {} to topic: {}", message.getMessageId(), destination);
                    acknowledgeQuietly(message);
                } else {
                    rescheduleAfterFailure(message, destination, headers, delay, ex);
                }
            });
        } catch (RuntimeException e) {
            rescheduleAfterFailure(message, destination, headers, delay, e);
        }
    }

    private void rescheduleAfterFailure(TrackedMessage message, String destination, Headers headers,
                                        Duration delay, Throwable cause) {
        logger.error("failed to republish message {} to topic: {}, retrying in {} ms - {}",
                message.getMessageId(), destination, delay.toMillis(), cause.getMessage(), cause);
        try {
            taskScheduler.schedule(() -> republish(message, destination, headers, delay),
                    Instant.now().plus(delay));
        } catch (RuntimeException e) {
            // scheduler is shutting down, the unacked source record is redelivered after restart
            logger.error("could not reschedule redelivery of message {}: {}", message.getMessageId(), e.getMessage());
        }
    }

    private void acknowledgeQuietly(TrackedMessage message) {
        try {
            sendAck(message);
        } catch (TransientDeliveryException e) {
            logger.warn("redelivered copy of message {} was sent but the source record could not be acked: {}",
                    message.getMessageId(), e.getMessage());
        }
    }

    private String redeliveryTopic() {
        DLQPolicy policy = settings.getDlqPolicy();
        if (policy != null) {
            return policy.getRetryLetterTopic().orElse(settings.getTopic());
        }
        return settings.getTopic();
    }
}
