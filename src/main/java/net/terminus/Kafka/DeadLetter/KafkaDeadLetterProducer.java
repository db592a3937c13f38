package net.terminus.Kafka.DeadLetter;

import net.terminus.Kafka.CustomObject.DeadLetterEnvelope;
import net.terminus.Kafka.CustomObject.TrackedMessage;
import net.terminus.Kafka.Errors.DeliveryException;
import net.terminus.Kafka.Errors.RoutingCancelledException;
import net.terminus.Kafka.Errors.TransientDeliveryException;
import net.terminus.Kafka.Tracing.TracingService;
import net.terminus.Kafka.Transport.HeaderUtils;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.ApiException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class KafkaDeadLetterProducer implements DeadLetterProducer {

    private static final Logger logger = LoggerFactory.getLogger(KafkaDeadLetterProducer.class);

    static final String TYPE_ID_HEADER = "__TypeId__";

    private final KafkaTemplate<Object, Object> kafkaTemplate;
    private final TracingService tracingService;

    @SuppressWarnings("unchecked")
    public KafkaDeadLetterProducer(KafkaTemplate<?, ?> kafkaTemplate, TracingService tracingService) {
        this.kafkaTemplate = (KafkaTemplate<Object, Object>) kafkaTemplate;
        this.tracingService = tracingService;
    }

    @Override
    public void produce(String destination, TrackedMessage message, DeadLetterEnvelope<?> envelope, Duration timeout) {
        Headers headers = HeaderUtils.buildDeadLetterHeaders(message.getHeaders(), envelope.getMetadata());
        // lets JsonDeserializer on the dead-letter topic resolve the envelope type
        headers.remove(TYPE_ID_HEADER);
        headers.add(TYPE_ID_HEADER, DeadLetterEnvelope.class.getName().getBytes(StandardCharsets.UTF_8));
        tracingService.injectContext(headers);

        ProducerRecord<Object, Object> record = new ProducerRecord<>(destination, null, null,
                message.getKey(), envelope, headers);

        logger.debug("sending message {} to dlq topic: {}", message.getMessageId(), destination);
        try {
            kafkaTemplate.send(record).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.debug("dlq topic {} confirmed message {}", destination, message.getMessageId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingCancelledException(message.getMessageId(),
                    "interrupted while sending message " + message.getMessageId() + " to dlq topic: " + destination, e);
        } catch (TimeoutException e) {
            throw new TransientDeliveryException(message.getMessageId(),
                    "timed out after " + timeout.toMillis() + " ms sending to dlq topic: " + destination, e);
        } catch (ExecutionException e) {
            throw classify(message, destination, e.getCause() != null ? e.getCause() : e);
        } catch (RuntimeException e) {
            // KafkaTemplate.send can fail before returning a future, e.g. on serialization
            throw classify(message, destination, e);
        }
    }

    private DeliveryException classify(TrackedMessage message, String destination, Throwable cause) {
        if (isPermanent(cause)) {
            logger.error("dlq topic {} rejected message {} permanently: {}", destination, message.getMessageId(),
                    cause.getMessage());
            return new DeliveryException(message.getMessageId(),
                    "dlq topic " + destination + " rejected message " + message.getMessageId(), cause);
        }
        return new TransientDeliveryException(message.getMessageId(),
                "failed to send message " + message.getMessageId() + " to dlq topic: " + destination, cause);
    }

    private static boolean isPermanent(Throwable cause) {
        Throwable current = cause;
        while (current != null) {
            if (current instanceof SerializationException) {
                return true;
            }
            if (current instanceof ApiException && !(current instanceof RetriableException)) {
                return true;
            }
            if (current instanceof RetriableException) {
                return false;
            }
            current = current.getCause();
        }
        return false;
    }
}
