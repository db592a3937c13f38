package net.terminus;

import net.terminus.Kafka.CustomObject.DeadLetterEnvelope;
import net.terminus.Kafka.CustomObject.DeadLetterMetadata;
import net.terminus.Kafka.CustomObject.DeadLetterReason;
import net.terminus.Kafka.CustomObject.MessageId;
import net.terminus.Kafka.CustomObject.TrackedMessage;
import net.terminus.Kafka.DeadLetter.KafkaDeadLetterProducer;
import net.terminus.Kafka.Errors.DeliveryException;
import net.terminus.Kafka.Errors.RoutingCancelledException;
import net.terminus.Kafka.Errors.TransientDeliveryException;
import net.terminus.Kafka.Tracing.NoOpTracingService;
import net.terminus.Kafka.Transport.HeaderUtils;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.NotLeaderOrFollowerException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.SerializationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaDeadLetterProducerTest {

    @Mock
    private KafkaTemplate<Object, Object> kafkaTemplate;

    private KafkaDeadLetterProducer producer;
    private TrackedMessage message;
    private DeadLetterEnvelope<Object> envelope;

    @BeforeEach
    void setUp() {
        producer = new KafkaDeadLetterProducer(kafkaTemplate, new NoOpTracingService());
        message = TrackedMessage.builder()
                .messageId(MessageId.of("orders-0@3"))
                .topic("orders")
                .offset(3L)
                .key("key-3")
                .value("value-3")
                .build();
        DeadLetterMetadata metadata = DeadLetterMetadata.builder()
                .messageId("orders-0@3")
                .originalTopic("orders")
                .originalOffset(3L)
                .deadLetterTopic("orders-dlq")
                .reason(DeadLetterReason.TERM)
                .redeliveryCount(1)
                .clientId("order-service")
                .deadLetteredAt(Instant.parse("2024-05-01T12:00:00Z"))
                .build();
        envelope = new DeadLetterEnvelope<>(message.getValue(), metadata);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testProduceSendsEnvelopeWithHeaders() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(CompletableFuture.completedFuture(null));

        producer.produce("orders-dlq", message, envelope, Duration.ofSeconds(1));

        ArgumentCaptor<ProducerRecord<Object, Object>> recordCaptor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(recordCaptor.capture());
        ProducerRecord<Object, Object> sent = recordCaptor.getValue();

        assertEquals("orders-dlq", sent.topic());
        assertEquals("key-3", sent.key());
        assertSame(envelope, sent.value());
        assertEquals("TERM", HeaderUtils.getHeaderValue(sent.headers(), HeaderUtils.HEADER_DLQ_REASON));
        assertEquals("orders", HeaderUtils.getHeaderValue(sent.headers(), HeaderUtils.HEADER_ORIGINAL_TOPIC));
        assertEquals("1", HeaderUtils.getHeaderValue(sent.headers(), HeaderUtils.HEADER_REDELIVERY_COUNT));
        assertEquals(DeadLetterEnvelope.class.getName(), HeaderUtils.getHeaderValue(sent.headers(), "__TypeId__"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testRetriableBrokerErrorIsTransient() {
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new NotLeaderOrFollowerException("leader moved")));

        assertThrows(TransientDeliveryException.class,
                () -> producer.produce("orders-dlq", message, envelope, Duration.ofSeconds(1)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testRejectedRecordIsPermanent() {
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new RecordTooLargeException("too large")));

        DeliveryException e = assertThrows(DeliveryException.class,
                () -> producer.produce("orders-dlq", message, envelope, Duration.ofSeconds(1)));
        assertFalse(e instanceof TransientDeliveryException);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSerializationFailureIsPermanent() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenThrow(new SerializationException("cannot serialize"));

        DeliveryException e = assertThrows(DeliveryException.class,
                () -> producer.produce("orders-dlq", message, envelope, Duration.ofSeconds(1)));
        assertFalse(e instanceof TransientDeliveryException);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testTimeoutIsTransient() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(new CompletableFuture<>());

        assertThrows(TransientDeliveryException.class,
                () -> producer.produce("orders-dlq", message, envelope, Duration.ofMillis(20)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testInterruptIsCancellation() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(new CompletableFuture<>());

        Thread.currentThread().interrupt();
        try {
            assertThrows(RoutingCancelledException.class,
                    () -> producer.produce("orders-dlq", message, envelope, Duration.ofSeconds(5)));
            assertTrue(Thread.currentThread().isInterrupted(), "interrupt flag should be restored");
        } finally {
            Thread.interrupted();
        }
    }
}
