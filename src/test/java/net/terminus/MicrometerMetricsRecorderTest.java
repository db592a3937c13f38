package net.terminus;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.terminus.Kafka.CustomObject.ConsumerSettings;
import net.terminus.Kafka.CustomObject.DeadLetterReason;
import net.terminus.Kafka.Errors.TransientDeliveryException;
import net.terminus.Kafka.Metrics.MetricsRecorder;
import net.terminus.Kafka.Metrics.MicrometerMetricsRecorder;
import net.terminus.Kafka.Metrics.NoOpMetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRecorderTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsRecorder recorder;
    private ConsumerSettings consumer;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        recorder = new MicrometerMetricsRecorder(registry);
        consumer = ConsumerSettings.builder()
                .topic("orders")
                .clientId("order-service")
                .tenant("acme")
                .namespace("billing")
                .build();
    }

    @Test
    void testTermCounterIsTaggedWithConsumerLabels() {
        recorder.recordTerm(consumer);
        recorder.recordTerm(consumer);

        Counter counter = registry.find(MetricsRecorder.CONSUMER_TERMS)
                .tag("client", "order-service")
                .tag("tenant", "acme")
                .tag("namespace", "billing")
                .tag("topic", "orders")
                .counter();
        assertNotNull(counter);
        assertEquals(2.0, counter.count());
    }

    @Test
    void testDeadLetterCounterCarriesReason() {
        recorder.recordDeadLetter(consumer, DeadLetterReason.MAX_REDELIVERIES_EXCEEDED);

        assertEquals(1.0, registry.get(MetricsRecorder.CONSUMER_DLQ_MESSAGES)
                .tag("reason", "MAX_REDELIVERIES_EXCEEDED")
                .counter()
                .count());
        assertNull(registry.find(MetricsRecorder.CONSUMER_DLQ_MESSAGES).tag("reason", "TERM").counter());
    }

    @Test
    void testAckRedeliveryAndRoutingFailureCounters() {
        recorder.recordAck(consumer);
        recorder.recordRedelivery(consumer, 1);
        recorder.recordRedelivery(consumer, 2);
        recorder.recordRoutingFailure(consumer, new TransientDeliveryException(null, "down", null));

        assertEquals(1.0, registry.get(MetricsRecorder.CONSUMER_ACKS).counter().count());
        assertEquals(2.0, registry.get(MetricsRecorder.CONSUMER_REDELIVERIES).counter().count());
        assertEquals(1.0, registry.get(MetricsRecorder.CONSUMER_DLQ_ROUTING_FAILURES)
                .tag("exception", "TransientDeliveryException")
                .counter()
                .count());
        assertTrue(recorder.isAvailable());
    }

    @Test
    void testNoOpRecorder() {
        NoOpMetricsRecorder noOp = new NoOpMetricsRecorder();

        assertDoesNotThrow(() -> {
            noOp.recordTerm(consumer);
            noOp.recordDeadLetter(consumer, DeadLetterReason.TERM);
        });
        assertFalse(noOp.isAvailable());
    }
}
