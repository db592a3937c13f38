package net.terminus;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.terminus.Kafka.Config.TerminusKafkaAutoConfiguration;
import net.terminus.Kafka.CustomObject.DeadLetterReason;
import net.terminus.Kafka.Dispatcher.MessageConsumer;
import net.terminus.Kafka.Dispatcher.MessageConsumerRegistry;
import net.terminus.Kafka.Metrics.MetricsRecorder;
import net.terminus.Kafka.Transport.HeaderUtils;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.springframework.kafka.test.EmbeddedKafkaBroker;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.kafka.test.utils.ContainerTestUtils;
import org.springframework.stereotype.Component;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
@SpringBootTest(
        classes = {
                TerminusIntegrationTest.TestConfig.class,
                TerminusIntegrationTest.OrderListener.class,
                TerminusIntegrationTest.DeadLetterCollector.class,
                TerminusKafkaAutoConfiguration.class
        },
        properties = {
                "spring.kafka.bootstrap-servers=${spring.embedded.kafka.brokers}",
                "terminus.kafka.consumers.orders.topic=terminus-orders",
                "terminus.kafka.consumers.orders.client-id=integration",
                "terminus.kafka.consumers.orders.max-redeliveries=2",
                "terminus.kafka.consumers.orders.dead-letter-topic=terminus-orders-dlq",
                "terminus.kafka.consumers.orders.nack-delay=100ms",
                "terminus.kafka.consumers.orders.delay-method=FIXED",
                "terminus.kafka.dead-letter.backoff-base=10ms"
        }
)
@EmbeddedKafka(
        partitions = 1,
        topics = {"terminus-orders", "terminus-orders-dlq"}
)
@DirtiesContext
class TerminusIntegrationTest {

    @Autowired
    @Qualifier("testOrderTemplate")
    private KafkaTemplate<String, Object> kafkaTemplate;

    @Autowired
    private OrderListener orderListener;

    @Autowired
    private DeadLetterCollector deadLetterCollector;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private KafkaListenerEndpointRegistry listenerRegistry;

    @Autowired
    private EmbeddedKafkaBroker embeddedKafka;

    @BeforeEach
    void setUp() {
        for (MessageListenerContainer container : listenerRegistry.getListenerContainers()) {
            ContainerTestUtils.waitForAssignment(container, embeddedKafka.getPartitionsPerTopic());
        }
    }

    @Test
    void testAcknowledgedOrderIsProcessedOnce() throws InterruptedException {
        TestOrder order = new TestOrder(UUID.randomUUID().toString(), "ok");
        kafkaTemplate.send("terminus-orders", order.getId(), order);

        await().atMost(10, TimeUnit.SECONDS)
                .untilAsserted(() -> assertEquals(1, orderListener.attemptsFor(order.getId())));

        // no redelivery should follow an ack
        Thread.sleep(1000);

        assertEquals(1, orderListener.attemptsFor(order.getId()));
        assertTrue(deadLetterCollector.recordsFor(order.getId()).isEmpty(),
                "Acknowledged orders should not reach the dead-letter topic");
    }

    @Test
    void testTermRoutesPoisonOrderToDeadLetterTopic() {
        TestOrder order = new TestOrder(UUID.randomUUID().toString(), "poison");
        kafkaTemplate.send("terminus-orders", order.getId(), order);

        await().atMost(15, TimeUnit.SECONDS)
                .pollInterval(200, TimeUnit.MILLISECONDS)
                .untilAsserted(() -> assertEquals(1, deadLetterCollector.recordsFor(order.getId()).size()));

        ConsumerRecord<String, String> dead = deadLetterCollector.recordsFor(order.getId()).get(0);
        assertEquals(DeadLetterReason.TERM.name(),
                HeaderUtils.getHeaderValue(dead.headers(), HeaderUtils.HEADER_DLQ_REASON));
        assertEquals("terminus-orders",
                HeaderUtils.getHeaderValue(dead.headers(), HeaderUtils.HEADER_ORIGINAL_TOPIC));
        assertEquals(1, orderListener.attemptsFor(order.getId()),
                "A terminated order should not be redelivered");

        Counter terms = meterRegistry.find(MetricsRecorder.CONSUMER_TERMS)
                .tag("topic", "terminus-orders")
                .counter();
        assertNotNull(terms);
        assertTrue(terms.count() >= 1.0);
    }

    @Test
    void testFailingOrderIsDeadLetteredAfterMaxRedeliveries() {
        TestOrder order = new TestOrder(UUID.randomUUID().toString(), "flaky");
        kafkaTemplate.send("terminus-orders", order.getId(), order);

        await().atMost(20, TimeUnit.SECONDS)
                .pollInterval(200, TimeUnit.MILLISECONDS)
                .untilAsserted(() -> assertEquals(1, deadLetterCollector.recordsFor(order.getId()).size()));

        // first delivery plus two redeliveries
        assertEquals(3, orderListener.attemptsFor(order.getId()));

        ConsumerRecord<String, String> dead = deadLetterCollector.recordsFor(order.getId()).get(0);
        assertEquals(DeadLetterReason.MAX_REDELIVERIES_EXCEEDED.name(),
                HeaderUtils.getHeaderValue(dead.headers(), HeaderUtils.HEADER_DLQ_REASON));
        assertEquals("2", HeaderUtils.getHeaderValue(dead.headers(), HeaderUtils.HEADER_REDELIVERY_COUNT));
        assertTrue(dead.value().contains(order.getId()), "Envelope should carry the original order");
    }

    @Test
    void testOrderRecoversOnRedelivery() throws InterruptedException {
        TestOrder order = new TestOrder(UUID.randomUUID().toString(), "recover");
        kafkaTemplate.send("terminus-orders", order.getId(), order);

        await().atMost(15, TimeUnit.SECONDS)
                .pollInterval(200, TimeUnit.MILLISECONDS)
                .untilAsserted(() -> assertTrue(orderListener.hasSucceeded(order.getId())));

        Thread.sleep(1000);

        assertEquals(2, orderListener.attemptsFor(order.getId()));
        assertTrue(deadLetterCollector.recordsFor(order.getId()).isEmpty());
    }

    @Component
    public static class OrderListener {
        private final MessageConsumerRegistry registry;
        private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
        private final List<String> succeeded = new CopyOnWriteArrayList<>();

        public OrderListener(MessageConsumerRegistry registry) {
            this.registry = registry;
        }

        @KafkaListener(
                topics = "terminus-orders",
                groupId = "terminus-orders-group",
                containerFactory = "orderContainerFactory"
        )
        public void listen(ConsumerRecord<String, Object> record, Acknowledgment acknowledgment) {
            MessageConsumer consumer = registry.get("orders");
            consumer.receive(record, acknowledgment).ifPresent(message -> {
                TestOrder order = (TestOrder) message.getValue();
                int attempt = attempts.computeIfAbsent(order.getId(), k -> new AtomicInteger()).incrementAndGet();

                switch (order.getBehaviour()) {
                    case "poison":
                        consumer.term(message);
                        break;
                    case "flaky":
                        consumer.nack(message);
                        break;
                    case "recover":
                        if (attempt < 2) {
                            consumer.nack(message);
                        } else {
                            consumer.ack(message);
                            succeeded.add(order.getId());
                        }
                        break;
                    default:
                        consumer.ack(message);
                        succeeded.add(order.getId());
                }
            });
        }

        public int attemptsFor(String orderId) {
            AtomicInteger count = attempts.get(orderId);
            return count == null ? 0 : count.get();
        }

        public boolean hasSucceeded(String orderId) {
            return succeeded.contains(orderId);
        }
    }

    @Component
    public static class DeadLetterCollector {
        private final List<ConsumerRecord<String, String>> received = new CopyOnWriteArrayList<>();

        @KafkaListener(
                topics = "terminus-orders-dlq",
                groupId = "terminus-dlq-group",
                containerFactory = "deadLetterContainerFactory"
        )
        public void collect(ConsumerRecord<String, String> record) {
            received.add(record);
        }

        public List<ConsumerRecord<String, String>> recordsFor(String orderId) {
            return received.stream()
                    .filter(r -> orderId.equals(r.key()))
                    .collect(Collectors.toList());
        }
    }

    @Configuration
    @EnableKafka
    public static class TestConfig {

        @Bean
        public MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean(name = "testOrderTemplate")
        public KafkaTemplate<String, Object> testOrderTemplate(EmbeddedKafkaBroker embeddedKafka) {
            Map<String, Object> props = new HashMap<>();
            props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, embeddedKafka.getBrokersAsString());
            props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
            props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
            return new KafkaTemplate<>(new DefaultKafkaProducerFactory<>(props));
        }

        @Bean
        public ConsumerFactory<String, Object> orderConsumerFactory(EmbeddedKafkaBroker embeddedKafka) {
            Map<String, Object> props = new HashMap<>();
            props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, embeddedKafka.getBrokersAsString());
            props.put(ConsumerConfig.GROUP_ID_CONFIG, "terminus-orders-group");
            props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
            props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);

            JsonDeserializer<Object> deserializer = new JsonDeserializer<>();
            deserializer.addTrustedPackages("*");

            return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), deserializer);
        }

        @Bean(name = "orderContainerFactory")
        public ConcurrentKafkaListenerContainerFactory<String, Object> orderContainerFactory(
                ConsumerFactory<String, Object> orderConsumerFactory) {
            ConcurrentKafkaListenerContainerFactory<String, Object> factory =
                    new ConcurrentKafkaListenerContainerFactory<>();
            factory.setConsumerFactory(orderConsumerFactory);
            factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
            // redeliveries ack from the scheduler thread, possibly out of order
            factory.getContainerProperties().setAsyncAcks(true);
            return factory;
        }

        @Bean(name = "deadLetterContainerFactory")
        public ConcurrentKafkaListenerContainerFactory<String, String> deadLetterContainerFactory(
                EmbeddedKafkaBroker embeddedKafka) {
            Map<String, Object> props = new HashMap<>();
            props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, embeddedKafka.getBrokersAsString());
            props.put(ConsumerConfig.GROUP_ID_CONFIG, "terminus-dlq-group");
            props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

            ConcurrentKafkaListenerContainerFactory<String, String> factory =
                    new ConcurrentKafkaListenerContainerFactory<>();
            factory.setConsumerFactory(new DefaultKafkaConsumerFactory<>(
                    props, new StringDeserializer(), new StringDeserializer()));
            return factory;
        }
    }
}
