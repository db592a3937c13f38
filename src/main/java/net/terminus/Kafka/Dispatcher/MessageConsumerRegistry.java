package net.terminus.Kafka.Dispatcher;

import net.terminus.Kafka.Config.TerminusKafkaProperties;
import net.terminus.Kafka.CustomObject.ConsumerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Consumers declared under {@code terminus.kafka.consumers.<name>}, looked up by name or topic.
 */
public class MessageConsumerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(MessageConsumerRegistry.class);

    private final Map<String, MessageConsumer> consumers;

    public MessageConsumerRegistry(MessageConsumerFactory factory, TerminusKafkaProperties properties) {
        Map<String, MessageConsumer> created = new LinkedHashMap<>();
        properties.getConsumers().forEach((name, consumerProperties) -> {
            ConsumerSettings settings;
            try {
                settings = consumerProperties.toSettings();
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid settings for consumer '" + name + "': " + e.getMessage(), e);
            }
            created.put(name, factory.create(settings));
        });
        this.consumers = Collections.unmodifiableMap(created);
        logger.info("registered {} consumer(s): {}", consumers.size(), consumers.keySet());
    }

    /**
     * @throws IllegalArgumentException if no consumer has that name
     */
    public MessageConsumer get(String name) {
        MessageConsumer consumer = consumers.get(name);
        if (consumer == null) {
            throw new IllegalArgumentException("no consumer named '" + name + "', known: " + consumers.keySet());
        }
        return consumer;
    }

    public Optional<MessageConsumer> forTopic(String topic) {
        return consumers.values().stream()
                .filter(consumer -> consumer.getSettings().getTopic().equals(topic))
                .findFirst();
    }

    public Map<String, MessageConsumer> getConsumers() {
        return consumers;
    }
}
