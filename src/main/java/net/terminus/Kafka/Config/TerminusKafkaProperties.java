package net.terminus.Kafka.Config;

import net.terminus.Kafka.CustomObject.ConsumerSettings;
import net.terminus.Kafka.CustomObject.DLQPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Top-level properties under "terminus.kafka": the redelivery scheduler,
 * tracing and the named consumers.
 *
 * <pre>
 * terminus.kafka.consumers.orders.topic=orders
 * terminus.kafka.consumers.orders.max-redeliveries=3
 * terminus.kafka.consumers.orders.dead-letter-topic=orders-dlq
 * </pre>
 */
@ConfigurationProperties(prefix = "terminus.kafka")
public class TerminusKafkaProperties {

    /**
     * Threads of the redelivery scheduler.
     * Default: 4
     */
    private int schedulerPoolSize = 4;

    /**
     * Use OpenTelemetry spans when the API is on the classpath.
     * Default: false
     */
    private boolean tracingEnabled = false;

    private Map<String, ConsumerProperties> consumers = new LinkedHashMap<>();

    public int getSchedulerPoolSize() {
        return schedulerPoolSize;
    }

    public void setSchedulerPoolSize(int schedulerPoolSize) {
        if (schedulerPoolSize <= 0) {
            throw new IllegalArgumentException("schedulerPoolSize must be positive");
        }
        this.schedulerPoolSize = schedulerPoolSize;
    }

    public boolean isTracingEnabled() {
        return tracingEnabled;
    }

    public void setTracingEnabled(boolean tracingEnabled) {
        this.tracingEnabled = tracingEnabled;
    }

    public Map<String, ConsumerProperties> getConsumers() {
        return consumers;
    }

    public void setConsumers(Map<String, ConsumerProperties> consumers) {
        this.consumers = consumers;
    }

    @Override
    public String toString() {
        return "TerminusKafkaProperties{" +
                "schedulerPoolSize=" + schedulerPoolSize +
                ", tracingEnabled=" + tracingEnabled +
                ", consumers=" + consumers.keySet() +
                '}';
    }

    /**
     * One consumer as declared in configuration.
     */
    public static class ConsumerProperties {

        private String topic;
        private String clientId = ConsumerSettings.DEFAULT_CLIENT_ID;
        private String tenant = ConsumerSettings.DEFAULT_SCOPE;
        private String namespace = ConsumerSettings.DEFAULT_SCOPE;
        private Duration nackDelay = ConsumerSettings.DEFAULT_NACK_DELAY;
        private Duration maxNackDelay = ConsumerSettings.DEFAULT_MAX_NACK_DELAY;
        private DelayMethod delayMethod = DelayMethod.FIXED;

        /** Null or absent means unbounded. */
        private Integer maxRedeliveries;

        private String deadLetterTopic;
        private String retryLetterTopic;

        public ConsumerSettings toSettings() {
            DLQPolicy dlqPolicy = null;
            if (maxRedeliveries != null || deadLetterTopic != null || retryLetterTopic != null) {
                dlqPolicy = DLQPolicy.builder()
                        .maxRedeliveries(maxRedeliveries)
                        .deadLetterTopic(deadLetterTopic)
                        .retryLetterTopic(retryLetterTopic)
                        .build();
            }
            return ConsumerSettings.builder()
                    .topic(topic)
                    .clientId(clientId)
                    .tenant(tenant)
                    .namespace(namespace)
                    .nackDelay(nackDelay)
                    .maxNackDelay(maxNackDelay)
                    .delayMethod(delayMethod)
                    .dlqPolicy(dlqPolicy)
                    .build();
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getTenant() {
            return tenant;
        }

        public void setTenant(String tenant) {
            this.tenant = tenant;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public Duration getNackDelay() {
            return nackDelay;
        }

        public void setNackDelay(Duration nackDelay) {
            this.nackDelay = nackDelay;
        }

        public Duration getMaxNackDelay() {
            return maxNackDelay;
        }

        public void setMaxNackDelay(Duration maxNackDelay) {
            this.maxNackDelay = maxNackDelay;
        }

        public DelayMethod getDelayMethod() {
            return delayMethod;
        }

        public void setDelayMethod(DelayMethod delayMethod) {
            this.delayMethod = delayMethod;
        }

        public Integer getMaxRedeliveries() {
            return maxRedeliveries;
        }

        public void setMaxRedeliveries(Integer maxRedeliveries) {
            this.maxRedeliveries = maxRedeliveries;
        }

        public String getDeadLetterTopic() {
            return deadLetterTopic;
        }

        public void setDeadLetterTopic(String deadLetterTopic) {
            this.deadLetterTopic = deadLetterTopic;
        }

        public String getRetryLetterTopic() {
            return retryLetterTopic;
        }

        public void setRetryLetterTopic(String retryLetterTopic) {
            this.retryLetterTopic = retryLetterTopic;
        }
    }
}
