package net.terminus.Kafka.Config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for producing to dead-letter topics.
 * These properties can be configured in application.properties with the prefix "terminus.kafka.dead-letter".
 */
@ConfigurationProperties(prefix = "terminus.kafka.dead-letter")
public class DeadLetterProperties {

    /**
     * Produce attempts per routing call, the first one included.
     * Default: 3
     */
    private int maxProduceAttempts = 3;

    /**
     * Upper bound for a single produce call.
     * Default: 10 seconds
     */
    private Duration produceTimeout = Duration.ofSeconds(10);

    private DelayMethod backoffMethod = DelayMethod.EXPO;

    private Duration backoffBase = Duration.ofMillis(200);

    private Duration backoffMax = Duration.ofSeconds(5);

    public int getMaxProduceAttempts() {
        return maxProduceAttempts;
    }

    public void setMaxProduceAttempts(int maxProduceAttempts) {
        if (maxProduceAttempts <= 0) {
            throw new IllegalArgumentException("maxProduceAttempts must be positive");
        }
        this.maxProduceAttempts = maxProduceAttempts;
    }

    public Duration getProduceTimeout() {
        return produceTimeout;
    }

    public void setProduceTimeout(Duration produceTimeout) {
        if (produceTimeout == null || produceTimeout.isNegative() || produceTimeout.isZero()) {
            throw new IllegalArgumentException("produceTimeout must be positive");
        }
        this.produceTimeout = produceTimeout;
    }

    public DelayMethod getBackoffMethod() {
        return backoffMethod;
    }

    public void setBackoffMethod(DelayMethod backoffMethod) {
        this.backoffMethod = backoffMethod;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        if (backoffBase == null || backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase cannot be negative");
        }
        this.backoffBase = backoffBase;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public void setBackoffMax(Duration backoffMax) {
        if (backoffMax == null || backoffMax.isNegative()) {
            throw new IllegalArgumentException("backoffMax cannot be negative");
        }
        this.backoffMax = backoffMax;
    }

    @Override
    public String toString() {
        return "DeadLetterProperties{" +
                "maxProduceAttempts=" + maxProduceAttempts +
                ", produceTimeout=" + produceTimeout +
                ", backoffMethod=" + backoffMethod +
                ", backoffBase=" + backoffBase +
                ", backoffMax=" + backoffMax +
                '}';
    }
}
