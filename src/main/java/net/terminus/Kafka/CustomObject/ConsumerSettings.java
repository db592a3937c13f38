package net.terminus.Kafka.CustomObject;

import lombok.Builder;
import lombok.Getter;
import net.terminus.Kafka.Config.DelayMethod;
import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * Immutable settings of one consumer: where it reads from, how it labels its
 * metrics, how long a nack waits before redelivery and where dead letters go.
 * Unset builder values fall back to the defaults below.
 */
@Getter
public class ConsumerSettings {

    public static final String DEFAULT_CLIENT_ID = "terminus-consumer";
    public static final String DEFAULT_SCOPE = "default";
    public static final Duration DEFAULT_NACK_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_NACK_DELAY = Duration.ofMinutes(5);

    private final String topic;
    private final String clientId;
    private final String tenant;
    private final String namespace;
    private final Duration nackDelay;
    private final Duration maxNackDelay;
    private final DelayMethod delayMethod;
    @Nullable
    private final DLQPolicy dlqPolicy;

    @Builder
    private ConsumerSettings(String topic,
                             @Nullable String clientId,
                             @Nullable String tenant,
                             @Nullable String namespace,
                             @Nullable Duration nackDelay,
                             @Nullable Duration maxNackDelay,
                             @Nullable DelayMethod delayMethod,
                             @Nullable DLQPolicy dlqPolicy) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic cannot be empty");
        }
        this.topic = topic;
        this.clientId = clientId != null ? clientId : DEFAULT_CLIENT_ID;
        this.tenant = tenant != null ? tenant : DEFAULT_SCOPE;
        this.namespace = namespace != null ? namespace : DEFAULT_SCOPE;
        this.nackDelay = nackDelay != null ? nackDelay : DEFAULT_NACK_DELAY;
        this.maxNackDelay = maxNackDelay != null ? maxNackDelay : DEFAULT_MAX_NACK_DELAY;
        this.delayMethod = delayMethod != null ? delayMethod : DelayMethod.FIXED;
        this.dlqPolicy = dlqPolicy;

        if (this.nackDelay.isNegative()) {
            throw new IllegalArgumentException("nackDelay cannot be negative");
        }
        if (this.maxNackDelay.compareTo(this.nackDelay) < 0) {
            throw new IllegalArgumentException("maxNackDelay cannot be shorter than nackDelay");
        }
        if (dlqPolicy != null && topic.equals(dlqPolicy.getDeadLetterTopic())) {
            throw new IllegalArgumentException("Dead letter topic cannot be the same as the topic");
        }
    }

    public boolean hasDeadLetterTopic() {
        return dlqPolicy != null && dlqPolicy.hasDeadLetterTopic();
    }

    @Override
    public String toString() {
        return "ConsumerSettings{" +
                "topic='" + topic + '\'' +
                ", clientId='" + clientId + '\'' +
                ", tenant='" + tenant + '\'' +
                ", namespace='" + namespace + '\'' +
                ", nackDelay=" + nackDelay +
                ", delayMethod=" + delayMethod +
                ", dlqPolicy=" + dlqPolicy +
                '}';
    }
}
