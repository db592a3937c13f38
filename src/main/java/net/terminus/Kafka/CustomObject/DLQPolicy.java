package net.terminus.Kafka.CustomObject;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * Dead-letter configuration owned by a consumer. Immutable once built.
 */
public final class DLQPolicy {

    /** Marker for "no redelivery maximum". */
    public static final int UNBOUNDED = -1;

    private final int maxRedeliveries;
    @Nullable
    private final String deadLetterTopic;
    @Nullable
    private final String retryLetterTopic;

    @Builder
    private DLQPolicy(@Nullable Integer maxRedeliveries,
                      @Nullable String deadLetterTopic,
                      @Nullable String retryLetterTopic) {
        int max = maxRedeliveries != null ? maxRedeliveries : UNBOUNDED;
        if (max != UNBOUNDED && max <= 0) {
            throw new IllegalArgumentException("maxRedeliveries must be positive or unbounded, was " + max);
        }
        String dead = blankToNull(deadLetterTopic);
        String retry = blankToNull(retryLetterTopic);
        if (dead != null && dead.equals(retry)) {
            throw new IllegalArgumentException("Retry letter topic cannot be the same as the dead letter topic");
        }
        this.maxRedeliveries = max;
        this.deadLetterTopic = dead;
        this.retryLetterTopic = retry;
    }

    public int getMaxRedeliveries() {
        return maxRedeliveries;
    }

    public boolean isUnbounded() {
        return maxRedeliveries == UNBOUNDED;
    }

    @Nullable
    public String getDeadLetterTopic() {
        return deadLetterTopic;
    }

    public boolean hasDeadLetterTopic() {
        return deadLetterTopic != null;
    }

    public Optional<String> getRetryLetterTopic() {
        return Optional.ofNullable(retryLetterTopic);
    }

    @Override
    public String toString() {
        return "DLQPolicy{" +
                "maxRedeliveries=" + (isUnbounded() ? "unbounded" : String.valueOf(maxRedeliveries)) +
                ", deadLetterTopic='" + deadLetterTopic + '\'' +
                ", retryLetterTopic='" + retryLetterTopic + '\'' +
                '}';
    }

    private static String blankToNull(@Nullable String topic) {
        return topic == null || topic.isBlank() ? null : topic;
    }

    public static class DLQPolicyBuilder {

        public DLQPolicyBuilder unbounded() {
            this.maxRedeliveries = UNBOUNDED;
            return this;
        }
    }
}
