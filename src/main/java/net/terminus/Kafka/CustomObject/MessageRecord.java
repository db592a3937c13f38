package net.terminus.Kafka.CustomObject;

import net.terminus.Kafka.Tracker.TransitionEvent;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-message redelivery state. Instances are immutable; the tracker swaps in a
 * new record on every transition.
 */
public final class MessageRecord {

    private final MessageId messageId;
    private final int redeliveryCount;
    private final DeliveryState state;
    private final boolean dlqEligible;
    private final Instant lastTransitionAt;
    @Nullable
    private final TransitionEvent finalizedBy;

    private MessageRecord(MessageId messageId,
                          int redeliveryCount,
                          DeliveryState state,
                          boolean dlqEligible,
                          Instant lastTransitionAt,
                          @Nullable TransitionEvent finalizedBy) {
        if (redeliveryCount < 0) {
            throw new IllegalArgumentException("redeliveryCount cannot be negative: " + redeliveryCount);
        }
        this.messageId = Objects.requireNonNull(messageId, "messageId");
        this.redeliveryCount = redeliveryCount;
        this.state = Objects.requireNonNull(state, "state");
        this.dlqEligible = dlqEligible;
        this.lastTransitionAt = Objects.requireNonNull(lastTransitionAt, "lastTransitionAt");
        this.finalizedBy = finalizedBy;
    }

    public static MessageRecord pending(MessageId messageId, Instant createdAt) {
        return new MessageRecord(messageId, 0, DeliveryState.PENDING, false, createdAt, null);
    }

    public MessageRecord withState(DeliveryState newState, Instant at) {
        return new MessageRecord(messageId, redeliveryCount, newState, dlqEligible, at, finalizedBy);
    }

    public MessageRecord withRedeliveryCount(int count) {
        return new MessageRecord(messageId, count, state, dlqEligible, lastTransitionAt, finalizedBy);
    }

    public MessageRecord markDlqEligible() {
        return new MessageRecord(messageId, redeliveryCount, state, true, lastTransitionAt, finalizedBy);
    }

    public MessageRecord finalizedBy(TransitionEvent event, Instant at) {
        return new MessageRecord(messageId, redeliveryCount, DeliveryState.TERMINAL, dlqEligible, at, event);
    }

    public MessageId getMessageId() {
        return messageId;
    }

    public int getRedeliveryCount() {
        return redeliveryCount;
    }

    public DeliveryState getState() {
        return state;
    }

    public boolean isDlqEligible() {
        return dlqEligible;
    }

    public Instant getLastTransitionAt() {
        return lastTransitionAt;
    }

    @Nullable
    public TransitionEvent getFinalizedBy() {
        return finalizedBy;
    }

    @Override
    public String toString() {
        return "MessageRecord{" +
                "messageId=" + messageId +
                ", redeliveryCount=" + redeliveryCount +
                ", state=" + state +
                ", dlqEligible=" + dlqEligible +
                ", finalizedBy=" + finalizedBy +
                '}';
    }
}
