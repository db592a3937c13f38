package net.terminus.Kafka.CustomObject;

import java.util.Objects;

/**
 * Identity of a message that stays stable across redeliveries.
 * Kafka gives every redelivered copy a new offset, so the id of the first
 * delivery travels with the copies in the {@code terminus-message-id} header.
 */
public final class MessageId implements Comparable<MessageId> {

    private final String value;

    private MessageId(String value) {
        this.value = value;
    }

    public static MessageId of(String value) {
        Objects.requireNonNull(value, "message id cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("message id cannot be blank");
        }
        return new MessageId(value);
    }

    public static MessageId fromCoordinates(String topic, int partition, long offset) {
        return new MessageId(topic + "-" + partition + "@" + offset);
    }

    public String value() {
        return value;
    }

    @Override
    public int compareTo(MessageId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageId)) return false;
        return value.equals(((MessageId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
