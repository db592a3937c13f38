package net.terminus.Kafka.CustomObject;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Payload written to the dead-letter topic: the original value plus the
 * metadata describing why it was routed there.
 */
public class DeadLetterEnvelope<T> {

    private DeadLetterMetadata metadata;

    // full class name of the wrapped value
    @JsonTypeInfo(
            use = JsonTypeInfo.Id.CLASS,
            include = JsonTypeInfo.As.PROPERTY,
            property = "@valueClass"
    )
    private T value;

    // Default constructor for Jackson
    public DeadLetterEnvelope() {
    }

    public DeadLetterEnvelope(T value, DeadLetterMetadata metadata) {
        this.value = value;
        this.metadata = metadata;
    }

    public T getValue() {
        return value;
    }

    public void setValue(T value) {
        this.value = value;
    }

    public DeadLetterMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(DeadLetterMetadata metadata) {
        this.metadata = metadata;
    }
}
