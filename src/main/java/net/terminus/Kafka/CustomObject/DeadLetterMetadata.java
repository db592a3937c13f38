package net.terminus.Kafka.CustomObject;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Where a dead letter came from and why it was routed.
 */
@Data
@Builder(toBuilder = true)
public class DeadLetterMetadata {

    private final String messageId;
    private final String originalTopic;
    private final int originalPartition;
    private final long originalOffset;
    private final String deadLetterTopic;
    private final DeadLetterReason reason;
    private final int redeliveryCount;

    /** Null when the consumer has no redelivery maximum. */
    private final Integer maxRedeliveries;

    private final String clientId;
    private final Instant deadLetteredAt;

    @JsonCreator
    public DeadLetterMetadata(
            @JsonProperty("messageId") String messageId,
            @JsonProperty("originalTopic") String originalTopic,
            @JsonProperty("originalPartition") int originalPartition,
            @JsonProperty("originalOffset") long originalOffset,
            @JsonProperty("deadLetterTopic") String deadLetterTopic,
            @JsonProperty("reason") DeadLetterReason reason,
            @JsonProperty("redeliveryCount") int redeliveryCount,
            @JsonProperty("maxRedeliveries") Integer maxRedeliveries,
            @JsonProperty("clientId") String clientId,
            @JsonProperty("deadLetteredAt") Instant deadLetteredAt) {
        this.messageId = messageId;
        this.originalTopic = originalTopic;
        this.originalPartition = originalPartition;
        this.originalOffset = originalOffset;
        this.deadLetterTopic = deadLetterTopic;
        this.reason = reason;
        this.redeliveryCount = redeliveryCount;
        this.maxRedeliveries = maxRedeliveries;
        this.clientId = clientId;
        this.deadLetteredAt = deadLetteredAt;
    }
}
