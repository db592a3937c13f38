package net.terminus.Kafka.CustomObject;

import lombok.Builder;
import lombok.Getter;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * A message handed to application code together with the delivery metadata
 * the broker supplied for it.
 */
@Getter
@Builder(toBuilder = true)
public class TrackedMessage {

    private final MessageId messageId;
    private final String topic;

    @Builder.Default
    private final int partition = 0;

    @Builder.Default
    private final long offset = -1L;

    @Nullable
    private final Object key;

    @Nullable
    private final Object value;

    @Builder.Default
    private final Headers headers = new RecordHeaders();

    /** Redelivery count carried by the record itself; 0 on the first delivery. */
    @Builder.Default
    private final int brokerRedeliveryCount = 0;

    @Builder.Default
    private final Instant receivedAt = Instant.now();

    /** Listener container handle used to commit the source record, absent with auto-commit. */
    @Nullable
    private final Acknowledgment acknowledgment;

    @Override
    public String toString() {
        return "TrackedMessage{" +
                "messageId=" + messageId +
                ", topic='" + topic + '\'' +
                ", partition=" + partition +
                ", offset=" + offset +
                ", brokerRedeliveryCount=" + brokerRedeliveryCount +
                '}';
    }
}
