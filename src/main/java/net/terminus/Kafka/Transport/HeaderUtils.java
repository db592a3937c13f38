package net.terminus.Kafka.Transport;

import net.terminus.Kafka.CustomObject.DeadLetterMetadata;
import net.terminus.Kafka.CustomObject.MessageId;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.nio.charset.StandardCharsets;

/**
 * Utility class for reading and writing redelivery metadata in Kafka headers.
 */
public final class HeaderUtils {

    private static final Logger logger = LoggerFactory.getLogger(HeaderUtils.class);

    // header key constants
    public static final String HEADER_MESSAGE_ID = "terminus-message-id";
    public static final String HEADER_REDELIVERY_COUNT = "terminus-redelivery-count";
    public static final String HEADER_ORIGINAL_TOPIC = "terminus-original-topic";
    public static final String HEADER_DLQ_REASON = "terminus-dlq-reason";
    public static final String HEADER_DEAD_LETTERED_AT = "terminus-dead-lettered-at";

    private HeaderUtils() {
    }

    /**
     * Message id carried by the record, or one derived from the record's own
     * coordinates on its first delivery.
     */
    public static MessageId messageIdOf(ConsumerRecord<?, ?> record) {
        String carried = getHeaderValue(record.headers(), HEADER_MESSAGE_ID);
        if (carried != null && !carried.isBlank()) {
            return MessageId.of(carried);
        }
        return MessageId.fromCoordinates(record.topic(), record.partition(), record.offset());
    }

    public static int redeliveryCountOf(@Nullable Headers headers) {
        return parseInt(getHeaderValue(headers, HEADER_REDELIVERY_COUNT), 0);
    }

    /**
     * Copies the original headers and stamps them with the redelivery metadata.
     */
    public static Headers buildRedeliveryHeaders(@Nullable Headers original,
                                                 MessageId messageId,
                                                 String originalTopic,
                                                 int redeliveryCount) {
        RecordHeaders headers = copy(original);
        put(headers, HEADER_MESSAGE_ID, messageId.value());
        put(headers, HEADER_REDELIVERY_COUNT, String.valueOf(redeliveryCount));
        if (getHeaderValue(headers, HEADER_ORIGINAL_TOPIC) == null) {
            put(headers, HEADER_ORIGINAL_TOPIC, originalTopic);
        }
        return headers;
    }

    /**
     * Copies the original headers and stamps them with the dead-letter metadata.
     */
    public static Headers buildDeadLetterHeaders(@Nullable Headers original, DeadLetterMetadata metadata) {
        RecordHeaders headers = copy(original);
        put(headers, HEADER_MESSAGE_ID, metadata.getMessageId());
        put(headers, HEADER_REDELIVERY_COUNT, String.valueOf(metadata.getRedeliveryCount()));
        put(headers, HEADER_ORIGINAL_TOPIC, metadata.getOriginalTopic());
        put(headers, HEADER_DLQ_REASON, metadata.getReason().name());
        put(headers, HEADER_DEAD_LETTERED_AT, String.valueOf(metadata.getDeadLetteredAt()));
        return headers;
    }

    @Nullable
    public static String getHeaderValue(@Nullable Headers headers, String key) {
        if (headers == null) {
            return null;
        }
        Header header = headers.lastHeader(key);
        if (header == null || header.value() == null) {
            return null;
        }
        return new String(header.value(), StandardCharsets.UTF_8);
    }

    private static RecordHeaders copy(@Nullable Headers original) {
        RecordHeaders headers = new RecordHeaders();
        if (original != null) {
            for (Header header : original) {
                headers.add(header.key(), header.value());
            }
        }
        return headers;
    }

    private static void put(Headers headers, String key, @Nullable String value) {
        headers.remove(key);
        if (value != null) {
            headers.add(key, value.getBytes(StandardCharsets.UTF_8));
        }
    }

    private static int parseInt(@Nullable String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("ignoring malformed {} header value: {}", HEADER_REDELIVERY_COUNT, value);
            return defaultValue;
        }
    }
}
