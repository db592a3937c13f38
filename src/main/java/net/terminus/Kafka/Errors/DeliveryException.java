package net.terminus.Kafka.Errors;

import net.terminus.Kafka.CustomObject.MessageId;
import org.springframework.lang.Nullable;

/**
 * Base type for failures raised while acknowledging, redelivering or
 * dead-lettering a message.
 */
public class DeliveryException extends RuntimeException {

    @Nullable
    private final MessageId messageId;

    public DeliveryException(@Nullable MessageId messageId, String message) {
        super(message);
        this.messageId = messageId;
    }

    public DeliveryException(@Nullable MessageId messageId, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.messageId = messageId;
    }

    @Nullable
    public MessageId getMessageId() {
        return messageId;
    }
}
