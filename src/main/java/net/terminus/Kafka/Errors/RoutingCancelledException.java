package net.terminus.Kafka.Errors;

import net.terminus.Kafka.CustomObject.MessageId;
import org.springframework.lang.Nullable;

/**
 * Dead-letter routing was aborted by a cancelled token, an elapsed deadline or
 * an interrupt. No acknowledgment was sent for the source record.
 */
public class RoutingCancelledException extends DeliveryException {

    public RoutingCancelledException(@Nullable MessageId messageId, String message) {
        super(messageId, message);
    }

    public RoutingCancelledException(@Nullable MessageId messageId, String message, @Nullable Throwable cause) {
        super(messageId, message, cause);
    }
}
