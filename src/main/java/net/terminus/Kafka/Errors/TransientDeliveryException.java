package net.terminus.Kafka.Errors;

import net.terminus.Kafka.CustomObject.MessageId;
import org.springframework.lang.Nullable;

/**
 * A network failure while producing to the dead-letter topic or acknowledging
 * the source record. The original message stays redeliverable.
 */
public class TransientDeliveryException extends DeliveryException {

    public TransientDeliveryException(@Nullable MessageId messageId, String message, @Nullable Throwable cause) {
        super(messageId, message, cause);
    }
}
