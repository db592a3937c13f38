package net.terminus.Kafka.Errors;

import net.terminus.Kafka.CustomObject.MessageId;
import org.springframework.lang.Nullable;

/**
 * Raised when a consumer has no dead-letter destination and a message has to be
 * dead-lettered. The caller must fix the configuration; it is never retried.
 */
public class InvalidConfigurationException extends DeliveryException {

    public InvalidConfigurationException(@Nullable MessageId messageId, String message) {
        super(messageId, message);
    }
}
