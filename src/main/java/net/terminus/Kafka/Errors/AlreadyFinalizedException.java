package net.terminus.Kafka.Errors;

import net.terminus.Kafka.CustomObject.DeliveryState;
import net.terminus.Kafka.CustomObject.MessageId;
import net.terminus.Kafka.Tracker.TransitionEvent;

/**
 * The delivery attempt was already resolved by another call. Callers treat this
 * as a successful no-op: duplicate deliveries routinely race with finalization.
 */
public class AlreadyFinalizedException extends DeliveryException {

    private final DeliveryState currentState;
    private final TransitionEvent rejectedEvent;

    public AlreadyFinalizedException(MessageId messageId, DeliveryState currentState, TransitionEvent rejectedEvent) {
        super(messageId, "message " + messageId + " is already " + currentState + ", ignoring " + rejectedEvent);
        this.currentState = currentState;
        this.rejectedEvent = rejectedEvent;
    }

    public DeliveryState getCurrentState() {
        return currentState;
    }

    public TransitionEvent getRejectedEvent() {
        return rejectedEvent;
    }
}
