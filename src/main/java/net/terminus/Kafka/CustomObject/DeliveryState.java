package net.terminus.Kafka.CustomObject;

/**
 * Lifecycle of a single delivery attempt.
 */
public enum DeliveryState {

    /** Delivered to application code and awaiting ack, nack or term. */
    PENDING,

    /** Handed back to the transport; the next delivery brings it back to PENDING. */
    REDELIVERING,

    /** Dead-letter produce in flight. */
    DEAD_LETTERING,

    /** Acknowledged, either naturally or after a successful dead-letter produce. */
    TERMINAL
}
