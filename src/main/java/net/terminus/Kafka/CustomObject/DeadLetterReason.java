package net.terminus.Kafka.CustomObject;

/**
 * Why a message ended up on the dead-letter topic.
 */
public enum DeadLetterReason {

    /** The application called term. */
    TERM,

    /** A nack found the redelivery maximum reached. */
    MAX_REDELIVERIES_EXCEEDED
}
