package net.terminus.Kafka.Dispatcher;

public enum AckOutcome {
    ACKNOWLEDGED,
    REDELIVERY_SCHEDULED,
    DEAD_LETTERED,
    /** Another call already resolved this delivery attempt; nothing was sent. */
    ALREADY_FINALIZED
}
