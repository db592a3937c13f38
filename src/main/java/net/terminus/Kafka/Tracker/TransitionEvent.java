package net.terminus.Kafka.Tracker;

/**
 * Events accepted by {@link DeliveryTracker#transition}.
 */
public enum TransitionEvent {

    /** A (re)delivery reached the application; syncs the broker-reported count. */
    DELIVER,

    /** A nack scheduled redelivery. */
    REDELIVER,

    /** Scheduling the redelivery failed; undoes REDELIVER. */
    REDELIVER_FAILED,

    /** Dead-letter routing started, either from an exhausted nack or a term. */
    ROUTE_TO_DLQ,

    /** Dead-letter routing failed or was cancelled; the message is pending again. */
    ROUTE_FAILED,

    /**
     * The dead-letter produce and the source ack both succeeded. Finalizes
     * whatever record is present, including one recreated after eviction.
     */
    DEAD_LETTERED,

    /** Natural ack. */
    FINALIZE
}
