package net.terminus.Kafka.Policy;

public enum RedeliveryDecision {
    REDELIVER,
    ROUTE_TO_DLQ
}
