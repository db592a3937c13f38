package net.terminus.Kafka.Config;

//BACKOFF STRATEGY FOR NACK DELAYS AND DEAD LETTER PRODUCE RETRIES
public enum DelayMethod {
    FIXED,
    LINEAR,
    EXPO,
    JITTER
}
