package net.terminus.Kafka.Tracing;

/**
 * A redelivery or dead-letter span, independent of the tracing backend.
 */
public interface TracingSpan {

    TracingSpan setAttribute(String key, String value);

    /**
     * Number of produce calls it took to land the dead-letter copy.
     */
    TracingSpan setProduceAttempts(int attempts);

    /**
     * Marks the span failed with the given cause.
     */
    TracingSpan recordException(Throwable exception);

    TracingSpan setSuccess();

    void end();
}
