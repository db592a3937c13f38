package net.terminus.Kafka.Config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the delivery trackers, one per declared consumer.
 * These properties can be configured in application.properties with the prefix "terminus.kafka.tracker".
 */
@ConfigurationProperties(prefix = "terminus.kafka.tracker")
public class TrackerProperties {

    /**
     * How long a finalized record is kept so duplicate deliveries are recognized.
     * Default: 10 minutes
     */
    private Duration finalizedRetention = Duration.ofMinutes(10);

    /**
     * How long a record that is still in flight survives without any transition.
     * Default: 1 hour
     */
    private Duration pendingRetention = Duration.ofHours(1);

    /**
     * Upper bound on tracked records, per consumer.
     * Default: 100000
     */
    private long maximumSize = 100_000;

    public Duration getFinalizedRetention() {
        return finalizedRetention;
    }

    public void setFinalizedRetention(Duration finalizedRetention) {
        if (finalizedRetention == null || finalizedRetention.isNegative()) {
            throw new IllegalArgumentException("finalizedRetention cannot be negative");
        }
        this.finalizedRetention = finalizedRetention;
    }

    public Duration getPendingRetention() {
        return pendingRetention;
    }

    public void setPendingRetention(Duration pendingRetention) {
        if (pendingRetention == null || pendingRetention.isNegative() || pendingRetention.isZero()) {
            throw new IllegalArgumentException("pendingRetention must be positive");
        }
        this.pendingRetention = pendingRetention;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
    }

    @Override
    public String toString() {
        return "TrackerProperties{" +
                "finalizedRetention=" + finalizedRetention +
                ", pendingRetention=" + pendingRetention +
                ", maximumSize=" + maximumSize +
                '}';
    }
}
