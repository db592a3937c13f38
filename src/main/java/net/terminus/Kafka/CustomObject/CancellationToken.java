package net.terminus.Kafka.CustomObject;

import net.terminus.Kafka.Errors.RoutingCancelledException;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-supplied deadline and cancellation flag for dead-letter routing.
 * Bounds every network call the router makes on behalf of one ack/nack/term.
 */
public final class CancellationToken {

    @Nullable
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationToken(@Nullable Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken none() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(deadline, clock);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /**
     * Time left for the next call, never more than {@code cap}.
     */
    public Duration remaining(Duration cap) {
        if (deadline == null) {
            return cap;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        if (left.isNegative()) {
            return Duration.ZERO;
        }
        return left.compareTo(cap) < 0 ? left : cap;
    }

    public void throwIfCancelled(@Nullable MessageId messageId, String operation) {
        if (isCancelled()) {
            throw new RoutingCancelledException(messageId, operation + " cancelled for message " + messageId);
        }
    }
}
