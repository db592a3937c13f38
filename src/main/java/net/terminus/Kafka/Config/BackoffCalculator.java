package net.terminus.Kafka.Config;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Calculates delays for the different backoff strategies. Used for the delay
 * before a nacked message is redelivered and between dead-letter produce attempts.
 */
public class BackoffCalculator {

    // 2^5, keeps the multiplier from overflowing
    private static final long MAX_MULTIPLIER = 32;

    /**
     * Delay before the given attempt.
     *
     * @param method   the backoff strategy
     * @param base     delay of the first attempt
     * @param max      upper bound for any computed delay
     * @param attempt  1-based attempt number
     * @return the delay, never negative and never above {@code max}
     */
    public Duration delayFor(DelayMethod method, Duration base, Duration max, int attempt) {
        int safeAttempt = Math.max(1, attempt);
        long baseMs = base.toMillis();

        long delayMs = switch (method) {
            case FIXED -> baseMs;
            case LINEAR -> baseMs * safeAttempt;
            case EXPO -> exponential(baseMs, safeAttempt);
            case JITTER -> withJitter(exponential(baseMs, safeAttempt));
        };

        return Duration.ofMillis(Math.max(0, Math.min(delayMs, max.toMillis())));
    }

    /**
     * Exponential backoff: baseDelay * 2^(attempt - 1)
     */
    private long exponential(long baseMs, int attempt) {
        long multiplier = Math.min((long) Math.pow(2, attempt - 1), MAX_MULTIPLIER);
        return baseMs * multiplier;
    }

    /**
     * Add jitter to prevent thundering herd problem: +-25% randomness
     */
    private long withJitter(long delayMs) {
        double jitterFactor = 0.75 + (ThreadLocalRandom.current().nextDouble() * 0.5);
        return (long) (delayMs * jitterFactor);
    }
}
