package net.terminus;

import net.terminus.Kafka.Config.BackoffCalculator;
import net.terminus.Kafka.Config.DelayMethod;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffCalculatorTest {

    private final BackoffCalculator calculator = new BackoffCalculator();
    private final Duration base = Duration.ofMillis(100);
    private final Duration max = Duration.ofSeconds(5);

    @Test
    void testFixedDelayIgnoresAttempt() {
        assertEquals(base, calculator.delayFor(DelayMethod.FIXED, base, max, 1));
        assertEquals(base, calculator.delayFor(DelayMethod.FIXED, base, max, 9));
    }

    @Test
    void testLinearDelay() {
        assertEquals(Duration.ofMillis(300), calculator.delayFor(DelayMethod.LINEAR, base, max, 3));
    }

    @Test
    void testExponentialDelay() {
        assertEquals(Duration.ofMillis(100), calculator.delayFor(DelayMethod.EXPO, base, max, 1));
        assertEquals(Duration.ofMillis(200), calculator.delayFor(DelayMethod.EXPO, base, max, 2));
        assertEquals(Duration.ofMillis(800), calculator.delayFor(DelayMethod.EXPO, base, max, 4));
    }

    @Test
    void testExponentialDelay_MaxCap() {
        assertEquals(max, calculator.delayFor(DelayMethod.EXPO, base, max, 60));
        assertEquals(max, calculator.delayFor(DelayMethod.LINEAR, base, max, 1_000));
    }

    @Test
    void testJitterStaysWithinBounds() {
        for (int i = 0; i < 100; i++) {
            long delayMs = calculator.delayFor(DelayMethod.JITTER, base, max, 3).toMillis();
            assertTrue(delayMs >= 300 && delayMs <= 500, "Jittered delay should be 400ms +-25%, was: " + delayMs);
        }
    }

    @Test
    void testAttemptZeroTreatedAsFirst() {
        assertEquals(base, calculator.delayFor(DelayMethod.LINEAR, base, max, 0));
        assertEquals(base, calculator.delayFor(DelayMethod.EXPO, base, max, 0));
    }
}
