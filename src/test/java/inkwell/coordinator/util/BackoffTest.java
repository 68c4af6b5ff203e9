package inkwell.coordinator.util;

import inkwell.coordinator.MutableClock;
import inkwell.coordinator.error.QueueFullException;
import inkwell.coordinator.model.Destination;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    @Test
    void delayDoublesUpToTheCap() {
        Backoff backoff = new Backoff(Duration.ofMillis(100), Duration.ofMillis(1000), 5);

        long first = backoff.delayMs(1);
        long second = backoff.delayMs(2);
        long fourth = backoff.delayMs(4);

        assertTrue(first >= 100 && first <= 150, "first=" + first);
        assertTrue(second >= 200 && second <= 250, "second=" + second);
        assertTrue(fourth >= 800 && fourth <= 850, "fourth=" + fourth);
        assertEquals(1000, backoff.delayMs(10));
    }

    @Test
    void retriesTransientFaultUntilSuccess() throws Exception {
        Backoff backoff = new Backoff(Duration.ofMillis(1), Duration.ofMillis(2), 5);
        AtomicInteger calls = new AtomicInteger();

        String result = backoff.call("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new QueueFullException(Destination.role("writer"), 10);
            }
            return "ok";
        }, QueueFullException.class);

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        Backoff backoff = new Backoff(Duration.ofMillis(1), Duration.ofMillis(2), 3);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(QueueFullException.class, () -> backoff.run("always full", () -> {
            calls.incrementAndGet();
            throw new QueueFullException(Destination.role("writer"), 10);
        }, QueueFullException.class));
        assertEquals(3, calls.get());
    }

    @Test
    void otherExceptionsAreNotRetried() {
        Backoff backoff = Backoff.defaults();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> backoff.run("broken", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        }, QueueFullException.class));
        assertEquals(1, calls.get());
    }

    @Test
    void deadlineInThePastStopsAfterOneCall() {
        MutableClock clock = MutableClock.at("2026-01-01T00:00:00Z");
        Backoff backoff = Backoff.defaults();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(QueueFullException.class, () -> backoff.call("late", () -> {
            calls.incrementAndGet();
            throw new QueueFullException(Destination.role("seo"), 1);
        }, QueueFullException.class, clock.instant().minusSeconds(1), clock));
        assertEquals(1, calls.get());
    }
}
