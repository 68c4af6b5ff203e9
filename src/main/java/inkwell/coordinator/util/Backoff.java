package inkwell.coordinator.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retry with capped exponential backoff for transient faults.
 * Retries stop after {@code maxAttempts} calls, or at a deadline when one is given.
 */
public final class Backoff {

    private static final Logger log = LoggerFactory.getLogger(Backoff.class);

    private final long baseMs;
    private final long maxMs;
    private final int maxAttempts;

    public Backoff(Duration base, Duration max, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseMs = Math.max(1L, base.toMillis());
        this.maxMs = Math.max(baseMs, max.toMillis());
        this.maxAttempts = maxAttempts;
    }

    public static Backoff defaults() {
        return new Backoff(Duration.ofMillis(50), Duration.ofSeconds(2), 5);
    }

    /**
     * Delay before the given retry (1-based), doubled per attempt with a little jitter.
     */
    public long delayMs(int attempt) {
        long backoff = baseMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxMs / 2L) {
                backoff = maxMs;
                break;
            }
            backoff *= 2L;
        }
        long jitter = ThreadLocalRandom.current().nextLong(0L, Math.max(1L, baseMs / 2L) + 1L);
        return Math.min(maxMs, backoff + jitter);
    }

    /**
     * Call {@code action}, retrying on {@code retryOn} up to the attempt limit.
     */
    public <T> T call(String what, Supplier<T> action, Class<? extends RuntimeException> retryOn)
            throws InterruptedException {
        return call(what, action, retryOn, null, Clock.systemUTC());
    }

    /**
     * Call {@code action}, retrying on {@code retryOn} until {@code giveUpAt}.
     * Without a deadline the attempt limit applies. The last failure is rethrown.
     */
    public <T> T call(String what, Supplier<T> action, Class<? extends RuntimeException> retryOn,
            Instant giveUpAt, Clock clock) throws InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryOn.isInstance(e) || exhausted(attempt, giveUpAt, clock)) {
                    throw e;
                }
                long delay = delayMs(attempt);
                if (giveUpAt != null) {
                    delay = Math.min(delay, Math.max(1L, Duration.between(clock.instant(), giveUpAt).toMillis()));
                }
                log.warn("{} failed (attempt {}): {}; retrying in {}ms", what, attempt, e.getMessage(), delay);
                Thread.sleep(delay);
            }
        }
    }

    public void run(String what, Runnable action, Class<? extends RuntimeException> retryOn)
            throws InterruptedException {
        call(what, () -> {
            action.run();
            return null;
        }, retryOn);
    }

    private boolean exhausted(int attempt, Instant giveUpAt, Clock clock) {
        if (giveUpAt != null) {
            return !clock.instant().isBefore(giveUpAt);
        }
        return attempt >= maxAttempts;
    }
}
