package inkwell.coordinator.scheduler;

import inkwell.coordinator.memory.MemoryStore;
import inkwell.coordinator.repository.LongTermMemoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Background task that removes expired short-term entries and long-term
 * entries older than the retention window.
 */
public class MemoryExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(MemoryExpirySweeper.class);

    private final MemoryStore store;
    private final LongTermMemoryRepository longTerm;
    private final Duration retention;
    private final Clock clock;

    public MemoryExpirySweeper(MemoryStore store, LongTermMemoryRepository longTerm, Duration retention,
            Clock clock) {
        this.store = store;
        this.longTerm = longTerm;
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * @return number of entries removed across both tiers
     */
    public int sweep() {
        Instant now = clock.instant();
        int expired = store.expireDue(now);
        int pruned = longTerm.deleteOlderThan(now.minus(retention));
        if (expired > 0 || pruned > 0) {
            log.info("Memory sweep: {} short-term expired, {} long-term past retention", expired, pruned);
        }
        return expired + pruned;
    }
}
