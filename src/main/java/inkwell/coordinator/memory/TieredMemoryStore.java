package inkwell.coordinator.memory;

import inkwell.coordinator.model.MemoryEntry;
import inkwell.coordinator.model.MemoryTier;
import inkwell.coordinator.repository.LongTermMemoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Memory store with an in-process short-term tier in front of a durable long-term repository.
 */
public class TieredMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(TieredMemoryStore.class);

    private final ShortTermTier shortTerm;
    private final LongTermMemoryRepository longTerm;
    private final Duration shortTermTtl;
    private final Clock clock;

    public TieredMemoryStore(LongTermMemoryRepository longTerm, int shortTermCapacity, Duration shortTermTtl) {
        this(longTerm, shortTermCapacity, shortTermTtl, Clock.systemUTC());
    }

    /**
     * @param shortTermTtl lifetime of short-term entries, {@code null} or zero for no expiry
     */
    public TieredMemoryStore(LongTermMemoryRepository longTerm, int shortTermCapacity, Duration shortTermTtl,
            Clock clock) {
        this.shortTerm = new ShortTermTier(shortTermCapacity);
        this.longTerm = Objects.requireNonNull(longTerm, "longTerm");
        this.shortTermTtl = shortTermTtl == null || shortTermTtl.isZero() ? null : shortTermTtl;
        this.clock = clock;
    }

    @Override
    public MemoryEntry put(String runId, String key, String value, MemoryTier tier, String writtenBy) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId is required");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is required");
        }
        Instant now = clock.instant();
        if (tier == MemoryTier.SHORT_TERM) {
            Instant expiresAt = shortTermTtl == null ? null : now.plus(shortTermTtl);
            MemoryEntry entry = new MemoryEntry(runId, key, value, tier, writtenBy, now, expiresAt);
            shortTerm.put(entry);
            log.debug("Stored short-term {}/{} by {}", runId, key, writtenBy);
            return entry;
        }
        MemoryEntry entry = new MemoryEntry(runId, key, value, tier, writtenBy, now, null);
        longTerm.upsert(entry);
        log.debug("Stored long-term {}/{} by {}", runId, key, writtenBy);
        return entry;
    }

    @Override
    public Optional<MemoryEntry> get(String runId, String key) {
        Optional<MemoryEntry> entry = shortTerm.get(runId, key, clock.instant());
        if (entry.isPresent()) {
            return entry;
        }
        return longTerm.find(runId, key);
    }

    @Override
    public Iterable<MemoryEntry> list(String runId, String prefix) {
        String effectivePrefix = prefix == null ? "" : prefix;
        return () -> new EntryIterator(runId, snapshotKeys(runId, effectivePrefix));
    }

    @Override
    public List<MemoryEntry> recall(String prefix, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return longTerm.recall(prefix == null ? "" : prefix, limit);
    }

    @Override
    public MemorySummary summarize(String runId) {
        Instant now = clock.instant();
        TreeMap<String, Integer> writers = new TreeMap<>();
        List<MemoryEntry> shortEntries = shortTerm.entries(runId, now);
        List<MemoryEntry> longEntries = longTerm.findByRun(runId);
        for (MemoryEntry e : shortEntries) {
            writers.merge(writerOf(e), 1, Integer::sum);
        }
        for (MemoryEntry e : longEntries) {
            writers.merge(writerOf(e), 1, Integer::sum);
        }
        return new MemorySummary(runId, shortEntries.size(), longEntries.size(), shortTerm.evictions(runId),
                writers);
    }

    @Override
    public void endRun(String runId) {
        int dropped = shortTerm.size(runId);
        shortTerm.drop(runId);
        log.info("Released short-term memory of run {} ({} entries)", runId, dropped);
    }

    @Override
    public int expireDue(Instant now) {
        int removed = shortTerm.expire(now);
        if (removed > 0) {
            log.debug("Expired {} short-term entries", removed);
        }
        return removed;
    }

    private TreeSet<String> snapshotKeys(String runId, String prefix) {
        TreeSet<String> keys = new TreeSet<>(shortTerm.keys(runId, prefix, clock.instant()));
        keys.addAll(longTerm.findKeys(runId, prefix));
        return keys;
    }

    private static String writerOf(MemoryEntry entry) {
        return entry.writtenBy() == null ? "unknown" : entry.writtenBy();
    }

    /**
     * Walks a key snapshot and reads each value on demand; keys removed meanwhile are skipped.
     */
    private final class EntryIterator implements Iterator<MemoryEntry> {
        private final String runId;
        private final Iterator<String> keys;
        private MemoryEntry next;

        EntryIterator(String runId, TreeSet<String> keys) {
            this.runId = runId;
            this.keys = keys.iterator();
        }

        @Override
        public boolean hasNext() {
            while (next == null && keys.hasNext()) {
                next = get(runId, keys.next()).orElse(null);
            }
            return next != null;
        }

        @Override
        public MemoryEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            MemoryEntry result = next;
            next = null;
            return result;
        }
    }
}
