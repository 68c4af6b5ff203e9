package inkwell.coordinator.memory;

import inkwell.coordinator.model.MemoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * Bounded per-run working memory.
 * Each run holds at most {@code capacity} entries; writing a new key to a full run evicts the
 * entry that was least recently written. Reads do not refresh an entry.
 */
final class ShortTermTier {

    private static final Logger log = LoggerFactory.getLogger(ShortTermTier.class);

    private final int capacity;
    private final Map<String, LinkedHashMap<String, MemoryEntry>> runs = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> evictions = new ConcurrentHashMap<>();

    ShortTermTier(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("short-term capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    void put(MemoryEntry entry) {
        // compute keeps the write atomic with expire() dropping an emptied run
        runs.compute(entry.runId(), (runId, run) -> {
            LinkedHashMap<String, MemoryEntry> target = run != null ? run : new LinkedHashMap<>();
            synchronized (target) {
                // re-insert so the entry moves to the most recently written position
                target.remove(entry.key());
                target.put(entry.key(), entry);
                Iterator<String> eldest = target.keySet().iterator();
                while (target.size() > capacity) {
                    String evicted = eldest.next();
                    eldest.remove();
                    evictions.computeIfAbsent(runId, r -> new LongAdder()).increment();
                    log.debug("Evicted short-term entry {} of run {}", evicted, runId);
                }
            }
            return target;
        });
    }

    Optional<MemoryEntry> get(String runId, String key, Instant now) {
        LinkedHashMap<String, MemoryEntry> run = runs.get(runId);
        if (run == null) {
            return Optional.empty();
        }
        synchronized (run) {
            MemoryEntry entry = run.get(key);
            if (entry == null || entry.isExpired(now)) {
                return Optional.empty();
            }
            return Optional.of(entry);
        }
    }

    List<String> keys(String runId, String prefix, Instant now) {
        LinkedHashMap<String, MemoryEntry> run = runs.get(runId);
        if (run == null) {
            return List.of();
        }
        synchronized (run) {
            return run.values().stream()
                    .filter(e -> e.key().startsWith(prefix) && !e.isExpired(now))
                    .map(MemoryEntry::key)
                    .collect(Collectors.toList());
        }
    }

    List<MemoryEntry> entries(String runId, Instant now) {
        LinkedHashMap<String, MemoryEntry> run = runs.get(runId);
        if (run == null) {
            return List.of();
        }
        synchronized (run) {
            return run.values().stream().filter(e -> !e.isExpired(now)).collect(Collectors.toList());
        }
    }

    int size(String runId) {
        LinkedHashMap<String, MemoryEntry> run = runs.get(runId);
        if (run == null) {
            return 0;
        }
        synchronized (run) {
            return run.size();
        }
    }

    long evictions(String runId) {
        LongAdder adder = evictions.get(runId);
        return adder == null ? 0 : adder.sum();
    }

    void drop(String runId) {
        runs.remove(runId);
        evictions.remove(runId);
    }

    /**
     * Remove expired entries of every run; a run left without entries is forgotten.
     */
    int expire(Instant now) {
        int[] removed = {0};
        for (String runId : runs.keySet()) {
            runs.computeIfPresent(runId, (id, run) -> {
                synchronized (run) {
                    Iterator<MemoryEntry> it = run.values().iterator();
                    while (it.hasNext()) {
                        if (it.next().isExpired(now)) {
                            it.remove();
                            removed[0]++;
                        }
                    }
                    if (run.isEmpty()) {
                        evictions.remove(id);
                        return null;
                    }
                    return run;
                }
            });
        }
        return removed[0];
    }

    int runCount() {
        return runs.size();
    }
}
