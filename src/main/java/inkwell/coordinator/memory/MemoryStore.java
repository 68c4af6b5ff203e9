package inkwell.coordinator.memory;

import inkwell.coordinator.error.MemoryNotFoundException;
import inkwell.coordinator.error.StoreUnavailableException;
import inkwell.coordinator.model.MemoryEntry;
import inkwell.coordinator.model.MemoryTier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Shared memory readable and writable by all agents of a run.
 * Entries are isolated by run id; within a run a key is unique per tier and
 * the last writer wins. There is no read-modify-write atomicity.
 */
public interface MemoryStore {

    /**
     * Atomic overwrite of a single key.
     *
     * @throws StoreUnavailableException on infrastructure failure
     */
    MemoryEntry put(String runId, String key, String value, MemoryTier tier, String writtenBy);

    /**
     * Short-term entries shadow long-term ones with the same key.
     */
    Optional<MemoryEntry> get(String runId, String key);

    /**
     * Value of a mandatory entry.
     *
     * @throws MemoryNotFoundException if the key is absent
     */
    default String require(String runId, String key) {
        return get(runId, key)
                .map(MemoryEntry::value)
                .orElseThrow(() -> new MemoryNotFoundException(runId, key));
    }

    /**
     * Entries of a run whose key starts with {@code prefix}, ordered by key.
     * The result is lazy: values are read while iterating, and each call to
     * {@code iterator()} starts over from the current contents.
     */
    Iterable<MemoryEntry> list(String runId, String prefix);

    /**
     * Long-term entries across runs whose key starts with {@code prefix}, newest first.
     */
    List<MemoryEntry> recall(String prefix, int limit);

    MemorySummary summarize(String runId);

    /**
     * Drop the short-term tier of a run. Long-term entries are kept.
     */
    void endRun(String runId);

    /**
     * Remove short-term entries whose TTL elapsed.
     *
     * @return number of entries removed
     */
    int expireDue(Instant now);
}
