package inkwell.coordinator.repository;

import inkwell.coordinator.error.StoreUnavailableException;
import inkwell.coordinator.model.MemoryEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable tier of the shared memory store.
 * All methods throw {@link StoreUnavailableException} when the backing store cannot be reached.
 */
public interface LongTermMemoryRepository {

    /**
     * Insert or overwrite the entry for (runId, key).
     */
    void upsert(MemoryEntry entry);

    Optional<MemoryEntry> find(String runId, String key);

    /**
     * Keys of a run starting with {@code prefix}, in key order.
     */
    List<String> findKeys(String runId, String prefix);

    List<MemoryEntry> findByRun(String runId);

    /**
     * Entries of any run whose key starts with {@code prefix}, newest first.
     */
    List<MemoryEntry> recall(String prefix, int limit);

    /**
     * Drop entries written before the cutoff.
     *
     * @return number of entries deleted
     */
    int deleteOlderThan(Instant cutoff);
}
