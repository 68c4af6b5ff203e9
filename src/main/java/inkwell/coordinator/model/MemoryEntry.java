package inkwell.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One value in the shared memory store, keyed by (runId, key) within a tier.
 *
 * @param expiresAt short-term only, null means no TTL
 */
public record MemoryEntry(
        String runId,
        String key,
        String value,
        MemoryTier tier,
        String writtenBy,
        Instant writtenAt,
        Instant expiresAt) {

    public MemoryEntry {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(tier, "tier is required");
        Objects.requireNonNull(writtenAt, "writtenAt is required");
        if (tier == MemoryTier.LONG_TERM && expiresAt != null) {
            throw new IllegalArgumentException("long-term entries do not expire");
        }
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
