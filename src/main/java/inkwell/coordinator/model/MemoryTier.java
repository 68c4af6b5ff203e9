package inkwell.coordinator.model;

/**
 * Memory store tier.
 */
public enum MemoryTier {
    /** Run-scoped, bounded by capacity and TTL, dropped when the run ends */
    SHORT_TERM,
    /** Durable across runs, never evicted silently */
    LONG_TERM
}
