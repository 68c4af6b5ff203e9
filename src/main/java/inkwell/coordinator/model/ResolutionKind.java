package inkwell.coordinator.model;

/**
 * Which rule of the resolution policy produced the authoritative value.
 */
public enum ResolutionKind {
    /** Only one eligible candidate */
    SINGLE,
    /** Highest ranked producing role */
    PRIORITY,
    /** Ranks tied, most recent candidate (then task id) */
    RECENCY,
    /** Non-contradictory fields of several candidates combined */
    MERGED
}
