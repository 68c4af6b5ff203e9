package inkwell.coordinator.model;

/**
 * Audit outcome of a dispatched task attempt.
 */
public enum TaskOutcome {
    DISPATCHED,
    SUCCESS,
    PARTIAL,
    /** Agent reported failure; a retry may follow */
    FAILURE,
    /** No usable completion before the stage deadline or queue stayed full */
    MISSING,
    /** Run aborted while the attempt was pending */
    STALE
}
