package inkwell.coordinator.model;

/**
 * Outcome reported by an agent for one task attempt.
 */
public enum CompletionStatus {
    SUCCESS,
    /** Result usable but incomplete; counts as a candidate and degrades the stage */
    PARTIAL,
    FAILURE
}
