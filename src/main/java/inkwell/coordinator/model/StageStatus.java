package inkwell.coordinator.model;

/**
 * Status of a single stage within a run.
 */
public enum StageStatus {
    PENDING,
    ACTIVE,
    /** All subjects resolved with complete candidate sets */
    COMPLETED,
    /** Finished, but some subjects had missing contributors or partial results */
    DEGRADED,
    /** Unresolved fraction reached the failure threshold */
    FAILED,
    /** No roster configured for the stage */
    SKIPPED,
    ABORTED;

    public boolean isFinished() {
        return this != PENDING && this != ACTIVE;
    }
}
