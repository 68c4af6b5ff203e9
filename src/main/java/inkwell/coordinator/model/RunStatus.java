package inkwell.coordinator.model;

/**
 * Overall status of a pipeline run.
 */
public enum RunStatus {
    /** Control loop is active */
    RUNNING,
    /** Every stage finished (possibly degraded) */
    COMPLETED,
    /** Too many subjects of a stage could not be resolved, or infrastructure failed */
    FAILED,
    /** Cancelled by an operator; never resumed */
    ABORTED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
