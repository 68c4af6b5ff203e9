package inkwell.coordinator.monitor;

public enum EventType {
    RUN_STARTED,
    STAGE_STARTED,
    STAGE_FINISHED,
    TASK_DISPATCHED,
    TASK_RETRIED,
    TASK_SUCCEEDED,
    TASK_FAILED,
    CONTRIBUTOR_MISSING,
    RESOLUTION,
    ALERT,
    ABORT_REQUESTED,
    RUN_FINISHED
}
