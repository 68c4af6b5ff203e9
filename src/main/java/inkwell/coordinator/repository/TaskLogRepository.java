package inkwell.coordinator.repository;

import inkwell.coordinator.model.TaskLogEntry;
import inkwell.coordinator.model.TaskOutcome;

import java.time.Instant;
import java.util.List;

/**
 * Audit trail of every task message a run dispatched.
 */
public interface TaskLogRepository {

    /**
     * Record a dispatched attempt.
     */
    void record(TaskLogEntry entry);

    /**
     * Set the outcome of an attempt, keyed by its message id.
     *
     * @return true if the attempt was found
     */
    boolean finish(String messageId, TaskOutcome outcome, String error, Instant finishedAt);

    /**
     * Mark every attempt of the run still in DISPATCHED as {@code outcome}.
     *
     * @return number of rows updated
     */
    int finishPending(String runId, TaskOutcome outcome, Instant finishedAt);

    /**
     * Attempts of a run in dispatch order.
     */
    List<TaskLogEntry> findByRun(String runId);

    int countByRun(String runId);
}
