package inkwell.coordinator.model;

import java.time.Instant;

/**
 * Audit row for one dispatched task message.
 */
public record TaskLogEntry(
        String messageId,
        String taskId,
        String runId,
        Stage stage,
        String role,
        String subject,
        int attempt,
        TaskOutcome outcome,
        String error,
        Instant dispatchedAt,
        Instant finishedAt) {

    public static TaskLogEntry dispatched(TaskMessage task) {
        return new TaskLogEntry(task.id(), task.taskId(), task.runId(), task.stage(), task.targetRole(),
                task.subject(), task.attempt(), TaskOutcome.DISPATCHED, null, task.createdAt(), null);
    }
}
