package inkwell.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Reported by an agent once per task attempt.
 *
 * @param resultRef memory key holding the produced value, null on failure
 * @param error     failure description, null on success
 */
public record CompletionMessage(
        String id,
        String taskId,
        String runId,
        int attempt,
        String producingRole,
        CompletionStatus status,
        String resultRef,
        String error,
        Instant createdAt) implements QueueMessage {

    public CompletionMessage {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(taskId, "taskId is required");
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(producingRole, "producingRole is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        if (status != CompletionStatus.FAILURE && resultRef == null) {
            throw new IllegalArgumentException("resultRef is required for status " + status);
        }
    }

    public static CompletionMessage success(TaskMessage task, String resultRef, Instant at) {
        return new CompletionMessage(TaskMessage.newMessageId(), task.taskId(), task.runId(), task.attempt(),
                task.targetRole(), CompletionStatus.SUCCESS, resultRef, null, at);
    }

    public static CompletionMessage partial(TaskMessage task, String resultRef, Instant at) {
        return new CompletionMessage(TaskMessage.newMessageId(), task.taskId(), task.runId(), task.attempt(),
                task.targetRole(), CompletionStatus.PARTIAL, resultRef, null, at);
    }

    public static CompletionMessage failure(TaskMessage task, String error, Instant at) {
        return new CompletionMessage(TaskMessage.newMessageId(), task.taskId(), task.runId(), task.attempt(),
                task.targetRole(), CompletionStatus.FAILURE, null, error, at);
    }
}
