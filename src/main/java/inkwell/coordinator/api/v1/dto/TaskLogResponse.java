package inkwell.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import inkwell.coordinator.model.TaskLogEntry;

import java.time.Instant;

/**
 * One row of GET /api/v1/runs/{runId}/tasks.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskLogResponse(
        @JsonProperty("messageId") String messageId,
        @JsonProperty("taskId") String taskId,
        @JsonProperty("stage") String stage,
        @JsonProperty("role") String role,
        @JsonProperty("subject") String subject,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("error") String error,
        @JsonProperty("dispatchedAt") Instant dispatchedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static TaskLogResponse from(TaskLogEntry entry) {
        return new TaskLogResponse(
                entry.messageId(),
                entry.taskId(),
                entry.stage().key(),
                entry.role(),
                entry.subject(),
                entry.attempt(),
                entry.outcome().name(),
                entry.error(),
                entry.dispatchedAt(),
                entry.finishedAt());
    }
}
