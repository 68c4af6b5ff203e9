package inkwell.coordinator.model;

import java.time.Instant;

/**
 * Published once a subject has an authoritative value.
 */
public record ResolutionMessage(
        String id,
        String runId,
        Stage stage,
        String subject,
        String winnerRole,
        String resolvedRef,
        ResolutionKind kind,
        Instant createdAt) implements QueueMessage {

    public static ResolutionMessage of(String runId, ResolutionOutcome outcome) {
        return new ResolutionMessage(TaskMessage.newMessageId(), runId, outcome.stage(), outcome.subject(),
                outcome.winnerRole(), outcome.resolvedRef(), outcome.kind(), outcome.resolvedAt());
    }
}
