package inkwell.coordinator.model;

import java.time.Instant;

/**
 * A competing result for a subject, with its provenance.
 *
 * @param resultRef memory key of the produced value
 * @param partial   reported with {@link CompletionStatus#PARTIAL}
 */
public record Candidate(
        String taskId,
        int attempt,
        String role,
        String resultRef,
        Instant producedAt,
        boolean partial) {

    public static Candidate of(CompletionMessage completion) {
        return new Candidate(completion.taskId(), completion.attempt(), completion.producingRole(),
                completion.resultRef(), completion.createdAt(),
                completion.status() == CompletionStatus.PARTIAL);
    }

    /** Identity used to drop duplicate (redelivered) completions. */
    public String identity() {
        return taskId + "#" + attempt;
    }
}
