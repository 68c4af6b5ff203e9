package inkwell.coordinator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one stage of a run.
 *
 * @param degradedSubjects    resolved with missing contributors or partial results, or left empty
 * @param unresolvedSubjects  no authoritative value could be produced
 * @param missingContributors "role:subject" pairs that never delivered a usable result
 */
public record StageReport(
        Stage stage,
        StageStatus status,
        int expectedSubjects,
        int resolvedSubjects,
        List<String> degradedSubjects,
        List<String> unresolvedSubjects,
        List<String> missingContributors,
        Instant startedAt,
        Instant finishedAt) {

    public StageReport {
        degradedSubjects = List.copyOf(degradedSubjects);
        unresolvedSubjects = List.copyOf(unresolvedSubjects);
        missingContributors = List.copyOf(missingContributors);
    }

    public static StageReport pending(Stage stage) {
        return new StageReport(stage, StageStatus.PENDING, 0, 0, List.of(), List.of(), List.of(), null, null);
    }

    public StageReport withStatus(StageStatus newStatus, Instant at) {
        Instant finished = newStatus.isFinished() ? at : finishedAt;
        Instant started = startedAt == null && newStatus == StageStatus.ACTIVE ? at : startedAt;
        return new StageReport(stage, newStatus, expectedSubjects, resolvedSubjects, degradedSubjects,
                unresolvedSubjects, missingContributors, started, finished);
    }

    public boolean degraded() {
        return status == StageStatus.DEGRADED;
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
