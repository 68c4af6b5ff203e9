package inkwell.coordinator.model;

import java.time.Instant;
import java.util.List;

/**
 * Authoritative result of a subject for one stage.
 *
 * @param resolvedRef   memory key holding the authoritative value
 * @param winnerRef     result reference of the winning candidate (first ranked one when merged)
 * @param contributors  roles whose candidates went into the outcome
 * @param rejectedRoles roles whose candidates were rejected by policy
 */
public record ResolutionOutcome(
        Stage stage,
        String subject,
        ResolutionKind kind,
        String winnerRole,
        String winnerRef,
        String resolvedRef,
        String value,
        List<String> contributors,
        List<String> rejectedRoles,
        Instant resolvedAt) {

    public ResolutionOutcome {
        contributors = List.copyOf(contributors);
        rejectedRoles = List.copyOf(rejectedRoles);
    }
}
