package inkwell.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import inkwell.coordinator.model.StageReport;

import java.time.Instant;
import java.util.List;

/**
 * Per-stage part of {@link RunResponse}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageResponse(
        @JsonProperty("stage") String stage,
        @JsonProperty("status") String status,
        @JsonProperty("degraded") boolean degraded,
        @JsonProperty("expectedSubjects") int expectedSubjects,
        @JsonProperty("resolvedSubjects") int resolvedSubjects,
        @JsonProperty("degradedSubjects") List<String> degradedSubjects,
        @JsonProperty("unresolvedSubjects") List<String> unresolvedSubjects,
        @JsonProperty("missingContributors") List<String> missingContributors,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("durationMs") Long durationMs) {

    public static StageResponse from(StageReport report) {
        Long duration = report.finishedAt() != null ? report.duration().toMillis() : null;
        return new StageResponse(
                report.stage().key(),
                report.status().name(),
                report.degraded(),
                report.expectedSubjects(),
                report.resolvedSubjects(),
                report.degradedSubjects(),
                report.unresolvedSubjects(),
                report.missingContributors(),
                report.startedAt(),
                report.finishedAt(),
                duration);
    }
}
