package inkwell.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import inkwell.coordinator.model.PipelineRun;
import inkwell.coordinator.monitor.RunMetrics;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for run details.
 * GET /api/v1/runs/{runId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        @JsonProperty("runId") String runId,
        @JsonProperty("topic") String topic,
        @JsonProperty("styleGuide") String styleGuide,
        @JsonProperty("targetLength") Integer targetLength,
        @JsonProperty("status") String status,
        @JsonProperty("currentStage") String currentStage,
        @JsonProperty("degraded") boolean degraded,
        @JsonProperty("failureReason") String failureReason,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("stages") List<StageResponse> stages,
        @JsonProperty("metrics") RunMetrics metrics) {

    public static RunResponse from(PipelineRun run, RunMetrics metrics) {
        List<StageResponse> stages = run.stages().values().stream()
                .map(StageResponse::from)
                .toList();
        return new RunResponse(
                run.runId(),
                run.topic(),
                run.options().styleGuide(),
                run.options().targetLength(),
                run.status().name(),
                run.currentStage().key(),
                run.degraded(),
                run.failureReason(),
                run.createdAt(),
                run.finishedAt(),
                stages,
                metrics);
    }

    /** Compact version returned right after a run is started. */
    public static RunResponse started(PipelineRun run) {
        return new RunResponse(run.runId(), run.topic(), run.options().styleGuide(), run.options().targetLength(),
                run.status().name(), run.currentStage().key(), false, null, run.createdAt(), null, null, null);
    }
}
