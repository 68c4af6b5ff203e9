package inkwell.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import inkwell.coordinator.model.QueueStats;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("activeRuns") Integer activeRuns,
        @JsonProperty("queue") QueueStats queue) {

    public static HealthResponse healthy(String uptime, String version, int activeRuns, QueueStats queue) {
        return new HealthResponse("healthy", "ok", uptime, version, activeRuns, queue);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null);
    }
}
