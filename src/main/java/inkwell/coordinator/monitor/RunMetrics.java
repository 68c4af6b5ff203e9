package inkwell.coordinator.monitor;

import inkwell.coordinator.model.Stage;

import java.time.Duration;
import java.util.Map;

/**
 * Counters derived from a run's event log.
 */
public record RunMetrics(
        String runId,
        int events,
        int tasksDispatched,
        int retries,
        int missingContributors,
        int resolutions,
        int degradedStages,
        int alerts,
        Map<Stage, Duration> stageDurations,
        Map<String, RolePerformance> roles) {

    public RunMetrics {
        stageDurations = Map.copyOf(stageDurations);
        roles = Map.copyOf(roles);
    }
}
