package inkwell.coordinator.monitor;

import inkwell.coordinator.model.Stage;

import java.time.Instant;

/**
 * Something that happened in a run, for operators.
 *
 * @param stage  null for run-level events
 * @param role   contributing role for task events, otherwise null
 * @param detail free text, e.g. "researcher/facts attempt 2"
 */
public record PipelineEvent(String runId, EventType type, Stage stage, String role, String detail, Instant at) {
}
