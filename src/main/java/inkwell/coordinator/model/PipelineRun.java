package inkwell.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one execution of the pipeline for a topic.
 * Instances are immutable; the scheduler publishes a new snapshot on every transition.
 */
public final class PipelineRun {
    private final String runId;
    private final String topic;
    private final RunOptions options;
    private final String configSnapshot;
    private final Stage currentStage;
    private final RunStatus status;
    private final Map<Stage, StageReport> stages;
    private final String failureReason;
    private final Instant createdAt;
    private final Instant finishedAt;

    private PipelineRun(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "runId is required");
        this.topic = Objects.requireNonNull(builder.topic, "topic is required");
        this.options = builder.options != null ? builder.options : RunOptions.none();
        this.configSnapshot = builder.configSnapshot;
        this.currentStage = builder.currentStage != null ? builder.currentStage : Stage.IDLE;
        this.status = builder.status != null ? builder.status : RunStatus.RUNNING;
        EnumMap<Stage, StageReport> copy = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.workStages()) {
            copy.put(stage, builder.stages.getOrDefault(stage, StageReport.pending(stage)));
        }
        this.stages = Collections.unmodifiableMap(copy);
        this.failureReason = builder.failureReason;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.finishedAt = builder.finishedAt;
    }

    public String runId() {
        return runId;
    }

    public String topic() {
        return topic;
    }

    public RunOptions options() {
        return options;
    }

    /** Configuration the run was started with, as JSON. */
    public String configSnapshot() {
        return configSnapshot;
    }

    public Stage currentStage() {
        return currentStage;
    }

    public RunStatus status() {
        return status;
    }

    /** Report per work stage, in pipeline order. */
    public Map<Stage, StageReport> stages() {
        return stages;
    }

    public StageReport stage(Stage stage) {
        return stages.get(stage);
    }

    public String failureReason() {
        return failureReason;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** True if any stage finished degraded. */
    public boolean degraded() {
        return stages.values().stream().anyMatch(StageReport::degraded);
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .runId(runId)
                .topic(topic)
                .options(options)
                .configSnapshot(configSnapshot)
                .currentStage(currentStage)
                .status(status)
                .failureReason(failureReason)
                .createdAt(createdAt)
                .finishedAt(finishedAt);
        b.stages.putAll(stages);
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String runId;
        private String topic;
        private RunOptions options;
        private String configSnapshot;
        private Stage currentStage;
        private RunStatus status;
        private final Map<Stage, StageReport> stages = new EnumMap<>(Stage.class);
        private String failureReason;
        private Instant createdAt;
        private Instant finishedAt;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder topic(String topic) {
            this.topic = topic;
            return this;
        }

        public Builder options(RunOptions options) {
            this.options = options;
            return this;
        }

        public Builder configSnapshot(String configSnapshot) {
            this.configSnapshot = configSnapshot;
            return this;
        }

        public Builder currentStage(Stage currentStage) {
            this.currentStage = currentStage;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder stage(StageReport report) {
            this.stages.put(report.stage(), report);
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public PipelineRun build() {
            return new PipelineRun(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PipelineRun that))
            return false;
        return Objects.equals(runId, that.runId)
                && status == that.status
                && currentStage == that.currentStage
                && Objects.equals(stages, that.stages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, status, currentStage);
    }

    @Override
    public String toString() {
        return "PipelineRun{runId='" + runId + "', stage=" + currentStage + ", status=" + status
                + ", degraded=" + degraded() + "}";
    }
}
