package inkwell.coordinator.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable unit of work addressed to one agent role.
 * A retry never mutates a message: {@link #nextAttempt(Instant)} creates a new message
 * with a fresh id, the same logical task id and an incremented attempt count.
 */
public final class TaskMessage implements QueueMessage {
    private final String id;
    private final String taskId;
    private final String runId;
    private final Stage stage;
    private final String subject;
    private final String targetRole;
    private final String payloadRef;
    private final Instant createdAt;
    private final int attempt;

    private TaskMessage(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.runId = Objects.requireNonNull(builder.runId, "runId is required");
        this.stage = Objects.requireNonNull(builder.stage, "stage is required");
        this.subject = Objects.requireNonNull(builder.subject, "subject is required");
        this.targetRole = Objects.requireNonNull(builder.targetRole, "targetRole is required");
        this.payloadRef = builder.payloadRef;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.attempt = builder.attempt;
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
    }

    @Override
    public String id() {
        return id;
    }

    public String taskId() {
        return taskId;
    }

    @Override
    public String runId() {
        return runId;
    }

    public Stage stage() {
        return stage;
    }

    public String subject() {
        return subject;
    }

    public String targetRole() {
        return targetRole;
    }

    public String payloadRef() {
        return payloadRef;
    }

    @Override
    public Instant createdAt() {
        return createdAt;
    }

    public int attempt() {
        return attempt;
    }

    /** Successor message for a redispatch of the same logical task. */
    public TaskMessage nextAttempt(Instant now) {
        return toBuilder()
                .id(newMessageId())
                .attempt(attempt + 1)
                .createdAt(now)
                .build();
    }

    public static String newMessageId() {
        return "msg-" + UUID.randomUUID();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .taskId(taskId)
                .runId(runId)
                .stage(stage)
                .subject(subject)
                .targetRole(targetRole)
                .payloadRef(payloadRef)
                .createdAt(createdAt)
                .attempt(attempt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String taskId;
        private String runId;
        private Stage stage;
        private String subject;
        private String targetRole;
        private String payloadRef;
        private Instant createdAt;
        private int attempt = 1;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stage = stage;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder targetRole(String targetRole) {
            this.targetRole = targetRole;
            return this;
        }

        public Builder payloadRef(String payloadRef) {
            this.payloadRef = payloadRef;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public TaskMessage build() {
            if (id == null) {
                id = newMessageId();
            }
            return new TaskMessage(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskMessage that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskMessage{id='" + id + "', taskId='" + taskId + "', stage=" + stage
                + ", subject='" + subject + "', role='" + targetRole + "', attempt=" + attempt + "}";
    }
}
