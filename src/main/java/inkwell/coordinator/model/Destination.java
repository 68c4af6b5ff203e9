package inkwell.coordinator.model;

import java.util.Objects;

/**
 * Address of a message: a single role (point-to-point) or a topic (broadcast to subscribers).
 */
public record Destination(Kind kind, String name) {

    public enum Kind {
        ROLE,
        TOPIC
    }

    /** Topic carrying {@link ResolutionMessage}s. */
    public static final String RESOLUTIONS_TOPIC = "resolutions";

    /** Topic carrying {@link ControlMessage}s for agent workers. */
    public static final String CONTROL_TOPIC = "control";

    public Destination {
        Objects.requireNonNull(kind, "kind is required");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("destination name is required");
        }
    }

    public static Destination role(String role) {
        return new Destination(Kind.ROLE, role);
    }

    public static Destination topic(String topic) {
        return new Destination(Kind.TOPIC, topic);
    }

    /** Role destination on which the control loop of a run collects completions. */
    public static Destination scheduler(String runId) {
        return role("scheduler/" + runId);
    }

    public boolean isTopic() {
        return kind == Kind.TOPIC;
    }

    @Override
    public String toString() {
        return (kind == Kind.ROLE ? "role:" : "topic:") + name;
    }
}
