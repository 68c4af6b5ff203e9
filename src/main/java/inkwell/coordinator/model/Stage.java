package inkwell.coordinator.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pipeline stage state machine.
 * IDLE → RESEARCHING → WRITING → EDITING → OPTIMIZING → ILLUSTRATING → PUBLISHING → COMPLETED.
 * FAILED and ABORTED are run-level terminal states, see {@link RunStatus}.
 */
public enum Stage {
    IDLE,
    RESEARCHING,
    WRITING,
    EDITING,
    OPTIMIZING,
    ILLUSTRATING,
    PUBLISHING,
    COMPLETED;

    private static final List<Stage> WORK_STAGES = List.of(
            RESEARCHING, WRITING, EDITING, OPTIMIZING, ILLUSTRATING, PUBLISHING);

    /** Stages that dispatch work to agents, in pipeline order. */
    public static List<Stage> workStages() {
        return WORK_STAGES;
    }

    /** True for stages that dispatch work to agents. */
    public boolean isWorkStage() {
        return this != IDLE && this != COMPLETED;
    }

    /** The stage that follows this one, empty once COMPLETED. */
    public Optional<Stage> next() {
        return this == COMPLETED ? Optional.empty() : Optional.of(values()[ordinal() + 1]);
    }

    /** Lower-case name used in config files and memory keys. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Stage fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("stage name is required");
        }
        return Stage.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
