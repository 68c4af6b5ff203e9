package inkwell.coordinator.memory;

import inkwell.coordinator.model.Stage;

/**
 * Key layout inside a run's memory.
 */
public final class MemoryKeys {

    public static final String TOPIC = "input/topic";

    /** Prefix of every authoritative value. */
    public static final String RESOLVED_PREFIX = "resolved/";

    private MemoryKeys() {
    }

    public static String candidate(Stage stage, String subject, String role, int attempt) {
        return "candidate/" + stage.key() + "/" + subject + "/" + role + "/" + attempt;
    }

    public static String resolved(Stage stage, String subject) {
        return RESOLVED_PREFIX + stage.key() + "/" + subject;
    }

    public static String brief(Stage stage) {
        return "brief/" + stage.key();
    }
}
