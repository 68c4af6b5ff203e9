package inkwell.coordinator.error;

import inkwell.coordinator.model.Stage;

/**
 * Every candidate for a subject was rejected by policy, so no authoritative value exists.
 */
public class ResolutionConflictUnresolvableException extends CoordinatorException {

    private final Stage stage;
    private final String subject;

    public ResolutionConflictUnresolvableException(Stage stage, String subject, String reason) {
        super("Cannot resolve " + stage.key() + "/" + subject + ": " + reason);
        this.stage = stage;
        this.subject = subject;
    }

    public Stage stage() {
        return stage;
    }

    public String subject() {
        return subject;
    }
}
