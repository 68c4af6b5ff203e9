package inkwell.coordinator.monitor;

/**
 * Conditions an operator should look at.
 */
public enum AlertType {
    /** A run ended FAILED. */
    RUN_FAILED,
    /** A contributor delivered, but took longer than the configured threshold. */
    SLOW_CONTRIBUTOR
}
