package inkwell.coordinator.monitor;

/**
 * Task outcomes of one role within a run. A failed attempt that was retried counts as a failure.
 */
public record RolePerformance(String role, int succeeded, int failed, int missing) {

    public int outcomes() {
        return succeeded + failed + missing;
    }

    /** Share of outcomes that delivered a result; 0 when the role reported nothing. */
    public double successRate() {
        return outcomes() == 0 ? 0.0 : (double) succeeded / outcomes();
    }

    public double errorRate() {
        return outcomes() == 0 ? 0.0 : (double) (failed + missing) / outcomes();
    }

    RolePerformance plus(EventType type) {
        return switch (type) {
            case TASK_SUCCEEDED -> new RolePerformance(role, succeeded + 1, failed, missing);
            case TASK_FAILED -> new RolePerformance(role, succeeded, failed + 1, missing);
            case CONTRIBUTOR_MISSING -> new RolePerformance(role, succeeded, failed, missing + 1);
            default -> this;
        };
    }
}
