package inkwell.coordinator.agent;

/**
 * Value produced by an adapter for one task attempt.
 *
 * @param partial the agent finished but knows its output is incomplete
 */
public record AgentResult(String value, boolean partial) {

    public AgentResult {
        if (value == null) {
            throw new IllegalArgumentException("result value is required");
        }
    }

    public static AgentResult complete(String value) {
        return new AgentResult(value, false);
    }

    public static AgentResult partial(String value) {
        return new AgentResult(value, true);
    }
}
