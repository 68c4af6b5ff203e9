package inkwell.coordinator.model;

import java.time.Instant;

/**
 * Out-of-band command broadcast to agent workers.
 */
public record ControlMessage(String id, String runId, Command command, Instant createdAt) implements QueueMessage {

    public enum Command {
        /** Tasks of the run are stale; workers may drop them */
        ABORT,
        /** Worker should leave its loop */
        SHUTDOWN
    }

    public static ControlMessage abort(String runId, Instant at) {
        return new ControlMessage(TaskMessage.newMessageId(), runId, Command.ABORT, at);
    }

    public static ControlMessage shutdown(Instant at) {
        return new ControlMessage(TaskMessage.newMessageId(), "*", Command.SHUTDOWN, at);
    }
}
