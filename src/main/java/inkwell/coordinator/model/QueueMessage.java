package inkwell.coordinator.model;

import java.time.Instant;

/**
 * Common view of every message that travels through the queue.
 * The set of implementations is closed: {@link TaskMessage}, {@link CompletionMessage},
 * {@link ResolutionMessage} and {@link ControlMessage}.
 */
public interface QueueMessage {

    /** Unique per message (a retry gets a new id). */
    String id();

    /** Owning pipeline run. */
    String runId();

    Instant createdAt();
}
