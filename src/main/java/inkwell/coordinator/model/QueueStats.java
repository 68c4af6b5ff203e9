package inkwell.coordinator.model;

import java.util.Map;

/**
 * Snapshot of queue counters, used for backpressure decisions and the health endpoint.
 */
public record QueueStats(
        int depth,
        int inFlight,
        long enqueued,
        long dequeued,
        long acked,
        long redelivered,
        long rejected,
        Map<String, Integer> depthByDestination) {

    public QueueStats {
        depthByDestination = Map.copyOf(depthByDestination);
    }
}
