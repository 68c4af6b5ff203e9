package inkwell.coordinator.error;

import inkwell.coordinator.model.Destination;

/**
 * Destination reached its capacity; the message was not enqueued.
 */
public class QueueFullException extends CoordinatorException {

    private final Destination destination;

    public QueueFullException(Destination destination, int capacity) {
        super("Queue full for " + destination + " (capacity " + capacity + ")");
        this.destination = destination;
    }

    public Destination destination() {
        return destination;
    }
}
