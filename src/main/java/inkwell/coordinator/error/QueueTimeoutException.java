package inkwell.coordinator.error;

import java.time.Duration;

/**
 * No delivery became available within the dequeue timeout.
 */
public class QueueTimeoutException extends CoordinatorException {

    public QueueTimeoutException(String role, Duration timeout) {
        super("No message for " + role + " within " + timeout.toMillis() + "ms");
    }
}
