package inkwell.coordinator.error;

/**
 * Base of all coordinator failures. Unchecked; callers decide which kinds they retry.
 */
public class CoordinatorException extends RuntimeException {

    public CoordinatorException(String message) {
        super(message);
    }

    public CoordinatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
