package inkwell.coordinator.error;

/**
 * Memory store infrastructure failure. Considered transient by callers.
 */
public class StoreUnavailableException extends CoordinatorException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
