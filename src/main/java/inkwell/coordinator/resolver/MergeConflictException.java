package inkwell.coordinator.resolver;

/**
 * Candidate values contradict each other and cannot be combined.
 * Never escapes the resolver, which falls back to ranking.
 */
public class MergeConflictException extends Exception {

    public MergeConflictException(String message) {
        super(message);
    }

    public MergeConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
