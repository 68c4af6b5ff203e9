package inkwell.coordinator.error;

public class MemoryNotFoundException extends CoordinatorException {

    public MemoryNotFoundException(String runId, String key) {
        super("No memory entry '" + key + "' in run " + runId);
    }
}
