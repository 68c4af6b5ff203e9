package inkwell.coordinator.agent;

import inkwell.coordinator.memory.MemoryKeys;
import inkwell.coordinator.memory.MemoryStore;
import inkwell.coordinator.model.MemoryEntry;
import inkwell.coordinator.model.MemoryTier;
import inkwell.coordinator.model.TaskMessage;

import java.util.Optional;

/**
 * What an adapter may see of the run it works for: the run's shared memory.
 */
public final class AgentContext {

    private final TaskMessage task;
    private final MemoryStore store;

    AgentContext(TaskMessage task, MemoryStore store) {
        this.task = task;
        this.store = store;
    }

    public String runId() {
        return task.runId();
    }

    public String topic() {
        return store.require(task.runId(), MemoryKeys.TOPIC);
    }

    /** Stage brief the task points at, as JSON. */
    public Optional<String> brief() {
        if (task.payloadRef() == null) {
            return Optional.empty();
        }
        return read(task.payloadRef());
    }

    public Optional<String> read(String key) {
        return store.get(task.runId(), key).map(MemoryEntry::value);
    }

    public Iterable<MemoryEntry> list(String prefix) {
        return store.list(task.runId(), prefix);
    }

    /**
     * Scratch write into the run's short-term memory, attributed to the task's role.
     */
    public void note(String key, String value) {
        store.put(task.runId(), key, value, MemoryTier.SHORT_TERM, task.targetRole());
    }
}
