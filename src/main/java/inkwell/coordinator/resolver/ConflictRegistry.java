package inkwell.coordinator.resolver;

import inkwell.coordinator.model.Candidate;
import inkwell.coordinator.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Conflict records of all active runs.
 */
public class ConflictRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConflictRegistry.class);

    private final Map<String, ConflictRecord> records = new ConcurrentHashMap<>();

    /**
     * Add a candidate, opening the record on first use.
     *
     * @return false if the same task attempt was already submitted
     */
    public boolean submit(String runId, Stage stage, String subject, Candidate candidate) {
        ConflictRecord record = records.computeIfAbsent(key(runId, stage, subject),
                k -> new ConflictRecord(runId, stage, subject));
        boolean added = record.add(candidate);
        if (!added) {
            log.debug("Duplicate candidate {} for {}", candidate.identity(), record);
        }
        return added;
    }

    public Optional<ConflictRecord> find(String runId, Stage stage, String subject) {
        return Optional.ofNullable(records.get(key(runId, stage, subject)));
    }

    public List<ConflictRecord> findByRun(String runId) {
        return records.values().stream()
                .filter(r -> r.runId().equals(runId))
                .collect(Collectors.toList());
    }

    /**
     * Forget all records of a finished run.
     */
    public int clearRun(String runId) {
        int before = records.size();
        records.values().removeIf(r -> r.runId().equals(runId));
        return before - records.size();
    }

    private static String key(String runId, Stage stage, String subject) {
        return runId + "|" + stage.name() + "|" + subject;
    }
}
