package inkwell.coordinator.resolver;

import inkwell.coordinator.model.Candidate;
import inkwell.coordinator.model.ResolutionOutcome;
import inkwell.coordinator.model.Stage;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Competing candidates for one (run, stage, subject) and their resolution.
 * Opened by the first candidate, resolved terminally, and reopened only when a new
 * candidate arrives after resolution. Mutated only while {@link #lock()} is held.
 */
public final class ConflictRecord {

    public enum Status {
        OPEN,
        RESOLVED,
        UNRESOLVABLE
    }

    private final String runId;
    private final Stage stage;
    private final String subject;
    private final Map<String, Candidate> candidates = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private Status status = Status.OPEN;
    private ResolutionOutcome outcome;
    private String failureReason;
    private Instant resolvedAt;

    ConflictRecord(String runId, Stage stage, String subject) {
        this.runId = runId;
        this.stage = stage;
        this.subject = subject;
    }

    public String runId() {
        return runId;
    }

    public Stage stage() {
        return stage;
    }

    public String subject() {
        return subject;
    }

    public Status status() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public List<Candidate> candidates() {
        lock.lock();
        try {
            return List.copyOf(candidates.values());
        } finally {
            lock.unlock();
        }
    }

    public ResolutionOutcome outcome() {
        lock.lock();
        try {
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    public String failureReason() {
        lock.lock();
        try {
            return failureReason;
        } finally {
            lock.unlock();
        }
    }

    public Instant resolvedAt() {
        lock.lock();
        try {
            return resolvedAt;
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lock() {
        return lock;
    }

    /**
     * @return false if a candidate with the same task and attempt was already recorded
     */
    boolean add(Candidate candidate) {
        lock.lock();
        try {
            if (candidates.putIfAbsent(candidate.identity(), candidate) != null) {
                return false;
            }
            if (status != Status.OPEN) {
                status = Status.OPEN;
                outcome = null;
                failureReason = null;
                resolvedAt = null;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    void markResolved(ResolutionOutcome resolved) {
        this.status = Status.RESOLVED;
        this.outcome = resolved;
        this.failureReason = null;
        this.resolvedAt = resolved.resolvedAt();
    }

    void markUnresolvable(String reason, Instant at) {
        this.status = Status.UNRESOLVABLE;
        this.outcome = null;
        this.failureReason = reason;
        this.resolvedAt = at;
    }

    @Override
    public String toString() {
        return "ConflictRecord{" + runId + "/" + stage.key() + "/" + subject + ", status=" + status
                + ", candidates=" + candidates.size() + "}";
    }
}
