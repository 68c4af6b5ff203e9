package inkwell.coordinator.pipeline;

import inkwell.coordinator.config.StageRoster;
import inkwell.coordinator.model.CompletionMessage;
import inkwell.coordinator.model.Stage;
import inkwell.coordinator.model.StageReport;
import inkwell.coordinator.model.StageStatus;
import inkwell.coordinator.model.TaskMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatch ledger of one stage: which contributor owes which subject, and what became of it.
 * Confined to the run's control thread.
 */
final class StageExecution {

    enum State {
        PENDING,
        DELIVERED,
        MISSING,
        STALE
    }

    private final Stage stage;
    private final Map<String, SubjectState> subjects = new LinkedHashMap<>();
    private final List<Contribution> contributions = new ArrayList<>();
    private final Map<String, Contribution> byTaskId = new HashMap<>();
    private final List<String> degraded = new ArrayList<>();
    private final List<String> unresolved = new ArrayList<>();
    private int resolved = 0;

    StageExecution(Stage stage, StageRoster roster) {
        this.stage = stage;
        for (String subject : roster.subjects()) {
            SubjectState state = new SubjectState(subject);
            subjects.put(subject, state);
            for (String role : roster.contributors(subject)) {
                Contribution c = new Contribution(role, subject);
                state.contributions.add(c);
                contributions.add(c);
            }
        }
    }

    Stage stage() {
        return stage;
    }

    List<Contribution> contributions() {
        return contributions;
    }

    Collection<SubjectState> subjects() {
        return subjects.values();
    }

    Contribution byTaskId(String taskId) {
        return byTaskId.get(taskId);
    }

    void track(Contribution c, TaskMessage task) {
        c.current = task;
        c.state = State.PENDING;
        byTaskId.put(task.taskId(), c);
    }

    boolean allSubjectsDone() {
        return subjects.values().stream().allMatch(SubjectState::done);
    }

    void markResolved(SubjectState subject) {
        subject.done = true;
        resolved++;
        if (subject.incomplete()) {
            degraded.add(subject.name);
        }
    }

    void markEmpty(SubjectState subject) {
        subject.done = true;
        degraded.add(subject.name);
    }

    void markUnresolved(SubjectState subject) {
        subject.done = true;
        unresolved.add(subject.name);
    }

    List<String> degradedSubjects() {
        return degraded;
    }

    List<String> unresolvedSubjects() {
        return unresolved;
    }

    StageReport report(StageStatus status, Instant startedAt, Instant finishedAt) {
        List<String> missing = new ArrayList<>();
        for (Contribution c : contributions) {
            if (c.state == State.MISSING) {
                missing.add(c.role + ":" + c.subject);
            }
        }
        return new StageReport(stage, status, subjects.size(), resolved, degraded, unresolved, missing,
                startedAt, finishedAt);
    }

    final class SubjectState {
        private final String name;
        private final List<Contribution> contributions = new ArrayList<>();
        private boolean done = false;

        SubjectState(String name) {
            this.name = name;
        }

        String name() {
            return name;
        }

        boolean done() {
            return done;
        }

        /** Every contributor either delivered or was given up on. */
        boolean settled() {
            return contributions.stream().noneMatch(Contribution::pending);
        }

        boolean hasCandidates() {
            return contributions.stream().anyMatch(c -> c.state == State.DELIVERED);
        }

        boolean incomplete() {
            return contributions.stream().anyMatch(c -> c.state != State.DELIVERED || c.partial);
        }
    }

    final class Contribution {
        private final String role;
        private final String subject;
        private TaskMessage current;
        private State state = State.PENDING;
        private boolean partial = false;

        Contribution(String role, String subject) {
            this.role = role;
            this.subject = subject;
        }

        String role() {
            return role;
        }

        String subject() {
            return subject;
        }

        Stage stage() {
            return stage;
        }

        TaskMessage current() {
            return current;
        }

        String messageId() {
            return current == null ? null : current.id();
        }

        int attempt() {
            return current == null ? 0 : current.attempt();
        }

        boolean pending() {
            return state == State.PENDING;
        }

        /** A completion counts only for the attempt currently awaited. */
        boolean accepts(CompletionMessage completion) {
            return state == State.PENDING
                    && current != null
                    && current.runId().equals(completion.runId())
                    && current.attempt() == completion.attempt()
                    && role.equals(completion.producingRole());
        }

        void delivered(boolean partialResult) {
            this.state = State.DELIVERED;
            this.partial = partialResult;
        }

        void missing() {
            this.state = State.MISSING;
        }

        void stale() {
            this.state = State.STALE;
        }

        String label() {
            return role + "/" + subject;
        }
    }
}
