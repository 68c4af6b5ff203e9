package inkwell.coordinator.store;

import inkwell.coordinator.model.Stage;
import inkwell.coordinator.model.TaskLogEntry;
import inkwell.coordinator.model.TaskMessage;
import inkwell.coordinator.model.TaskOutcome;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the task attempt audit log.
 */
class JdbcTaskLogRepositoryTest {

    private static Database db;
    private static JdbcTaskLogRepository repo;

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-tasklog;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        repo = new JdbcTaskLogRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanLog() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM task_log");
            conn.commit();
        }
    }

    private TaskMessage task(String runId, String subject, int attempt) {
        return TaskMessage.builder()
                .taskId("task-" + subject)
                .runId(runId)
                .stage(Stage.RESEARCHING)
                .subject(subject)
                .targetRole("researcher")
                .createdAt(T0)
                .attempt(attempt)
                .build();
    }

    @Test
    void recordsAttemptsInDispatchOrder() {
        TaskMessage first = task("run-1", "facts", 1);
        TaskMessage second = first.nextAttempt(T0.plusSeconds(1));
        TaskMessage other = task("run-1", "sources", 1);
        repo.record(TaskLogEntry.dispatched(first));
        repo.record(TaskLogEntry.dispatched(other));
        repo.record(TaskLogEntry.dispatched(second));
        repo.record(TaskLogEntry.dispatched(task("run-2", "facts", 1)));

        List<TaskLogEntry> entries = repo.findByRun("run-1");
        assertEquals(3, entries.size());
        assertEquals(first.id(), entries.get(0).messageId());
        assertEquals(other.id(), entries.get(1).messageId());
        assertEquals(2, entries.get(2).attempt());
        assertEquals(TaskOutcome.DISPATCHED, entries.get(0).outcome());
        assertEquals(Stage.RESEARCHING, entries.get(0).stage());
        assertEquals(3, repo.countByRun("run-1"));
    }

    @Test
    void finishSetsOutcome() {
        TaskMessage task = task("run-1", "facts", 1);
        repo.record(TaskLogEntry.dispatched(task));

        assertTrue(repo.finish(task.id(), TaskOutcome.FAILURE, "timeout from search api", T0.plusSeconds(2)));
        assertFalse(repo.finish("msg-unknown", TaskOutcome.SUCCESS, null, T0));

        TaskLogEntry entry = repo.findByRun("run-1").get(0);
        assertEquals(TaskOutcome.FAILURE, entry.outcome());
        assertEquals("timeout from search api", entry.error());
        assertEquals(T0.plusSeconds(2), entry.finishedAt());
    }

    @Test
    void longErrorsAreTruncated() {
        TaskMessage task = task("run-1", "facts", 1);
        repo.record(TaskLogEntry.dispatched(task));

        repo.finish(task.id(), TaskOutcome.FAILURE, "x".repeat(5000), T0);

        assertEquals(2048, repo.findByRun("run-1").get(0).error().length());
    }

    @Test
    void finishPendingOnlyTouchesDispatchedAttempts() {
        TaskMessage done = task("run-1", "facts", 1);
        TaskMessage pending = task("run-1", "sources", 1);
        repo.record(TaskLogEntry.dispatched(done));
        repo.record(TaskLogEntry.dispatched(pending));
        repo.finish(done.id(), TaskOutcome.SUCCESS, null, T0.plusSeconds(1));

        assertEquals(1, repo.finishPending("run-1", TaskOutcome.STALE, T0.plusSeconds(5)));

        List<TaskLogEntry> entries = repo.findByRun("run-1");
        assertEquals(TaskOutcome.SUCCESS, entries.get(0).outcome());
        assertEquals(TaskOutcome.STALE, entries.get(1).outcome());
        assertEquals(0, repo.finishPending("run-1", TaskOutcome.STALE, T0.plusSeconds(6)));
    }
}
