package inkwell.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TaskMessage and the completion messages derived from it.
 */
class TaskMessageTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private TaskMessage task() {
        return TaskMessage.builder()
                .taskId("task-1")
                .runId("run-1")
                .stage(Stage.EDITING)
                .subject("tone")
                .targetRole("editor")
                .payloadRef("brief/editing")
                .createdAt(T0)
                .attempt(1)
                .build();
    }

    @Test
    void builderAssignsMessageId() {
        TaskMessage task = task();
        assertNotNull(task.id());
        assertTrue(task.id().startsWith("msg-"));
        assertEquals(1, task.attempt());
    }

    @Test
    void builderRejectsMissingFields() {
        assertThrows(NullPointerException.class, () -> TaskMessage.builder()
                .taskId("task-1")
                .stage(Stage.WRITING)
                .subject("draft")
                .targetRole("writer")
                .attempt(1)
                .build());
    }

    @Test
    void attemptMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> task().toBuilder().attempt(0).build());
    }

    @Test
    void nextAttemptKeepsTaskIdentity() {
        TaskMessage first = task();
        Instant later = T0.plusSeconds(5);
        TaskMessage second = first.nextAttempt(later);

        assertNotEquals(first.id(), second.id());
        assertNotEquals(first, second);
        assertEquals(first.taskId(), second.taskId());
        assertEquals(2, second.attempt());
        assertEquals(later, second.createdAt());
        assertEquals("editor", second.targetRole());
        assertEquals("tone", second.subject());
    }

    @Test
    void completionFactoriesCopyTaskCoordinates() {
        TaskMessage task = task();

        CompletionMessage ok = CompletionMessage.success(task, "candidate/editing/tone/editor/1", T0);
        assertEquals(CompletionStatus.SUCCESS, ok.status());
        assertEquals("task-1", ok.taskId());
        assertEquals("editor", ok.producingRole());
        assertEquals(1, ok.attempt());
        assertNull(ok.error());

        CompletionMessage failed = CompletionMessage.failure(task, "boom", T0);
        assertEquals(CompletionStatus.FAILURE, failed.status());
        assertNull(failed.resultRef());
        assertEquals("boom", failed.error());
    }

    @Test
    void successWithoutResultIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new CompletionMessage("m", "t", "r", 1, "writer", CompletionStatus.SUCCESS, null, null, T0));
    }

    @Test
    void candidateIdentityIncludesAttempt() {
        TaskMessage task = task();
        Candidate first = Candidate.of(CompletionMessage.partial(task, "ref-1", T0));
        Candidate second = Candidate.of(CompletionMessage.success(task.nextAttempt(T0), "ref-2", T0));

        assertTrue(first.partial());
        assertFalse(second.partial());
        assertEquals("task-1#1", first.identity());
        assertEquals("task-1#2", second.identity());
    }
}
