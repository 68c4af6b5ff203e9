package inkwell.coordinator.scheduler;

import inkwell.coordinator.MutableClock;
import inkwell.coordinator.model.Destination;
import inkwell.coordinator.model.Stage;
import inkwell.coordinator.model.TaskMessage;
import inkwell.coordinator.queue.InMemoryMessageQueue;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class MaintenanceSchedulerTest {

    private MaintenanceScheduler maintenance;

    @BeforeEach
    void setUp() {
        maintenance = new MaintenanceScheduler("test-maintenance");
    }

    @AfterEach
    void tearDown() {
        maintenance.close();
    }

    @Test
    void runsRegisteredJobsRepeatedly() {
        AtomicInteger ticks = new AtomicInteger();
        maintenance.every("tick", Duration.ofMillis(20), ticks::incrementAndGet).start();

        await().atMost(Duration.ofSeconds(2)).until(() -> ticks.get() >= 3);
        assertTrue(maintenance.completedRuns("tick") >= 3);
        assertEquals(0, maintenance.failedRuns("tick"));
    }

    @Test
    void failingJobKeepsItsSchedule() {
        AtomicInteger calls = new AtomicInteger();
        maintenance.every("flaky", Duration.ofMillis(20), () -> {
            if (calls.incrementAndGet() % 2 == 1) {
                throw new IllegalStateException("database busy");
            }
        }).start();

        await().atMost(Duration.ofSeconds(2)).until(() -> maintenance.completedRuns("flaky") >= 2);
        assertTrue(maintenance.failedRuns("flaky") >= 2);
    }

    @Test
    void leaseReaperRunsAsAJob() throws Exception {
        MutableClock clock = MutableClock.at("2026-04-01T10:00:00Z");
        InMemoryMessageQueue queue = new InMemoryMessageQueue(10, Duration.ofSeconds(5), clock);
        TaskMessage task = TaskMessage.builder()
                .taskId("task-draft")
                .runId("run-1")
                .stage(Stage.WRITING)
                .subject("draft")
                .targetRole("writer")
                .createdAt(clock.instant())
                .attempt(1)
                .build();
        queue.enqueue(task, Destination.role("writer"));
        queue.dequeue("writer", Duration.ofMillis(50));
        clock.advance(Duration.ofSeconds(6));

        LeaseReaper reaper = new LeaseReaper(queue, clock);
        maintenance.every("lease-reaper", Duration.ofMillis(20), reaper::reapExpiredLeases).start();

        await().atMost(Duration.ofSeconds(2)).until(() -> queue.depth("writer") == 1);
        assertEquals(0, queue.stats().inFlight());
    }

    @Test
    void jobsAddedAfterStartAreScheduled() {
        maintenance.start();
        AtomicInteger ticks = new AtomicInteger();
        maintenance.every("late", Duration.ofMillis(20), ticks::incrementAndGet);

        await().atMost(Duration.ofSeconds(2)).until(() -> ticks.get() >= 1);
        assertEquals(List.of("late"), maintenance.jobNames());
    }

    @Test
    void rejectsDuplicateOrNonPositiveIntervals() {
        maintenance.every("tick", Duration.ofSeconds(1), () -> { });

        assertThrows(IllegalArgumentException.class, () -> maintenance.every("tick", Duration.ofSeconds(1), () -> { }));
        assertThrows(IllegalArgumentException.class, () -> maintenance.every("zero", Duration.ZERO, () -> { }));
    }

    @Test
    void stopIsIdempotent() {
        maintenance.every("tick", Duration.ofSeconds(1), () -> { }).start();
        assertTrue(maintenance.isRunning());

        maintenance.stop();
        maintenance.stop();

        assertFalse(maintenance.isRunning());
    }
}
