package inkwell.coordinator.monitor;

import inkwell.coordinator.MutableClock;
import inkwell.coordinator.model.Destination;
import inkwell.coordinator.model.ResolutionKind;
import inkwell.coordinator.model.ResolutionMessage;
import inkwell.coordinator.model.Stage;
import inkwell.coordinator.model.StageStatus;
import inkwell.coordinator.queue.InMemoryMessageQueue;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineMonitorTest {

    private MutableClock clock;
    private InMemoryMessageQueue queue;
    private PipelineMonitor monitor;

    @BeforeEach
    void init() {
        clock = MutableClock.at("2026-05-10T09:00:00Z");
        queue = new InMemoryMessageQueue(20, Duration.ofSeconds(30), clock);
        monitor = new PipelineMonitor(queue, Duration.ofMillis(50), clock);
    }

    @Test
    void countsEventsPerRun() {
        monitor.record("run-1", EventType.RUN_STARTED, null, "Kelp forests");
        monitor.record("run-1", EventType.TASK_DISPATCHED, Stage.RESEARCHING, "researcher/facts attempt 1");
        monitor.record("run-1", EventType.TASK_RETRIED, Stage.RESEARCHING, "researcher/facts attempt 2");
        monitor.record("run-1", EventType.CONTRIBUTOR_MISSING, Stage.RESEARCHING, "researcher/sources");
        monitor.record("run-1", EventType.STAGE_FINISHED, Stage.RESEARCHING, StageStatus.DEGRADED.name());
        monitor.record("run-2", EventType.RUN_STARTED, null, "Other");

        RunMetrics metrics = monitor.metrics("run-1");

        assertEquals(5, metrics.events());
        assertEquals(1, metrics.tasksDispatched());
        assertEquals(1, metrics.retries());
        assertEquals(1, metrics.missingContributors());
        assertEquals(1, metrics.degradedStages());
        assertEquals(1, monitor.events("run-2").size());
    }

    @Test
    void measuresStageDurations() {
        monitor.record("run-1", EventType.STAGE_STARTED, Stage.WRITING, null);
        clock.advance(Duration.ofSeconds(4));
        monitor.record("run-1", EventType.STAGE_FINISHED, Stage.WRITING, StageStatus.COMPLETED.name());
        monitor.record("run-1", EventType.STAGE_STARTED, Stage.EDITING, null);
        clock.advance(Duration.ofSeconds(1));

        var durations = monitor.stageDurations("run-1");

        assertEquals(Duration.ofSeconds(4), durations.get(Stage.WRITING));
        // still running: measured up to now
        assertEquals(Duration.ofSeconds(1), durations.get(Stage.EDITING));
    }

    @Test
    void unknownRunHasNoEvents() {
        assertEquals(List.of(), monitor.events("run-none"));
        assertEquals(0, monitor.metrics("run-none").events());
    }

    @Test
    void picksUpResolutionsFromTopic() throws Exception {
        ResolutionMessage resolution = new ResolutionMessage("msg-1", "run-1", Stage.EDITING, "tone", "editor",
                "resolved/editing/tone", ResolutionKind.PRIORITY, clock.instant());
        assertEquals(1, queue.enqueue(resolution, Destination.topic(Destination.RESOLUTIONS_TOPIC)));

        assertTrue(monitor.pollOnce());
        assertFalse(monitor.pollOnce());

        PipelineEvent event = monitor.events("run-1").get(0);
        assertEquals(EventType.RESOLUTION, event.type());
        assertEquals(Stage.EDITING, event.stage());
        assertEquals("tone PRIORITY by editor", event.detail());
        assertEquals(1, monitor.metrics("run-1").resolutions());
        assertEquals(0, queue.stats().inFlight());
    }

    @Test
    void tracksOutcomesPerRole() {
        monitor.record("run-1", EventType.TASK_FAILED, Stage.RESEARCHING, "researcher", "researcher/facts attempt 1");
        monitor.record("run-1", EventType.TASK_SUCCEEDED, Stage.RESEARCHING, "researcher", "researcher/facts");
        monitor.record("run-1", EventType.CONTRIBUTOR_MISSING, Stage.RESEARCHING, "researcher",
                "researcher/sources: no completion before stage deadline");
        monitor.record("run-1", EventType.TASK_SUCCEEDED, Stage.WRITING, "writer", "writer/draft");

        RunMetrics metrics = monitor.metrics("run-1");

        RolePerformance researcher = metrics.roles().get("researcher");
        assertEquals(1, researcher.succeeded());
        assertEquals(1, researcher.failed());
        assertEquals(1, researcher.missing());
        assertEquals(1.0 / 3, researcher.successRate(), 1e-9);
        assertEquals(2.0 / 3, researcher.errorRate(), 1e-9);
        assertEquals(1.0, metrics.roles().get("writer").successRate(), 1e-9);
        assertEquals(2, metrics.roles().size());
    }

    @Test
    void alertsAreKeptWithTheRun() {
        monitor.alert("run-1", AlertType.SLOW_CONTRIBUTOR, Stage.WRITING, "writer/draft took 6000ms");
        monitor.alert("run-1", AlertType.RUN_FAILED, Stage.ILLUSTRATING, "1 of 1 subjects unresolved in illustrating");
        monitor.record("run-1", EventType.STAGE_STARTED, Stage.WRITING, null);

        List<PipelineEvent> alerts = monitor.alerts("run-1");

        assertEquals(2, alerts.size());
        assertEquals("SLOW_CONTRIBUTOR: writer/draft took 6000ms", alerts.get(0).detail());
        assertTrue(alerts.get(1).detail().startsWith("RUN_FAILED: "));
        assertEquals(2, monitor.metrics("run-1").alerts());
        assertEquals(List.of(), monitor.alerts("run-2"));
    }
}
