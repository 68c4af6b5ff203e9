package inkwell.coordinator.monitor;

import inkwell.coordinator.error.QueueTimeoutException;
import inkwell.coordinator.model.Delivery;
import inkwell.coordinator.model.Destination;
import inkwell.coordinator.model.ResolutionMessage;
import inkwell.coordinator.model.Stage;
import inkwell.coordinator.model.StageStatus;
import inkwell.coordinator.queue.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Event log and stage timing per run.
 *
 * The scheduler reports lifecycle events directly. Resolutions are picked up
 * asynchronously from the resolutions topic by {@link #run()}, which subscribes
 * under the role {@value #ROLE}. Only the most recent runs are kept.
 */
public class PipelineMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PipelineMonitor.class);

    public static final String ROLE = "monitor";

    private static final int MAX_RUNS = 200;

    private final MessageQueue queue;
    private final Duration pollTimeout;
    private final Clock clock;
    private final Map<String, List<PipelineEvent>> events = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, List<PipelineEvent>> eldest) {
                    return size() > MAX_RUNS;
                }
            });

    public PipelineMonitor(MessageQueue queue, Duration pollTimeout, Clock clock) {
        this.queue = queue;
        this.pollTimeout = pollTimeout;
        this.clock = clock;
        queue.subscribe(Destination.RESOLUTIONS_TOPIC, ROLE);
    }

    public void record(String runId, EventType type, Stage stage, String detail) {
        record(runId, type, stage, null, detail);
    }

    /**
     * Record an event attributed to a contributing role.
     */
    public void record(String runId, EventType type, Stage stage, String role, String detail) {
        PipelineEvent event = new PipelineEvent(runId, type, stage, role, detail, clock.instant());
        List<PipelineEvent> list;
        synchronized (events) {
            list = events.computeIfAbsent(runId, r -> new ArrayList<>());
        }
        synchronized (list) {
            list.add(event);
        }
        log.debug("[{}] {} {} {}", runId, type, stage == null ? "" : stage.key(), detail == null ? "" : detail);
    }

    /**
     * Raise an alert: kept in the run's event log as {@link EventType#ALERT} and logged as a warning.
     */
    public void alert(String runId, AlertType type, Stage stage, String message) {
        record(runId, EventType.ALERT, stage, type.name() + ": " + message);
        log.warn("Alert {} for run {}: {}", type, runId, message);
    }

    public List<PipelineEvent> alerts(String runId) {
        return events(runId).stream().filter(e -> e.type() == EventType.ALERT).toList();
    }

    public List<PipelineEvent> events(String runId) {
        List<PipelineEvent> list = events.get(runId);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    /**
     * Time from STAGE_STARTED to STAGE_FINISHED per stage; unfinished stages are measured up to now.
     */
    public Map<Stage, Duration> stageDurations(String runId) {
        Map<Stage, Instant> started = new EnumMap<>(Stage.class);
        Map<Stage, Duration> durations = new EnumMap<>(Stage.class);
        for (PipelineEvent e : events(runId)) {
            if (e.type() == EventType.STAGE_STARTED) {
                started.put(e.stage(), e.at());
            } else if (e.type() == EventType.STAGE_FINISHED && started.containsKey(e.stage())) {
                durations.put(e.stage(), Duration.between(started.remove(e.stage()), e.at()));
            }
        }
        Instant now = clock.instant();
        started.forEach((stage, at) -> durations.put(stage, Duration.between(at, now)));
        return durations;
    }

    public RunMetrics metrics(String runId) {
        List<PipelineEvent> list = events(runId);
        int dispatched = 0;
        int retries = 0;
        int missing = 0;
        int resolutions = 0;
        int degraded = 0;
        int alerts = 0;
        Map<String, RolePerformance> roles = new TreeMap<>();
        for (PipelineEvent e : list) {
            if (e.role() != null) {
                roles.computeIfAbsent(e.role(), r -> new RolePerformance(r, 0, 0, 0));
                roles.computeIfPresent(e.role(), (r, perf) -> perf.plus(e.type()));
            }
            switch (e.type()) {
                case TASK_DISPATCHED -> dispatched++;
                case TASK_RETRIED -> retries++;
                case CONTRIBUTOR_MISSING -> missing++;
                case RESOLUTION -> resolutions++;
                case ALERT -> alerts++;
                case STAGE_FINISHED -> {
                    if (StageStatus.DEGRADED.name().equals(e.detail())) {
                        degraded++;
                    }
                }
                default -> {
                }
            }
        }
        return new RunMetrics(runId, list.size(), dispatched, retries, missing, resolutions, degraded, alerts,
                stageDurations(runId), roles);
    }

    /**
     * Listens for resolution messages until interrupted.
     */
    @Override
    public void run() {
        log.info("Pipeline monitor started");

        while (!Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Pipeline monitor error", e);
            }
        }

        log.info("Pipeline monitor stopped");
    }

    /**
     * @return false if nothing arrived within the poll timeout
     */
    boolean pollOnce() throws InterruptedException {
        Delivery delivery;
        try {
            delivery = queue.dequeue(ROLE, pollTimeout);
        } catch (QueueTimeoutException e) {
            return false;
        }
        if (delivery.message() instanceof ResolutionMessage resolution) {
            record(resolution.runId(), EventType.RESOLUTION, resolution.stage(),
                    resolution.subject() + " " + resolution.kind() + " by " + resolution.winnerRole());
        }
        queue.ack(delivery.deliveryId());
        return true;
    }
}
