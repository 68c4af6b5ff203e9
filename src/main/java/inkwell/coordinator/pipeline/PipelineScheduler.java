package inkwell.coordinator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import inkwell.coordinator.config.PipelineConfig;
import inkwell.coordinator.config.StageRoster;
import inkwell.coordinator.error.CoordinatorException;
import inkwell.coordinator.error.QueueFullException;
import inkwell.coordinator.error.QueueTimeoutException;
import inkwell.coordinator.error.ResolutionConflictUnresolvableException;
import inkwell.coordinator.error.StoreUnavailableException;
import inkwell.coordinator.memory.MemoryKeys;
import inkwell.coordinator.memory.MemoryStore;
import inkwell.coordinator.model.Candidate;
import inkwell.coordinator.model.CompletionMessage;
import inkwell.coordinator.model.CompletionStatus;
import inkwell.coordinator.model.ControlMessage;
import inkwell.coordinator.model.Delivery;
import inkwell.coordinator.model.Destination;
import inkwell.coordinator.model.MemoryEntry;
import inkwell.coordinator.model.MemoryTier;
import inkwell.coordinator.model.PipelineRun;
import inkwell.coordinator.model.QueueMessage;
import inkwell.coordinator.model.RunOptions;
import inkwell.coordinator.model.RunStatus;
import inkwell.coordinator.model.Stage;
import inkwell.coordinator.model.StageReport;
import inkwell.coordinator.model.StageStatus;
import inkwell.coordinator.model.TaskLogEntry;
import inkwell.coordinator.model.TaskMessage;
import inkwell.coordinator.model.TaskOutcome;
import inkwell.coordinator.monitor.AlertType;
import inkwell.coordinator.monitor.EventType;
import inkwell.coordinator.monitor.PipelineMonitor;
import inkwell.coordinator.queue.MessageQueue;
import inkwell.coordinator.repository.PipelineRunRepository;
import inkwell.coordinator.repository.TaskLogRepository;
import inkwell.coordinator.resolver.ConflictResolver;
import inkwell.coordinator.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives runs through the stage machine
 * IDLE → RESEARCHING → WRITING → EDITING → OPTIMIZING → ILLUSTRATING → PUBLISHING → COMPLETED.
 *
 * Each run gets its own control thread. Per stage the loop:
 * 1. writes the stage brief (topic plus references to everything resolved so far)
 * 2. dispatches one task message per (role, subject) of the roster
 * 3. collects completions from {@code scheduler/<runId>}, redispatching failures up to the attempt limit
 * 4. resolves each subject once all its contributors reported or the stage deadline passed
 * 5. grades the stage: COMPLETED, DEGRADED, or FAILED when the unresolved share reaches the threshold
 *
 * Abort requests are honoured between dequeue slices and between resolutions, never in
 * the middle of one resolution.
 */
public class PipelineScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    /** Writer recorded for memory entries the scheduler produces. */
    public static final String WRITER = "scheduler";

    private static final int MAX_FINISHED = 200;

    public enum AbortResult {
        ACCEPTED,
        ALREADY_TERMINAL,
        NOT_FOUND
    }

    private final PipelineConfig config;
    private final MessageQueue queue;
    private final MemoryStore store;
    private final ConflictResolver resolver;
    private final PipelineRunRepository runRepository;
    private final TaskLogRepository taskLog;
    private final PipelineMonitor monitor;
    private final ObjectMapper mapper;
    private final Backoff backoff;
    private final Clock clock;

    private final ExecutorService executor;
    private final AtomicInteger threadIds = new AtomicInteger(1);
    private final Map<String, RunContext> active = new ConcurrentHashMap<>();
    private final Map<String, PipelineRun> finished = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, PipelineRun> eldest) {
                    return size() > MAX_FINISHED;
                }
            });

    public PipelineScheduler(PipelineConfig config, MessageQueue queue, MemoryStore store,
            ConflictResolver resolver, PipelineRunRepository runRepository, TaskLogRepository taskLog,
            PipelineMonitor monitor, ObjectMapper mapper, Clock clock) {
        this.config = config;
        this.queue = queue;
        this.store = store;
        this.resolver = resolver;
        this.runRepository = runRepository;
        this.taskLog = taskLog;
        this.monitor = monitor;
        this.mapper = mapper;
        this.backoff = Backoff.defaults();
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "inkwell-run-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    public PipelineConfig config() {
        return config;
    }

    public PipelineRun start(String topic) {
        return start(topic, RunOptions.none());
    }

    /**
     * Create a run for the topic and start it on its own control thread.
     * The options travel with every stage brief.
     *
     * @return the run as created, in status RUNNING at stage IDLE
     */
    public PipelineRun start(String topic, RunOptions options) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        String runId = newRunId(topic);
        PipelineRun run = PipelineRun.builder()
                .runId(runId)
                .topic(topic.trim())
                .options(options)
                .configSnapshot(snapshotConfig())
                .currentStage(Stage.IDLE)
                .status(RunStatus.RUNNING)
                .createdAt(clock.instant())
                .build();

        RunContext ctx = new RunContext(run);
        active.put(runId, ctx);
        monitor.record(runId, EventType.RUN_STARTED, null, run.topic());
        log.info("Run {} started for topic '{}'", runId, run.topic());

        executor.submit(() -> execute(ctx));
        return run;
    }

    /**
     * Latest snapshot of a run: live for active runs, otherwise from recent memory or the archive.
     */
    public Optional<PipelineRun> status(String runId) {
        RunContext ctx = active.get(runId);
        if (ctx != null) {
            return Optional.of(ctx.snapshot());
        }
        PipelineRun recent = finished.get(runId);
        if (recent != null) {
            return Optional.of(recent);
        }
        return runRepository.findById(runId);
    }

    public List<PipelineRun> activeRuns() {
        List<PipelineRun> runs = new ArrayList<>();
        active.values().forEach(ctx -> runs.add(ctx.snapshot()));
        return runs;
    }

    /**
     * Request an abort; the run stops at its next checkpoint and is never resumed.
     */
    public AbortResult abort(String runId) {
        RunContext ctx = active.get(runId);
        if (ctx == null) {
            return status(runId).isPresent() ? AbortResult.ALREADY_TERMINAL : AbortResult.NOT_FOUND;
        }
        if (!ctx.requestAbort()) {
            return AbortResult.ALREADY_TERMINAL;
        }
        monitor.record(runId, EventType.ABORT_REQUESTED, ctx.snapshot().currentStage(), null);
        log.info("Abort requested for run {}", runId);
        return AbortResult.ACCEPTED;
    }

    /**
     * Wait until the run reaches a terminal status.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitTermination(String runId, Duration timeout) throws InterruptedException {
        RunContext ctx = active.get(runId);
        if (ctx == null) {
            return status(runId).map(PipelineRun::isTerminal).orElse(false);
        }
        return ctx.await(timeout);
    }

    @Override
    public void close() {
        active.keySet().forEach(this::abort);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Pipeline scheduler forcefully stopped");
            } else {
                log.info("Pipeline scheduler stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---- control loop ----

    private void execute(RunContext ctx) {
        String runId = ctx.runId();
        archive(ctx.snapshot());
        try {
            String topic = ctx.snapshot().topic();
            backoff.run("Store topic of " + runId,
                    () -> store.put(runId, MemoryKeys.TOPIC, topic, MemoryTier.LONG_TERM, WRITER),
                    StoreUnavailableException.class);

            for (Stage stage : Stage.workStages()) {
                if (ctx.abortRequested()) {
                    finish(ctx, RunStatus.ABORTED, "aborted before " + stage.key());
                    return;
                }
                StageReport report = runStage(ctx, stage);
                ctx.stage(report);
                monitor.record(runId, EventType.STAGE_FINISHED, stage, report.status().name());

                if (report.status() == StageStatus.ABORTED) {
                    finish(ctx, RunStatus.ABORTED, "aborted during " + stage.key());
                    return;
                }
                if (report.status() == StageStatus.FAILED) {
                    finish(ctx, RunStatus.FAILED, report.unresolvedSubjects().size() + " of "
                            + report.expectedSubjects() + " subjects unresolved in " + stage.key());
                    return;
                }
                archive(ctx.snapshot());
            }

            ctx.update(b -> b.currentStage(Stage.COMPLETED));
            finish(ctx, RunStatus.COMPLETED, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(ctx, RunStatus.ABORTED, "control thread interrupted");
        } catch (StoreUnavailableException e) {
            log.error("Run {} lost its memory store: {}", runId, e.getMessage());
            finish(ctx, RunStatus.FAILED, "memory store unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Run {} failed unexpectedly", runId, e);
            finish(ctx, RunStatus.FAILED, "unexpected error: " + e);
        }
    }

    private StageReport runStage(RunContext ctx, Stage stage) throws InterruptedException {
        String runId = ctx.runId();
        StageRoster roster = config.roster(stage);
        Instant startedAt = clock.instant();
        ctx.update(b -> b.currentStage(stage));

        if (roster.isEmpty()) {
            log.info("Run {} skipping {}: no roster", runId, stage.key());
            return new StageReport(stage, StageStatus.SKIPPED, 0, 0, List.of(), List.of(), List.of(),
                    startedAt, startedAt);
        }

        ctx.stage(StageReport.pending(stage).withStatus(StageStatus.ACTIVE, startedAt));
        monitor.record(runId, EventType.STAGE_STARTED, stage, null);
        log.info("Run {} entering {}", runId, stage.key());

        Instant deadline = startedAt.plus(config.stageDeadline(stage));
        String briefKey = writeBrief(ctx, stage);
        StageExecution exec = new StageExecution(stage, roster);

        for (StageExecution.Contribution c : exec.contributions()) {
            TaskMessage task = TaskMessage.builder()
                    .taskId(newTaskId())
                    .runId(runId)
                    .stage(stage)
                    .subject(c.subject())
                    .targetRole(c.role())
                    .payloadRef(briefKey)
                    .createdAt(clock.instant())
                    .attempt(1)
                    .build();
            dispatch(ctx, exec, c, task, deadline);
        }

        Destination inbox = Destination.scheduler(runId);
        while (true) {
            if (ctx.abortRequested()) {
                return abortStage(exec, startedAt);
            }
            if (!resolveSettled(ctx, exec)) {
                return abortStage(exec, startedAt);
            }
            if (exec.allSubjectsDone()) {
                break;
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                expireContributors(ctx, exec, now);
                continue;
            }

            Duration wait = Duration.between(now, deadline);
            if (wait.compareTo(config.pollInterval()) > 0) {
                wait = config.pollInterval();
            }
            Optional<Delivery> delivery = poll(inbox.name(), wait);
            if (delivery.isPresent()) {
                handleDelivery(ctx, exec, delivery.get(), deadline);
            }
        }

        return grade(exec, startedAt);
    }

    private Optional<Delivery> poll(String inbox, Duration wait) throws InterruptedException {
        try {
            return Optional.of(queue.dequeue(inbox, wait));
        } catch (QueueTimeoutException e) {
            return Optional.empty();
        }
    }

    private void dispatch(RunContext ctx, StageExecution exec, StageExecution.Contribution c, TaskMessage task,
            Instant deadline) throws InterruptedException {
        exec.track(c, task);
        audit(() -> taskLog.record(TaskLogEntry.dispatched(task)));
        try {
            backoff.call("Dispatch " + task.taskId() + " to " + task.targetRole(),
                    () -> queue.enqueue(task, Destination.role(task.targetRole())),
                    QueueFullException.class, deadline, clock);
            monitor.record(ctx.runId(), task.attempt() > 1 ? EventType.TASK_RETRIED : EventType.TASK_DISPATCHED,
                    task.stage(), c.label() + " attempt " + task.attempt());
            log.debug("Dispatched {} ({} attempt {})", task.id(), c.label(), task.attempt());
        } catch (QueueFullException e) {
            markMissing(ctx, c, "queue full until stage deadline");
        }
    }

    private void handleDelivery(RunContext ctx, StageExecution exec, Delivery delivery, Instant deadline)
            throws InterruptedException {
        QueueMessage message = delivery.message();
        if (!(message instanceof CompletionMessage completion)) {
            log.warn("Run {} scheduler received unexpected {}", ctx.runId(), message.getClass().getSimpleName());
            queue.ack(delivery.deliveryId());
            return;
        }

        StageExecution.Contribution c = exec.byTaskId(completion.taskId());
        if (c == null || !c.accepts(completion)) {
            log.debug("Ignoring stale completion {} of task {} attempt {}", completion.id(), completion.taskId(),
                    completion.attempt());
            queue.ack(delivery.deliveryId());
            return;
        }

        Instant now = clock.instant();
        if (completion.status() == CompletionStatus.FAILURE) {
            audit(() -> taskLog.finish(c.messageId(), TaskOutcome.FAILURE, completion.error(), now));
            monitor.record(ctx.runId(), EventType.TASK_FAILED, exec.stage(), c.role(),
                    c.label() + " attempt " + c.attempt() + ": " + completion.error());
            if (c.attempt() < config.maxAttempts() && now.isBefore(deadline)) {
                log.warn("{} failed attempt {} of {}: {}", c.label(), c.attempt(), config.maxAttempts(),
                        completion.error());
                queue.ack(delivery.deliveryId());
                dispatch(ctx, exec, c, c.current().nextAttempt(now), deadline);
                return;
            }
            markMissing(ctx, c, "failed " + c.attempt() + " attempts: " + completion.error());
        } else {
            boolean partial = completion.status() == CompletionStatus.PARTIAL;
            resolver.registry().submit(ctx.runId(), exec.stage(), c.subject(), Candidate.of(completion));
            c.delivered(partial);
            audit(() -> taskLog.finish(c.messageId(), partial ? TaskOutcome.PARTIAL : TaskOutcome.SUCCESS,
                    null, now));
            monitor.record(ctx.runId(), EventType.TASK_SUCCEEDED, exec.stage(), c.role(),
                    c.label() + (partial ? " partial" : ""));
            Duration took = Duration.between(c.current().createdAt(), now);
            if (took.compareTo(config.slowContributor()) > 0) {
                monitor.alert(ctx.runId(), AlertType.SLOW_CONTRIBUTOR, exec.stage(),
                        c.label() + " took " + took.toMillis() + "ms");
            }
            log.debug("{} delivered {}", c.label(), completion.resultRef());
        }
        queue.ack(delivery.deliveryId());
    }

    /**
     * Resolve every subject whose contributors all reported.
     *
     * @return false if an abort was requested between two resolutions
     */
    private boolean resolveSettled(RunContext ctx, StageExecution exec) throws InterruptedException {
        for (StageExecution.SubjectState subject : exec.subjects()) {
            if (subject.done() || !subject.settled()) {
                continue;
            }
            if (!subject.hasCandidates()) {
                log.warn("Run {} {}/{}: no contributor delivered, leaving subject empty", ctx.runId(),
                        exec.stage().key(), subject.name());
                exec.markEmpty(subject);
            } else {
                try {
                    backoff.call("Resolve " + exec.stage().key() + "/" + subject.name(),
                            () -> resolver.resolve(ctx.runId(), exec.stage(), subject.name()),
                            StoreUnavailableException.class);
                    exec.markResolved(subject);
                } catch (ResolutionConflictUnresolvableException e) {
                    log.warn("Run {}: {}", ctx.runId(), e.getMessage());
                    exec.markUnresolved(subject);
                }
            }
            if (ctx.abortRequested()) {
                return false;
            }
        }
        return true;
    }

    private void expireContributors(RunContext ctx, StageExecution exec, Instant now) {
        for (StageExecution.Contribution c : exec.contributions()) {
            if (c.pending()) {
                markMissing(ctx, c, "no completion before stage deadline");
            }
        }
        log.warn("Run {} reached the {} deadline at {}", ctx.runId(), exec.stage().key(), now);
    }

    private void markMissing(RunContext ctx, StageExecution.Contribution c, String reason) {
        c.missing();
        String messageId = c.messageId();
        Instant now = clock.instant();
        audit(() -> taskLog.finish(messageId, TaskOutcome.MISSING, reason, now));
        monitor.record(ctx.runId(), EventType.CONTRIBUTOR_MISSING, c.stage(), c.role(), c.label() + ": " + reason);
        log.warn("Run {} contributor {} missing: {}", ctx.runId(), c.label(), reason);
    }

    private StageReport grade(StageExecution exec, Instant startedAt) {
        int total = exec.subjects().size();
        int unresolved = exec.unresolvedSubjects().size();
        StageStatus status;
        if (unresolved > 0 && (double) unresolved / total >= config.failureThreshold()) {
            status = StageStatus.FAILED;
        } else if (unresolved > 0 || !exec.degradedSubjects().isEmpty()) {
            status = StageStatus.DEGRADED;
        } else {
            status = StageStatus.COMPLETED;
        }
        return exec.report(status, startedAt, clock.instant());
    }

    private StageReport abortStage(StageExecution exec, Instant startedAt) {
        for (StageExecution.Contribution c : exec.contributions()) {
            if (c.pending()) {
                c.stale();
            }
        }
        return exec.report(StageStatus.ABORTED, startedAt, clock.instant());
    }

    private void finish(RunContext ctx, RunStatus status, String reason) {
        String runId = ctx.runId();
        Instant now = clock.instant();

        if (status != RunStatus.COMPLETED) {
            audit(() -> taskLog.finishPending(runId, TaskOutcome.STALE, now));
        }
        if (status == RunStatus.ABORTED) {
            queue.purge(runId);
            try {
                queue.enqueue(ControlMessage.abort(runId, now), Destination.topic(Destination.CONTROL_TOPIC));
            } catch (CoordinatorException e) {
                log.warn("Could not broadcast abort of run {}: {}", runId, e.getMessage());
            }
        }
        queue.retire(Destination.scheduler(runId));
        resolver.registry().clearRun(runId);
        if (status != RunStatus.ABORTED) {
            store.endRun(runId);
        }

        PipelineRun run = ctx.update(b -> b.status(status).failureReason(reason).finishedAt(now));
        archive(run);
        finished.put(runId, run);
        active.remove(runId);
        monitor.record(runId, EventType.RUN_FINISHED, run.currentStage(), status.name());
        if (status == RunStatus.FAILED) {
            monitor.alert(runId, AlertType.RUN_FAILED, run.currentStage(), reason);
        }
        ctx.markTerminated();

        if (status == RunStatus.COMPLETED) {
            log.info("Run {} completed{}", runId, run.degraded() ? " (degraded)" : "");
        } else {
            log.warn("Run {} {} at {}: {}", runId, status, run.currentStage().key(), reason);
        }
    }

    // ---- helpers ----

    private String writeBrief(RunContext ctx, Stage stage) throws InterruptedException {
        String runId = ctx.runId();
        Map<String, String> inputs = new TreeMap<>();
        for (MemoryEntry entry : store.list(runId, MemoryKeys.RESOLVED_PREFIX)) {
            inputs.put(entry.key().substring(MemoryKeys.RESOLVED_PREFIX.length()), entry.key());
        }
        Map<String, Object> brief = new LinkedHashMap<>();
        brief.put("runId", runId);
        brief.put("topic", ctx.snapshot().topic());
        brief.put("stage", stage.key());
        RunOptions options = ctx.snapshot().options();
        if (options.styleGuide() != null) {
            brief.put("styleGuide", options.styleGuide());
        }
        if (options.targetLength() != null) {
            brief.put("targetLength", options.targetLength());
        }
        brief.put("inputs", inputs);

        String key = MemoryKeys.brief(stage);
        String json = toJson(brief);
        backoff.run("Store brief of " + stage.key(),
                () -> store.put(runId, key, json, MemoryTier.SHORT_TERM, WRITER),
                StoreUnavailableException.class);
        return key;
    }

    private String snapshotConfig() {
        return toJson(config.describe());
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private void archive(PipelineRun run) {
        try {
            runRepository.save(run);
        } catch (RuntimeException e) {
            log.warn("Failed to archive run {}: {}", run.runId(), e.getMessage());
        }
    }

    private void audit(Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.warn("Failed to update task log: {}", e.getMessage());
        }
    }

    static String newRunId(String topic) {
        String slug = topic.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
        if (slug.length() > 24) {
            slug = slug.substring(0, 24).replaceAll("-+$", "");
        }
        if (slug.isEmpty()) {
            slug = "topic";
        }
        return "run-" + slug + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static String newTaskId() {
        return "task-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
