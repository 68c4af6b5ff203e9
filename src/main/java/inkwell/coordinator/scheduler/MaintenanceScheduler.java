package inkwell.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Named housekeeping jobs sharing one daemon thread, so no two of them overlap.
 * A job that throws is logged and runs again at its next slot.
 *
 * <pre>
 * new MaintenanceScheduler("inkwell-maintenance")
 *         .every("lease-reaper", Duration.ofSeconds(5), reaper::reapExpiredLeases)
 *         .start();
 * </pre>
 */
public class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private record Job(String name, Duration interval, Runnable action) {
    }

    private final String threadName;
    private final List<Job> jobs = new ArrayList<>();
    private final Map<String, AtomicLong> completed = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> failed = new ConcurrentHashMap<>();

    private ScheduledExecutorService executor;

    public MaintenanceScheduler(String threadName) {
        this.threadName = threadName;
    }

    /**
     * Register a job; jobs added after {@link #start()} are scheduled right away.
     */
    public synchronized MaintenanceScheduler every(String name, Duration interval, Runnable action) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval of " + name + " must be positive");
        }
        if (completed.containsKey(name)) {
            throw new IllegalArgumentException("job " + name + " already registered");
        }
        Job job = new Job(name, interval, action);
        jobs.add(job);
        completed.put(name, new AtomicLong());
        failed.put(name, new AtomicLong());
        if (executor != null) {
            schedule(job);
        }
        return this;
    }

    public synchronized void start() {
        if (executor != null) {
            log.warn("Maintenance already running");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        jobs.forEach(this::schedule);
        log.info("Maintenance started with {} jobs", jobs.size());
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Maintenance forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Maintenance stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    public synchronized List<String> jobNames() {
        return jobs.stream().map(Job::name).toList();
    }

    /** Runs of the job that returned normally. */
    public long completedRuns(String name) {
        AtomicLong count = completed.get(name);
        return count == null ? 0 : count.get();
    }

    public long failedRuns(String name) {
        AtomicLong count = failed.get(name);
        return count == null ? 0 : count.get();
    }

    private void schedule(Job job) {
        long everyMs = job.interval().toMillis();
        executor.scheduleWithFixedDelay(() -> runGuarded(job), everyMs, everyMs, TimeUnit.MILLISECONDS);
        log.info("Scheduled {} every {}ms", job.name(), everyMs);
    }

    private void runGuarded(Job job) {
        try {
            job.action().run();
            completed.get(job.name()).incrementAndGet();
        } catch (RuntimeException e) {
            failed.get(job.name()).incrementAndGet();
            log.error("Maintenance job {} failed", job.name(), e);
        }
    }
}
