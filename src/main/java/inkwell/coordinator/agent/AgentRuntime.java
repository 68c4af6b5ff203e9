package inkwell.coordinator.agent;

import inkwell.coordinator.memory.MemoryStore;
import inkwell.coordinator.model.ControlMessage;
import inkwell.coordinator.model.Destination;
import inkwell.coordinator.queue.MessageQueue;
import inkwell.coordinator.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the registered adapters, each on its own worker threads.
 */
public class AgentRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentRuntime.class);

    /** Aborted runs remembered for dropping late tasks; older ones are forgotten first. */
    static final int MAX_ABORTED_RUNS = 500;

    private final MessageQueue queue;
    private final MemoryStore store;
    private final Duration pollTimeout;
    private final Clock clock;
    private final Map<String, AgentAdapter> adapters = new LinkedHashMap<>();
    private final Map<String, Integer> workerCounts = new LinkedHashMap<>();
    private final List<AgentWorker> workers = new ArrayList<>();
    private final Set<String> abortedRuns = newAbortedRunSet();
    private final AtomicInteger threadIds = new AtomicInteger(1);

    private ExecutorService executor;
    private volatile boolean running = false;

    public AgentRuntime(MessageQueue queue, MemoryStore store, Duration pollTimeout, Clock clock) {
        this.queue = queue;
        this.store = store;
        this.pollTimeout = pollTimeout;
        this.clock = clock;
    }

    /**
     * Register an adapter; one role can only be registered once.
     */
    public synchronized AgentRuntime register(AgentAdapter adapter, int workerCount) {
        if (adapters.containsKey(adapter.role())) {
            throw new IllegalArgumentException("Adapter already registered for role " + adapter.role());
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        adapters.put(adapter.role(), adapter);
        workerCounts.put(adapter.role(), workerCount);
        log.info("Registered adapter {} for role {} ({} workers)", adapter.getClass().getSimpleName(),
                adapter.role(), workerCount);
        if (running) {
            startWorkers(adapter, workerCount);
        }
        return this;
    }

    static Set<String> newAbortedRunSet() {
        return Collections.synchronizedSet(Collections.newSetFromMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > MAX_ABORTED_RUNS;
            }
        }));
    }

    public synchronized Set<String> roles() {
        return Set.copyOf(adapters.keySet());
    }

    public synchronized void start() {
        if (running) {
            log.warn("Agent runtime already running");
            return;
        }
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "inkwell-agent-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        running = true;
        adapters.forEach((role, adapter) -> startWorkers(adapter, workerCounts.get(role)));
        log.info("Agent runtime started with roles {}", adapters.keySet());
    }

    private void startWorkers(AgentAdapter adapter, int count) {
        queue.subscribe(Destination.CONTROL_TOPIC, adapter.role());
        for (int i = 0; i < count; i++) {
            AgentWorker worker = new AgentWorker(adapter, queue, store, abortedRuns, pollTimeout,
                    Backoff.defaults(), clock);
            workers.add(worker);
            executor.submit(worker);
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        workers.forEach(AgentWorker::stop);
        try {
            queue.enqueue(ControlMessage.shutdown(clock.instant()), Destination.topic(Destination.CONTROL_TOPIC));
        } catch (RuntimeException e) {
            log.debug("Could not broadcast shutdown: {}", e.getMessage());
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Agent workers did not stop in time");
            } else {
                log.info("Agent runtime stopped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        workers.clear();
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
    }
}
