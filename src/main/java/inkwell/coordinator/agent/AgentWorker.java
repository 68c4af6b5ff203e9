package inkwell.coordinator.agent;

import inkwell.coordinator.error.QueueFullException;
import inkwell.coordinator.error.QueueTimeoutException;
import inkwell.coordinator.error.StoreUnavailableException;
import inkwell.coordinator.memory.MemoryKeys;
import inkwell.coordinator.memory.MemoryStore;
import inkwell.coordinator.model.CompletionMessage;
import inkwell.coordinator.model.ControlMessage;
import inkwell.coordinator.model.Delivery;
import inkwell.coordinator.model.Destination;
import inkwell.coordinator.model.MemoryTier;
import inkwell.coordinator.model.QueueMessage;
import inkwell.coordinator.model.TaskMessage;
import inkwell.coordinator.queue.MessageQueue;
import inkwell.coordinator.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Drives one {@link AgentAdapter} off the queue.
 * Loops: dequeue role → perform → store candidate → report completion → ack.
 * Stops cleanly on Thread.interrupt() or a SHUTDOWN control message.
 *
 * The delivery is acked only after the completion was enqueued, so a crash in between
 * leads to a redelivery. Message ids already handled are remembered and acked without
 * running the adapter again.
 */
public final class AgentWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(AgentWorker.class);

    private static final int PROCESSED_CAPACITY = 1024;

    private final AgentAdapter adapter;
    private final MessageQueue queue;
    private final MemoryStore store;
    private final Set<String> abortedRuns;
    private final Duration pollTimeout;
    private final Backoff backoff;
    private final Clock clock;
    private final Map<String, Boolean> processed = Collections.synchronizedMap(
            new LinkedHashMap<>(64, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > PROCESSED_CAPACITY;
                }
            });

    private volatile boolean stopped = false;

    public AgentWorker(AgentAdapter adapter, MessageQueue queue, MemoryStore store, Set<String> abortedRuns,
            Duration pollTimeout, Backoff backoff, Clock clock) {
        this.adapter = adapter;
        this.queue = queue;
        this.store = store;
        this.abortedRuns = abortedRuns;
        this.pollTimeout = pollTimeout;
        this.backoff = backoff;
        this.clock = clock;
    }

    public String role() {
        return adapter.role();
    }

    @Override
    public void run() {
        log.info("Agent worker for role {} started", adapter.role());

        while (!stopped && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Agent worker {} error", adapter.role(), e);
                try {
                    Thread.sleep(pollTimeout.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Agent worker for role {} stopped", adapter.role());
    }

    /**
     * Handle at most one delivery.
     *
     * @return false if nothing arrived within the poll timeout
     */
    public boolean pollOnce() throws InterruptedException {
        Delivery delivery;
        try {
            delivery = queue.dequeue(adapter.role(), pollTimeout);
        } catch (QueueTimeoutException e) {
            return false;
        }

        QueueMessage message = delivery.message();
        if (message instanceof ControlMessage control) {
            handleControl(control);
            queue.ack(delivery.deliveryId());
        } else if (message instanceof TaskMessage task) {
            handleTask(delivery, task);
        } else {
            log.warn("Role {} received unexpected {}, dropping", adapter.role(), message.getClass().getSimpleName());
            queue.ack(delivery.deliveryId());
        }
        return true;
    }

    public void stop() {
        stopped = true;
    }

    private void handleControl(ControlMessage control) {
        switch (control.command()) {
            case ABORT -> {
                abortedRuns.add(control.runId());
                log.info("Role {} dropping remaining work of aborted run {}", adapter.role(), control.runId());
            }
            case SHUTDOWN -> stop();
        }
    }

    private void handleTask(Delivery delivery, TaskMessage task) throws InterruptedException {
        if (processed.containsKey(task.id())) {
            log.debug("Task message {} already handled, acking redelivery", task.id());
            queue.ack(delivery.deliveryId());
            return;
        }
        if (abortedRuns.contains(task.runId())) {
            log.debug("Dropping task {} of aborted run {}", task.id(), task.runId());
            queue.ack(delivery.deliveryId());
            return;
        }

        CompletionMessage completion = execute(task);

        try {
            backoff.call("Report completion of " + task.id(),
                    () -> queue.enqueue(completion, Destination.scheduler(task.runId())),
                    QueueFullException.class);
        } catch (QueueFullException e) {
            log.warn("Could not report completion of {}, returning it for redelivery: {}", task.id(), e.getMessage());
            queue.nack(delivery.deliveryId());
            return;
        }

        processed.put(task.id(), Boolean.TRUE);
        queue.ack(delivery.deliveryId());
        log.debug("Role {} finished {} ({}/{} attempt {}): {}", adapter.role(), task.id(), task.stage().key(),
                task.subject(), task.attempt(), completion.status());
    }

    private CompletionMessage execute(TaskMessage task) throws InterruptedException {
        AgentResult result;
        try {
            result = adapter.perform(task, new AgentContext(task, store));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Role {} failed task {} (attempt {}): {}", adapter.role(), task.taskId(), task.attempt(),
                    e.getMessage());
            return CompletionMessage.failure(task, describe(e), clock.instant());
        }

        String key = MemoryKeys.candidate(task.stage(), task.subject(), adapter.role(), task.attempt());
        try {
            backoff.run("Store result of " + task.id(),
                    () -> store.put(task.runId(), key, result.value(), MemoryTier.SHORT_TERM, adapter.role()),
                    StoreUnavailableException.class);
        } catch (StoreUnavailableException e) {
            return CompletionMessage.failure(task, "result could not be stored: " + e.getMessage(), clock.instant());
        }

        return result.partial()
                ? CompletionMessage.partial(task, key, clock.instant())
                : CompletionMessage.success(task, key, clock.instant());
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message;
    }
}
