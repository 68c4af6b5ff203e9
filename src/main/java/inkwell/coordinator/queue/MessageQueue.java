package inkwell.coordinator.queue;

import inkwell.coordinator.error.QueueFullException;
import inkwell.coordinator.error.QueueTimeoutException;
import inkwell.coordinator.model.Delivery;
import inkwell.coordinator.model.Destination;
import inkwell.coordinator.model.QueueMessage;
import inkwell.coordinator.model.QueueStats;

import java.time.Duration;
import java.time.Instant;

/**
 * Asynchronous transport between the scheduler, agents and listeners.
 *
 * Delivery is at-least-once: a dequeued delivery is leased, and if it is not
 * acked before the lease runs out it becomes eligible again, keeping its
 * original position. Order is FIFO per destination and undefined across destinations.
 */
public interface MessageQueue {

    /**
     * Enqueue without blocking.
     *
     * @return number of deliveries created (subscriber count for a topic, 1 for a role)
     * @throws QueueFullException if the destination (or any topic subscriber) is at capacity
     */
    int enqueue(QueueMessage message, Destination destination);

    /**
     * Take the next delivery for a role, waiting up to {@code timeout}.
     *
     * @throws QueueTimeoutException if nothing became available in time
     */
    Delivery dequeue(String role, Duration timeout) throws InterruptedException;

    /**
     * Consume a leased delivery.
     *
     * @return false if the delivery is unknown (already acked, purged or redelivered to someone else)
     */
    boolean ack(String deliveryId);

    /**
     * Return a leased delivery to its destination immediately.
     */
    boolean nack(String deliveryId);

    void subscribe(String topic, String role);

    void unsubscribe(String topic, String role);

    /**
     * Make deliveries with expired leases available again.
     *
     * @return number of deliveries returned
     */
    int redeliverExpired(Instant now);

    /**
     * Drop undelivered and leased messages belonging to a run.
     *
     * @return number of deliveries dropped
     */
    int purge(String runId);

    /**
     * Close a role destination for good. Later messages to it are dropped.
     */
    void retire(Destination destination);

    int depth(String role);

    QueueStats stats();
}
