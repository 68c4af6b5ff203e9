package inkwell.coordinator.queue;

import inkwell.coordinator.MutableClock;
import inkwell.coordinator.error.QueueFullException;
import inkwell.coordinator.error.QueueTimeoutException;
import inkwell.coordinator.model.ControlMessage;
import inkwell.coordinator.model.Delivery;
import inkwell.coordinator.model.Destination;
import inkwell.coordinator.model.QueueStats;
import inkwell.coordinator.model.Stage;
import inkwell.coordinator.model.TaskMessage;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-process leased queue.
 */
class InMemoryMessageQueueTest {

    private static final Duration LEASE = Duration.ofSeconds(30);
    private static final Duration SHORT = Duration.ofMillis(50);

    private MutableClock clock;
    private InMemoryMessageQueue queue;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        queue = new InMemoryMessageQueue(10, LEASE, clock);
    }

    private TaskMessage task(String runId, String subject) {
        return TaskMessage.builder()
                .taskId("task-" + subject)
                .runId(runId)
                .stage(Stage.RESEARCHING)
                .subject(subject)
                .targetRole("researcher")
                .createdAt(clock.instant())
                .attempt(1)
                .build();
    }

    private String subjectOf(Delivery delivery) {
        return ((TaskMessage) delivery.message()).subject();
    }

    @Test
    void deliversInEnqueueOrderPerDestination() throws Exception {
        Destination researcher = Destination.role("researcher");
        queue.enqueue(task("run-1", "a"), researcher);
        queue.enqueue(task("run-1", "b"), researcher);
        queue.enqueue(task("run-1", "c"), researcher);

        assertEquals("a", subjectOf(queue.dequeue("researcher", SHORT)));
        assertEquals("b", subjectOf(queue.dequeue("researcher", SHORT)));
        assertEquals("c", subjectOf(queue.dequeue("researcher", SHORT)));
    }

    @Test
    void rejectsWhenDestinationIsFull() {
        InMemoryMessageQueue small = new InMemoryMessageQueue(2, LEASE, clock);
        Destination writer = Destination.role("writer");
        small.enqueue(task("run-1", "a"), writer);
        small.enqueue(task("run-1", "b"), writer);

        QueueFullException e = assertThrows(QueueFullException.class,
                () -> small.enqueue(task("run-1", "c"), writer));
        assertEquals(writer, e.destination());
        assertEquals(1, small.stats().rejected());
        assertEquals(2, small.depth("writer"));
    }

    @Test
    void leasedDeliveriesCountTowardsCapacity() throws Exception {
        InMemoryMessageQueue small = new InMemoryMessageQueue(1, LEASE, clock);
        Destination writer = Destination.role("writer");
        small.enqueue(task("run-1", "a"), writer);
        Delivery leased = small.dequeue("writer", SHORT);

        assertThrows(QueueFullException.class, () -> small.enqueue(task("run-1", "b"), writer));

        assertTrue(small.ack(leased.deliveryId()));
        assertEquals(1, small.enqueue(task("run-1", "b"), writer));
    }

    @Test
    void dequeueTimesOutWhenEmpty() {
        assertThrows(QueueTimeoutException.class, () -> queue.dequeue("editor", SHORT));
    }

    @Test
    void blockedConsumerWakesUpOnEnqueue() throws Exception {
        CompletableFuture<Delivery> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.dequeue("seo", Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        TimeUnit.MILLISECONDS.sleep(100);
        queue.enqueue(task("run-1", "keywords"), Destination.role("seo"));

        Delivery delivery = pending.get(5, TimeUnit.SECONDS);
        assertEquals("keywords", subjectOf(delivery));
    }

    @Test
    @DisplayName("Expired lease: message comes back ahead of later messages")
    void expiredLeaseIsRedeliveredInOriginalPosition() throws Exception {
        Destination researcher = Destination.role("researcher");
        queue.enqueue(task("run-1", "a"), researcher);
        queue.enqueue(task("run-1", "b"), researcher);

        Delivery first = queue.dequeue("researcher", SHORT);
        assertEquals("a", subjectOf(first));
        assertEquals(1, first.deliveryCount());

        // consumer crashed: never acks
        clock.advance(LEASE.plusSeconds(1));
        queue.enqueue(task("run-1", "c"), researcher);

        Delivery again = queue.dequeue("researcher", SHORT);
        assertEquals("a", subjectOf(again));
        assertEquals(first.deliveryId(), again.deliveryId());
        assertTrue(again.isRedelivery());
        assertEquals("b", subjectOf(queue.dequeue("researcher", SHORT)));
        assertEquals("c", subjectOf(queue.dequeue("researcher", SHORT)));
        assertEquals(1, queue.stats().redelivered());
    }

    @Test
    void redeliverExpiredReturnsLeasesWithoutConsumer() throws Exception {
        queue.enqueue(task("run-1", "a"), Destination.role("researcher"));
        Delivery leased = queue.dequeue("researcher", SHORT);
        assertEquals(0, queue.depth("researcher"));

        assertEquals(0, queue.redeliverExpired(clock.instant()));
        clock.advance(LEASE);
        assertEquals(1, queue.redeliverExpired(clock.instant()));

        assertEquals(1, queue.depth("researcher"));
        assertFalse(queue.ack(leased.deliveryId()), "stale lease must not ack the returned delivery");
    }

    @Test
    void ackConsumesExactlyOnce() throws Exception {
        queue.enqueue(task("run-1", "a"), Destination.role("researcher"));
        Delivery delivery = queue.dequeue("researcher", SHORT);

        assertTrue(queue.ack(delivery.deliveryId()));
        assertFalse(queue.ack(delivery.deliveryId()));

        clock.advance(LEASE.multipliedBy(2));
        assertEquals(0, queue.redeliverExpired(clock.instant()));
        assertThrows(QueueTimeoutException.class, () -> queue.dequeue("researcher", SHORT));
    }

    @Test
    void nackReturnsDeliveryImmediately() throws Exception {
        queue.enqueue(task("run-1", "a"), Destination.role("researcher"));
        queue.enqueue(task("run-1", "b"), Destination.role("researcher"));
        Delivery first = queue.dequeue("researcher", SHORT);

        assertTrue(queue.nack(first.deliveryId()));

        Delivery again = queue.dequeue("researcher", SHORT);
        assertEquals("a", subjectOf(again));
        assertEquals(2, again.deliveryCount());
    }

    @Test
    void topicFansOutToEverySubscriber() throws Exception {
        queue.subscribe("control", "writer");
        queue.subscribe("control", "editor");

        int deliveries = queue.enqueue(ControlMessage.abort("run-1", clock.instant()), Destination.topic("control"));
        assertEquals(2, deliveries);

        Delivery toWriter = queue.dequeue("writer", SHORT);
        Delivery toEditor = queue.dequeue("editor", SHORT);
        assertEquals(toWriter.message().id(), toEditor.message().id());
        assertNotEquals(toWriter.deliveryId(), toEditor.deliveryId());
        assertTrue(queue.ack(toWriter.deliveryId()));
        assertTrue(queue.ack(toEditor.deliveryId()));
    }

    @Test
    void topicWithoutSubscribersDropsMessage() {
        assertEquals(0, queue.enqueue(ControlMessage.shutdown(clock.instant()), Destination.topic("nobody")));

        queue.subscribe("control", "writer");
        queue.unsubscribe("control", "writer");
        assertEquals(0, queue.enqueue(ControlMessage.shutdown(clock.instant()), Destination.topic("control")));
        assertEquals(0, queue.stats().depth());
    }

    @Test
    void purgeDropsReadyAndLeasedDeliveriesOfRun() throws Exception {
        Destination researcher = Destination.role("researcher");
        queue.enqueue(task("run-1", "a"), researcher);
        queue.enqueue(task("run-2", "b"), researcher);
        queue.enqueue(task("run-1", "c"), researcher);
        Delivery leased = queue.dequeue("researcher", SHORT);
        assertEquals("run-1", leased.message().runId());

        assertEquals(2, queue.purge("run-1"));

        assertFalse(queue.ack(leased.deliveryId()));
        Delivery remaining = queue.dequeue("researcher", SHORT);
        assertEquals("run-2", remaining.message().runId());
        assertEquals(0, queue.depth("researcher"));
    }

    @Test
    void retiredDestinationDropsLaterMessages() {
        Destination inbox = Destination.scheduler("run-1");
        assertEquals(1, queue.enqueue(task("run-1", "a"), inbox));

        queue.retire(inbox);

        assertEquals(0, queue.enqueue(task("run-1", "b"), inbox));
        assertEquals(0, queue.depth(inbox.name()));
        assertThrows(IllegalArgumentException.class, () -> queue.retire(Destination.topic("control")));
    }

    @Test
    void retiredDestinationsAreBounded() {
        int total = InMemoryMessageQueue.MAX_RETIRED + 100;
        for (int i = 0; i < total; i++) {
            queue.retire(Destination.scheduler("run-" + i));
        }

        assertEquals(InMemoryMessageQueue.MAX_RETIRED, queue.retiredCount());
        String newest = "run-" + (total - 1);
        assertEquals(0, queue.enqueue(task(newest, "late"), Destination.scheduler(newest)));
    }

    @Test
    void statsReflectTraffic() throws Exception {
        queue.enqueue(task("run-1", "a"), Destination.role("researcher"));
        queue.enqueue(task("run-1", "b"), Destination.role("writer"));
        Delivery delivery = queue.dequeue("researcher", SHORT);
        queue.ack(delivery.deliveryId());

        QueueStats stats = queue.stats();
        assertEquals(1, stats.depth());
        assertEquals(0, stats.inFlight());
        assertEquals(2, stats.enqueued());
        assertEquals(1, stats.dequeued());
        assertEquals(1, stats.acked());
        assertEquals(1, stats.depthByDestination().get("writer"));
    }
}
