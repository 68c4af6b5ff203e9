package inkwell.coordinator.queue;

import inkwell.coordinator.error.QueueFullException;
import inkwell.coordinator.error.QueueTimeoutException;
import inkwell.coordinator.model.Delivery;
import inkwell.coordinator.model.Destination;
import inkwell.coordinator.model.QueueMessage;
import inkwell.coordinator.model.QueueStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local queue with one lane per consuming role.
 *
 * A lane keeps ready deliveries ordered by sequence number, so a delivery whose lease
 * expired goes back in front of anything enqueued after it. Topic messages are copied
 * into the lane of every subscribed role.
 */
public class InMemoryMessageQueue implements MessageQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageQueue.class);

    /** Retired destinations remembered; the oldest is forgotten first. */
    static final int MAX_RETIRED = 1024;

    private final int capacity;
    private final Duration lease;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Lane> lanes = new HashMap<>();
    private final Map<String, Delivery> inFlight = new LinkedHashMap<>();
    private final Map<String, Set<String>> subscribers = new HashMap<>();
    private final Set<String> retired = Collections.newSetFromMap(new LinkedHashMap<>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > MAX_RETIRED;
        }
    });
    private long sequence = 0;

    private final LongAdder enqueued = new LongAdder();
    private final LongAdder dequeued = new LongAdder();
    private final LongAdder acked = new LongAdder();
    private final LongAdder redelivered = new LongAdder();
    private final LongAdder rejected = new LongAdder();

    public InMemoryMessageQueue(int capacity, Duration lease) {
        this(capacity, lease, Clock.systemUTC());
    }

    public InMemoryMessageQueue(int capacity, Duration lease, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        if (lease.isNegative() || lease.isZero()) {
            throw new IllegalArgumentException("lease must be positive");
        }
        this.capacity = capacity;
        this.lease = lease;
        this.clock = clock;
    }

    @Override
    public int enqueue(QueueMessage message, Destination destination) {
        lock.lock();
        try {
            List<String> roles = targetRoles(destination);
            if (roles.isEmpty()) {
                log.debug("No subscribers for {}, dropping {}", destination, message.id());
                return 0;
            }

            for (String role : roles) {
                Lane lane = lane(role);
                if (lane.size() >= capacity) {
                    rejected.increment();
                    throw new QueueFullException(destination.isTopic() ? destination : Destination.role(role),
                            capacity);
                }
            }

            Instant now = clock.instant();
            for (String role : roles) {
                String deliveryId = destination.isTopic() ? message.id() + "@" + role : message.id();
                Delivery delivery = new Delivery(deliveryId, destination, message, ++sequence, now, null, 0);
                Lane lane = lane(role);
                lane.ready.put(delivery.sequence(), delivery);
                lane.notEmpty.signal();
                enqueued.increment();
            }
            log.debug("Enqueued {} to {} ({} deliveries)", message.id(), destination, roles.size());
            return roles.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Delivery dequeue(String role, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        lock.lockInterruptibly();
        try {
            Lane lane = lane(role);
            while (true) {
                reclaimExpired(lane, clock.instant());
                Map.Entry<Long, Delivery> head = lane.ready.pollFirstEntry();
                if (head != null) {
                    Delivery leased = head.getValue().leased(clock.instant().plus(lease));
                    inFlight.put(leased.deliveryId(), leased);
                    lane.leased++;
                    dequeued.increment();
                    if (leased.isRedelivery()) {
                        redelivered.increment();
                    }
                    return leased;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new QueueTimeoutException(role, timeout);
                }
                lane.notEmpty.awaitNanos(Math.min(remaining, lease.toNanos()));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean ack(String deliveryId) {
        lock.lock();
        try {
            Delivery delivery = inFlight.remove(deliveryId);
            if (delivery == null) {
                log.debug("Ack for unknown delivery {}", deliveryId);
                return false;
            }
            lane(roleOf(delivery)).leased--;
            acked.increment();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean nack(String deliveryId) {
        lock.lock();
        try {
            Delivery delivery = inFlight.remove(deliveryId);
            if (delivery == null) {
                return false;
            }
            Lane lane = lane(roleOf(delivery));
            lane.leased--;
            lane.ready.put(delivery.sequence(), delivery.released());
            lane.notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void subscribe(String topic, String role) {
        lock.lock();
        try {
            subscribers.computeIfAbsent(topic, t -> new LinkedHashSet<>()).add(role);
            log.debug("Role {} subscribed to topic {}", role, topic);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void unsubscribe(String topic, String role) {
        lock.lock();
        try {
            Set<String> roles = subscribers.get(topic);
            if (roles != null) {
                roles.remove(role);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int redeliverExpired(Instant now) {
        lock.lock();
        try {
            int count = 0;
            for (Lane lane : lanes.values()) {
                count += reclaimExpired(lane, now);
            }
            if (count > 0) {
                log.info("Returned {} expired deliveries", count);
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int purge(String runId) {
        lock.lock();
        try {
            int count = 0;
            for (Lane lane : lanes.values()) {
                Iterator<Delivery> it = lane.ready.values().iterator();
                while (it.hasNext()) {
                    if (runId.equals(it.next().message().runId())) {
                        it.remove();
                        count++;
                    }
                }
            }
            Iterator<Delivery> leased = inFlight.values().iterator();
            while (leased.hasNext()) {
                Delivery delivery = leased.next();
                if (runId.equals(delivery.message().runId())) {
                    leased.remove();
                    lane(roleOf(delivery)).leased--;
                    count++;
                }
            }
            log.info("Purged {} deliveries of run {}", count, runId);
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void retire(Destination destination) {
        if (destination.isTopic()) {
            throw new IllegalArgumentException("only role destinations can be retired");
        }
        lock.lock();
        try {
            retired.add(destination.name());
            Lane lane = lanes.remove(destination.name());
            if (lane != null) {
                inFlight.values().removeIf(d -> roleOf(d).equals(destination.name()));
                lane.notEmpty.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int depth(String role) {
        lock.lock();
        try {
            Lane lane = lanes.get(role);
            return lane == null ? 0 : lane.ready.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueStats stats() {
        lock.lock();
        try {
            Map<String, Integer> byDestination = new TreeMap<>();
            int depth = 0;
            for (Map.Entry<String, Lane> e : lanes.entrySet()) {
                int size = e.getValue().ready.size();
                if (size > 0) {
                    byDestination.put(e.getKey(), size);
                }
                depth += size;
            }
            return new QueueStats(depth, inFlight.size(), enqueued.sum(), dequeued.sum(), acked.sum(),
                    redelivered.sum(), rejected.sum(), byDestination);
        } finally {
            lock.unlock();
        }
    }

    int retiredCount() {
        lock.lock();
        try {
            return retired.size();
        } finally {
            lock.unlock();
        }
    }

    // ---- internals, lock held ----

    private List<String> targetRoles(Destination destination) {
        if (!destination.isTopic()) {
            if (retired.contains(destination.name())) {
                return List.of();
            }
            return List.of(destination.name());
        }
        Set<String> roles = subscribers.get(destination.name());
        return roles == null ? List.of() : new ArrayList<>(roles);
    }

    private int reclaimExpired(Lane lane, Instant now) {
        if (lane.leased == 0) {
            return 0;
        }
        int count = 0;
        Iterator<Delivery> it = inFlight.values().iterator();
        while (it.hasNext()) {
            Delivery delivery = it.next();
            if (lanes.get(roleOf(delivery)) == lane && delivery.leaseExpired(now)) {
                it.remove();
                lane.leased--;
                lane.ready.put(delivery.sequence(), delivery.released());
                lane.notEmpty.signal();
                count++;
                log.debug("Lease expired for {}, redelivering", delivery.deliveryId());
            }
        }
        return count;
    }

    private Lane lane(String role) {
        return lanes.computeIfAbsent(role, r -> new Lane(lock.newCondition()));
    }

    private static String roleOf(Delivery delivery) {
        String id = delivery.deliveryId();
        if (delivery.destination().isTopic()) {
            return id.substring(id.lastIndexOf('@') + 1);
        }
        return delivery.destination().name();
    }

    private static final class Lane {
        final TreeMap<Long, Delivery> ready = new TreeMap<>();
        final Condition notEmpty;
        int leased;

        Lane(Condition notEmpty) {
            this.notEmpty = notEmpty;
        }

        int size() {
            return ready.size() + leased;
        }
    }
}
