package inkwell.coordinator.scheduler;

import inkwell.coordinator.queue.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Background task that returns deliveries whose lease ran out.
 *
 * A lease runs out when a consumer dequeued a message and then
 * crashed, hung, or lost its ack. The delivery goes back to its
 * destination at its original position and counts as a redelivery.
 */
public class LeaseReaper {

    private static final Logger log = LoggerFactory.getLogger(LeaseReaper.class);

    private final MessageQueue queue;
    private final Clock clock;

    public LeaseReaper(MessageQueue queue, Clock clock) {
        this.queue = queue;
        this.clock = clock;
    }

    /**
     * @return number of deliveries made available again
     */
    public int reapExpiredLeases() {
        int returned = queue.redeliverExpired(clock.instant());
        if (returned == 0) {
            log.debug("No expired leases found");
        }
        return returned;
    }
}
