package inkwell.coordinator.model;

import java.time.Instant;

/**
 * A message as held by the queue for one destination.
 *
 * @param sequence       enqueue order; redelivered messages keep their original position
 * @param leaseExpiresAt set while the delivery is in flight
 * @param deliveryCount  how many times the delivery was handed to a consumer
 */
public record Delivery(
        String deliveryId,
        Destination destination,
        QueueMessage message,
        long sequence,
        Instant enqueuedAt,
        Instant leaseExpiresAt,
        int deliveryCount) {

    public Delivery leased(Instant expiresAt) {
        return new Delivery(deliveryId, destination, message, sequence, enqueuedAt, expiresAt, deliveryCount + 1);
    }

    public Delivery released() {
        return new Delivery(deliveryId, destination, message, sequence, enqueuedAt, null, deliveryCount);
    }

    public boolean isRedelivery() {
        return deliveryCount > 1;
    }

    public boolean leaseExpired(Instant now) {
        return leaseExpiresAt != null && !leaseExpiresAt.isAfter(now);
    }
}
