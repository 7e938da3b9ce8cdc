package io.tagstream.publisher;

import io.tagstream.EventEnvelope;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Bounded FIFO of envelopes fetched but not yet delivered.
 *
 * <p>Contents are strictly increasing in offset. Not thread-safe: owned by a single
 * publisher and touched only from its mailbox.
 */
final class DeliveryBuffer {
    private final int maxSize;
    private final ArrayDeque<EventEnvelope> envelopes;

    DeliveryBuffer(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;
        this.envelopes = new ArrayDeque<>(Math.min(maxSize, 1024));
    }

    int size() {
        return envelopes.size();
    }

    boolean isEmpty() {
        return envelopes.isEmpty();
    }

    int remainingCapacity() {
        return maxSize - envelopes.size();
    }

    /**
     * Appends a batch in order.
     *
     * @throws IllegalStateException if the batch overflows the bound or is not strictly
     *                               above the current tail
     */
    void appendAll(List<EventEnvelope> batch) {
        if (batch.size() > remainingCapacity()) {
            throw new IllegalStateException("batch of " + batch.size()
                    + " exceeds remaining capacity " + remainingCapacity());
        }
        long last = envelopes.isEmpty() ? -1L : envelopes.peekLast().offset();
        for (EventEnvelope envelope : batch) {
            if (envelope.offset() <= last) {
                throw new IllegalStateException("offset " + envelope.offset()
                        + " does not follow " + last);
            }
            last = envelope.offset();
        }
        envelopes.addAll(batch);
    }

    /**
     * @return the oldest envelope, or {@code null} when empty
     */
    EventEnvelope poll() {
        return envelopes.pollFirst();
    }

    void clear() {
        envelopes.clear();
    }
}
