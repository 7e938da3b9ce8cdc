package io.tagstream;

import java.util.Objects;

/**
 * Immutable, delivery-ready representation of one stored event, as emitted by
 * {@link io.tagstream.publisher.EventsByTagPublisher}.
 *
 * <p>{@code offset} is the journal ordering of the entry. Within one tag,
 * envelopes are totally ordered by offset and a subscriber observes them in
 * strictly increasing offset order.
 *
 * @param offset         journal ordering of the entry, {@code >= 0}
 * @param entityId       identifier of the entity that persisted the event
 * @param sequenceNumber per-entity sequence number, {@code >= 0}
 * @param payload        decoded domain payload
 */
public record EventEnvelope(long offset, String entityId, long sequenceNumber, Object payload) {

    public EventEnvelope {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        Objects.requireNonNull(entityId, "entityId");
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber must be >= 0");
        }
    }
}
