package io.tagstream.model;

import java.util.Objects;

/**
 * Decoded form of a journal entry: the event as persisted by its entity.
 *
 * @param entityId       identifier of the persisting entity
 * @param sequenceNumber per-entity sequence number
 * @param payload        domain payload
 */
public record StoredEvent(String entityId, long sequenceNumber, Object payload) {

    public StoredEvent {
        Objects.requireNonNull(entityId, "entityId");
        if (entityId.isEmpty()) {
            throw new IllegalArgumentException("entityId cannot be empty");
        }
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber must be >= 0");
        }
    }
}
