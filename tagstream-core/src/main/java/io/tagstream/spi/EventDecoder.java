package io.tagstream.spi;

import io.tagstream.EventDecodingException;
import io.tagstream.model.StoredEvent;

/**
 * Turns the bytes of a journal entry back into the event that was stored.
 */
@FunctionalInterface
public interface EventDecoder {

    /**
     * Decodes one entry.
     *
     * @param serialized encoded event
     * @return the decoded event
     * @throws EventDecodingException if the bytes are malformed or incompatible
     */
    StoredEvent decode(byte[] serialized);
}
