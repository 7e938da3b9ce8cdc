package io.tagstream.spi;

import io.tagstream.model.StoredEvent;
import io.tagstream.util.JsonEventCodec;

/**
 * Symmetric codec used when the same process writes and reads the journal.
 *
 * @see #getDefault()
 */
public interface EventCodec extends EventDecoder {

    /**
     * Returns the default, dependency-free JSON codec.
     *
     * @return the default {@link EventCodec}
     */
    static EventCodec getDefault() {
        return JsonEventCodec.INSTANCE;
    }

    /**
     * Encodes an event for storage.
     *
     * @param event the event to encode
     * @return encoded bytes
     * @throws IllegalArgumentException if the payload cannot be represented
     */
    byte[] encode(StoredEvent event);
}
