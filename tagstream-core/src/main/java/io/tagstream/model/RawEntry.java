package io.tagstream.model;

import java.util.Objects;

/**
 * Journal entry as returned by the storage engine, before decoding.
 *
 * @param ordering   global, strictly increasing journal ordering
 * @param serialized encoded event; not guaranteed to decode
 */
public record RawEntry(long ordering, byte[] serialized) {

    public RawEntry {
        if (ordering < 0) {
            throw new IllegalArgumentException("ordering must be >= 0");
        }
        Objects.requireNonNull(serialized, "serialized");
    }
}
