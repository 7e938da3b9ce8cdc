package io.tagstream.publisher;

/**
 * Immutable position from which the next poll queries the journal.
 *
 * <p>A cursor only moves forward: {@link #advancePast(long)} never returns a cursor
 * behind this one.
 */
public final class Cursor {
    private final long nextOffset;

    private Cursor(long nextOffset) {
        this.nextOffset = nextOffset;
    }

    /**
     * @param offset initial offset, {@code >= 0}
     * @return a cursor positioned at {@code offset}
     */
    public static Cursor at(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        return new Cursor(offset);
    }

    public long nextOffset() {
        return nextOffset;
    }

    /**
     * Returns the cursor positioned one past {@code highestOffset}, or this cursor if
     * that would move it backwards.
     *
     * @param highestOffset highest offset merged by a poll
     * @return the advanced cursor
     */
    public Cursor advancePast(long highestOffset) {
        if (highestOffset == Long.MAX_VALUE) {
            throw new IllegalStateException("offset space exhausted");
        }
        long candidate = highestOffset + 1;
        return candidate > nextOffset ? new Cursor(candidate) : this;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Cursor other && other.nextOffset == nextOffset;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(nextOffset);
    }

    @Override
    public String toString() {
        return "Cursor[" + nextOffset + "]";
    }
}
