package io.tagstream;

/**
 * Thrown when a stored entry cannot be decoded into a domain event.
 *
 * <p>A single decoding failure fails the whole poll it belongs to; none of the
 * entries of that batch are delivered.
 */
public class EventDecodingException extends TagStreamException {

    private final String tag;
    private final long ordering;

    /**
     * Creates an exception without entry coordinates, as thrown by a decoder.
     *
     * @param message detail message
     * @param cause   the underlying cause, may be {@code null}
     */
    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
        this.tag = null;
        this.ordering = -1L;
    }

    /**
     * Creates an exception locating the entry that failed.
     *
     * @param tag      tag being streamed
     * @param ordering journal ordering of the failing entry
     * @param cause    the decoder failure
     */
    public EventDecodingException(String tag, long ordering, Throwable cause) {
        super("Failed to decode entry at ordering " + ordering + " for tag '" + tag + "'", cause);
        this.tag = tag;
        this.ordering = ordering;
    }

    /**
     * @return the tag being streamed, or {@code null} if raised directly by a decoder
     */
    public String tag() {
        return tag;
    }

    /**
     * @return the ordering of the failing entry, or {@code -1} if unknown
     */
    public long ordering() {
        return ordering;
    }
}
