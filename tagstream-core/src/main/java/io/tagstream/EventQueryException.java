package io.tagstream;

/**
 * Thrown when the storage query behind a tag stream fails or returns a result
 * the publisher cannot use.
 *
 * <p>Not retried: the publisher stops and whoever created it decides whether to
 * start a new one from the last observed offset.
 */
public class EventQueryException extends TagStreamException {

    public EventQueryException(String message) {
        super(message);
    }

    public EventQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
