package io.tagstream;

/**
 * Base unchecked exception for failures surfaced by a tag stream.
 *
 * <p>Every exception of this family is terminal for the publisher that raised it:
 * the subscriber receives it through {@code onError} and the publisher stops.
 */
public class TagStreamException extends RuntimeException {

    public TagStreamException(String message) {
        super(message);
    }

    public TagStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
