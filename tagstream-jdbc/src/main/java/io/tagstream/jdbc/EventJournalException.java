package io.tagstream.jdbc;

import io.tagstream.TagStreamException;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link AbstractJdbcEventJournal}
 * and {@link JdbcTaggedEventLog}.
 */
public final class EventJournalException extends TagStreamException {
  public EventJournalException(String message, Throwable cause) {
    super(message, cause);
  }
}
