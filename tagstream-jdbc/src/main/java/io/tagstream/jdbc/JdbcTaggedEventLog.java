package io.tagstream.jdbc;

import io.tagstream.model.RawEntry;
import io.tagstream.spi.ConnectionProvider;
import io.tagstream.spi.TaggedEventLog;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link TaggedEventLog} stored in a relational database.
 *
 * <p>Each call borrows a connection from the {@link ConnectionProvider}. An append
 * writes the journal row and its tag rows in one transaction, so a reader never sees
 * an entry under only some of its tags. Reads block the calling thread; pair this
 * log with {@link io.tagstream.spi.EventsByTagQuery#blocking} to keep them off the
 * publisher's thread.
 *
 * <pre>{@code
 * JdbcTaggedEventLog log = JdbcTaggedEventLog.create(dataSource);
 * log.createSchema();
 * }</pre>
 */
public final class JdbcTaggedEventLog implements TaggedEventLog {
  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcEventJournal journal;

  public JdbcTaggedEventLog(ConnectionProvider connectionProvider, AbstractJdbcEventJournal journal) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.journal = Objects.requireNonNull(journal, "journal");
  }

  /**
   * Creates a log over {@code dataSource}, detecting the dialect from its JDBC URL.
   */
  public static JdbcTaggedEventLog create(DataSource dataSource) {
    return new JdbcTaggedEventLog(new DataSourceConnectionProvider(dataSource),
        JdbcEventJournals.detect(dataSource));
  }

  public AbstractJdbcEventJournal journal() {
    return journal;
  }

  /**
   * Creates the journal and tag tables if they do not exist.
   */
  public void createSchema() {
    try (Connection conn = connectionProvider.getConnection()) {
      journal.createSchema(conn);
    } catch (SQLException e) {
      throw new EventJournalException("Failed to create journal schema", e);
    }
  }

  @Override
  public long append(byte[] serialized, Set<String> tags) {
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        long ordering = journal.append(conn, serialized, tags);
        conn.commit();
        return ordering;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new EventJournalException("Failed to append journal entry", e);
    }
  }

  @Override
  public List<RawEntry> readByTag(String tag, long fromOrdering, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return journal.readByTag(conn, tag, fromOrdering, limit);
    } catch (SQLException e) {
      throw new EventJournalException("Failed to read entries for tag " + tag, e);
    }
  }

  @Override
  public long highestOrdering() {
    try (Connection conn = connectionProvider.getConnection()) {
      return journal.highestOrdering(conn);
    } catch (SQLException e) {
      throw new EventJournalException("Failed to read highest ordering", e);
    }
  }

  private static void rollback(Connection conn, Exception failure) {
    try {
      conn.rollback();
    } catch (SQLException rollbackFailure) {
      failure.addSuppressed(rollbackFailure);
    }
  }
}
