package io.tagstream.jdbc;

import io.tagstream.model.RawEntry;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base JDBC journal with standard SQL for appending and reading tagged entries.
 *
 * <p>Entries live in a journal table keyed by an identity {@code ordering}; a tag
 * table holds one {@code (tag, ordering)} row per tag of an entry. Every method runs
 * on the caller's connection and leaves transaction control to the caller.
 * Subclasses supply the dialect-specific DDL and must declare {@code ordering} as the
 * first column of the journal table, since it is read back as the first generated
 * key. Register custom implementations via
 * {@code META-INF/services/io.tagstream.jdbc.AbstractJdbcEventJournal}.
 *
 * @see JdbcEventJournals
 * @see JdbcTaggedEventLog
 */
public abstract class AbstractJdbcEventJournal {

  protected static final JdbcTemplate.RowMapper<RawEntry> ENTRY_ROW_MAPPER = rs -> new RawEntry(
      rs.getLong("ordering"),
      rs.getBytes("payload"));

  private final String journalTable;
  private final String tagTable;

  protected AbstractJdbcEventJournal() {
    this(TableNames.DEFAULT_JOURNAL_TABLE, TableNames.DEFAULT_TAG_TABLE);
  }

  protected AbstractJdbcEventJournal(String journalTable, String tagTable) {
    this.journalTable = TableNames.validate(journalTable);
    this.tagTable = TableNames.validate(tagTable);
  }

  /**
   * Unique identifier for this journal (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this journal handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Statements creating both tables if they do not exist yet.
   */
  protected abstract List<String> createTableStatements();

  protected String journalTable() {
    return journalTable;
  }

  protected String tagTable() {
    return tagTable;
  }

  public void createSchema(Connection conn) {
    JdbcTemplate.execute(conn, createTableStatements());
  }

  /**
   * Inserts the entry and one tag row per tag.
   *
   * @return the ordering generated for the entry
   */
  public long append(Connection conn, byte[] payload, Set<String> tags) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(tags, "tags");
    for (String tag : tags) {
      if (tag == null || tag.isEmpty()) {
        throw new IllegalArgumentException("tags cannot contain null or empty values");
      }
    }
    String insertEntry = "INSERT INTO " + journalTable + " (payload, created_at) VALUES (?,?)";
    long ordering = JdbcTemplate.insertReturningKey(conn, insertEntry,
        payload, Timestamp.from(Instant.now()));

    List<Object[]> tagRows = new ArrayList<>(tags.size());
    for (String tag : tags) {
      tagRows.add(new Object[]{tag, ordering});
    }
    JdbcTemplate.batchUpdate(conn, "INSERT INTO " + tagTable + " (tag, ordering) VALUES (?,?)", tagRows);
    return ordering;
  }

  public List<RawEntry> readByTag(Connection conn, String tag, long fromOrdering, int limit) {
    Objects.requireNonNull(tag, "tag");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    String sql = "SELECT j.ordering, j.payload FROM " + tagTable + " t " +
        "JOIN " + journalTable + " j ON j.ordering = t.ordering " +
        "WHERE t.tag = ? AND t.ordering >= ? ORDER BY t.ordering LIMIT ?";
    return JdbcTemplate.query(conn, sql, ENTRY_ROW_MAPPER, tag, fromOrdering, limit);
  }

  /**
   * @return the highest ordering in the journal, or {@code -1} when it is empty
   */
  public long highestOrdering(Connection conn) {
    String sql = "SELECT COALESCE(MAX(ordering), -1) AS highest FROM " + journalTable;
    return JdbcTemplate.query(conn, sql, rs -> rs.getLong("highest")).get(0);
  }
}
