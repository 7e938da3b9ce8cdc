package io.tagstream.jdbc;

import java.util.List;

/**
 * PostgreSQL journal.
 */
public final class PostgresEventJournal extends AbstractJdbcEventJournal {

  public PostgresEventJournal() {
    super();
  }

  public PostgresEventJournal(String journalTable, String tagTable) {
    super(journalTable, tagTable);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected List<String> createTableStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + journalTable() + " (" +
            "ordering BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
            "payload BYTEA NOT NULL, " +
            "created_at TIMESTAMPTZ NOT NULL)",
        "CREATE TABLE IF NOT EXISTS " + tagTable() + " (" +
            "tag VARCHAR(255) NOT NULL, " +
            "ordering BIGINT NOT NULL, " +
            "PRIMARY KEY (tag, ordering))");
  }
}
