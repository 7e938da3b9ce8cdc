package io.tagstream.jdbc;

import java.util.List;

/**
 * H2 journal. Primarily for testing.
 */
public final class H2EventJournal extends AbstractJdbcEventJournal {

  public H2EventJournal() {
    super();
  }

  public H2EventJournal(String journalTable, String tagTable) {
    super(journalTable, tagTable);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected List<String> createTableStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + journalTable() + " (" +
            "ordering BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
            "payload VARBINARY NOT NULL, " +
            "created_at TIMESTAMP NOT NULL)",
        "CREATE TABLE IF NOT EXISTS " + tagTable() + " (" +
            "tag VARCHAR(255) NOT NULL, " +
            "ordering BIGINT NOT NULL, " +
            "PRIMARY KEY (tag, ordering))");
  }
}
