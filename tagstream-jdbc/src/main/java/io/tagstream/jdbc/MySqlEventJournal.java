package io.tagstream.jdbc;

import java.util.List;

/**
 * MySQL journal. Also compatible with TiDB.
 */
public final class MySqlEventJournal extends AbstractJdbcEventJournal {

  public MySqlEventJournal() {
    super();
  }

  public MySqlEventJournal(String journalTable, String tagTable) {
    super(journalTable, tagTable);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected List<String> createTableStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + journalTable() + " (" +
            "ordering BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY, " +
            "payload LONGBLOB NOT NULL, " +
            "created_at TIMESTAMP(3) NOT NULL) ENGINE=InnoDB",
        "CREATE TABLE IF NOT EXISTS " + tagTable() + " (" +
            "tag VARCHAR(255) NOT NULL, " +
            "ordering BIGINT NOT NULL, " +
            "PRIMARY KEY (tag, ordering)) ENGINE=InnoDB");
  }
}
