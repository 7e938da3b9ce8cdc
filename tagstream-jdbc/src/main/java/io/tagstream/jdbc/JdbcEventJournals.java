package io.tagstream.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC journals with auto-detection support.
 *
 * <p>Journals are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.tagstream.jdbc.AbstractJdbcEventJournal}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcEventJournal journal = JdbcEventJournals.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcEventJournal journal = JdbcEventJournals.detect("jdbc:postgresql://localhost/events");
 *
 * // Get by name
 * AbstractJdbcEventJournal journal = JdbcEventJournals.get("h2");
 * }</pre>
 */
public final class JdbcEventJournals {

  private static final List<AbstractJdbcEventJournal> JOURNALS;
  private static final Map<String, AbstractJdbcEventJournal> BY_NAME = new ConcurrentHashMap<>();

  static {
    JOURNALS = ServiceLoader.load(AbstractJdbcEventJournal.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcEventJournal journal : JOURNALS) {
      BY_NAME.put(journal.name().toLowerCase(Locale.ROOT), journal);
    }
  }

  private JdbcEventJournals() {
  }

  /**
   * Returns all registered journals.
   */
  public static List<AbstractJdbcEventJournal> all() {
    return JOURNALS;
  }

  /**
   * Gets a journal by name.
   *
   * @param name journal name (case-insensitive)
   * @return the journal
   * @throws IllegalArgumentException if no journal is registered under that name
   */
  public static AbstractJdbcEventJournal get(String name) {
    AbstractJdbcEventJournal journal = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (journal == null) {
      throw new IllegalArgumentException("Unknown event journal: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return journal;
  }

  /**
   * Auto-detects the journal from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   */
  public static AbstractJdbcEventJournal detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event journal from DataSource", e);
    }
  }

  /**
   * Auto-detects the journal from a JDBC URL.
   *
   * @throws IllegalArgumentException if no registered journal handles the URL
   */
  public static AbstractJdbcEventJournal detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcEventJournal journal : JOURNALS) {
      for (String prefix : journal.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return journal;
        }
      }
    }

    throw new IllegalArgumentException("No event journal found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return JOURNALS.stream()
        .flatMap(j -> j.jdbcUrlPrefixes().stream())
        .toList();
  }
}
