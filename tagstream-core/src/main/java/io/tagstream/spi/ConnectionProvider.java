package io.tagstream.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to journal implementations. Callers close what they obtain.
 */
@FunctionalInterface
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;
}
