/**
 * JDBC-backed {@link io.tagstream.spi.TaggedEventLog}.
 *
 * <p>{@link io.tagstream.jdbc.AbstractJdbcEventJournal} provides the shared SQL and row
 * mapping; subclasses supply table DDL for H2, MySQL and PostgreSQL.
 * {@link io.tagstream.jdbc.JdbcTaggedEventLog} adds connection and transaction handling.
 *
 * @see io.tagstream.jdbc.AbstractJdbcEventJournal
 * @see io.tagstream.jdbc.H2EventJournal
 * @see io.tagstream.jdbc.MySqlEventJournal
 * @see io.tagstream.jdbc.PostgresEventJournal
 * @see io.tagstream.jdbc.JdbcEventJournals
 */
package io.tagstream.jdbc;
