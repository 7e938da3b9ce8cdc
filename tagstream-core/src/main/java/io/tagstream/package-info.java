/**
 * Root API of tagstream: ordered, backpressured streams of the events stored under
 * one tag of an append-only journal.
 *
 * <h2>Core Design</h2>
 * <p>Each subscription is served by an {@linkplain io.tagstream.publisher.EventsByTagPublisher
 * events-by-tag publisher}. A periodic check polls the journal only while the
 * subscriber has asked for more than the publisher's buffer holds; fetched entries are
 * decoded, buffered up to a fixed bound and handed out strictly in offset order. The
 * publisher's cursor moves one past the highest offset it fetched, so no entry is
 * delivered twice. Any query or decoding failure ends the stream with {@code onError}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>tagstream-core</b> - publisher, SPIs, in-memory journal, JSON codec (zero external
 *       deps besides ULID generation)</li>
 *   <li><b>tagstream-jdbc</b> - JDBC tagged event log (H2, MySQL, PostgreSQL)</li>
 *   <li><b>tagstream-micrometer</b> - Micrometer metrics exporter</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var log = new InMemoryEventJournal();
 * try (TagReadJournal journal = TagReadJournal.builder().eventLog(log).build()) {
 *     journal.write(new StoredEvent("cart-7", 1, "item-added"), Set.of("carts"));
 *     journal.currentEventsByTag("carts", 0L).subscribe(subscriber);
 * }
 * }</pre>
 *
 * @see io.tagstream.TagReadJournal
 * @see io.tagstream.EventEnvelope
 * @see io.tagstream.ReadJournalConfig
 */
package io.tagstream;
