/**
 * Tagged event log implementations and adapters onto the publisher's query SPI.
 *
 * @see io.tagstream.journal.InMemoryEventJournal
 * @see io.tagstream.journal.TaggedEventLogQuery
 */
package io.tagstream.journal;
