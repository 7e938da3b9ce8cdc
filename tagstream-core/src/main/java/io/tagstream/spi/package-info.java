/**
 * Service Provider Interfaces (SPI) for plugging storage, decoding and metrics
 * into a tag stream.
 *
 * @see io.tagstream.spi.EventsByTagQuery
 * @see io.tagstream.spi.TaggedEventLog
 * @see io.tagstream.spi.EventDecoder
 * @see io.tagstream.spi.EventCodec
 * @see io.tagstream.spi.ConnectionProvider
 * @see io.tagstream.spi.MetricsExporter
 */
package io.tagstream.spi;
