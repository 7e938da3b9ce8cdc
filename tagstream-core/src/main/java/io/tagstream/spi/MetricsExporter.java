package io.tagstream.spi;

/**
 * Observability hook for exporting publisher counters and gauges to a metrics backend.
 *
 * <p>Calls are made from the publisher's own execution context, one at a time per
 * publisher; an exporter shared by several publishers must be thread-safe.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of fetches issued against the storage engine.
     */
    void incrementPollsIssued();

    /**
     * Increments the count of polls that ended the stream with a failure.
     */
    void incrementPollsFailed();

    /**
     * Records how many entries a successful poll merged into the buffer.
     *
     * @param count merged entries, possibly {@code 0}
     */
    void recordEntriesFetched(int count);

    /**
     * Increments the count of envelopes handed to the subscriber.
     */
    void incrementEnvelopesDelivered();

    /**
     * Records the number of envelopes waiting in the buffer.
     *
     * @param depth buffer length
     */
    default void recordBufferDepth(int depth) {
    }

    /**
     * Records requested-but-undelivered demand.
     *
     * @param demand outstanding demand, {@link Long#MAX_VALUE} meaning unbounded
     */
    default void recordOutstandingDemand(long demand) {
    }

    /**
     * Records the cursor after a successful poll.
     *
     * @param nextOffset the next offset the publisher will query from
     */
    default void recordCursorOffset(long nextOffset) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPollsIssued() {
        }

        @Override
        public void incrementPollsFailed() {
        }

        @Override
        public void recordEntriesFetched(int count) {
        }

        @Override
        public void incrementEnvelopesDelivered() {
        }
    }
}
