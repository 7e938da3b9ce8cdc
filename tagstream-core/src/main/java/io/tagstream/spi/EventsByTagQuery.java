package io.tagstream.spi;

import io.tagstream.journal.TaggedEventLogQuery;
import io.tagstream.model.RawEntry;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Narrow, asynchronous view of the storage engine used by a tag stream publisher.
 *
 * <p>A publisher issues at most one call at a time. Implementations should return
 * entries ordered by {@link RawEntry#ordering()} ascending; the publisher sorts
 * each batch anyway and ignores entries below {@code fromOffset}.
 *
 * @see TaggedEventLog
 */
@FunctionalInterface
public interface EventsByTagQuery {

    /**
     * Fetches entries tagged {@code tag} whose ordering is {@code >= fromOffset}.
     *
     * @param tag        tag to read
     * @param fromOffset lowest ordering to return
     * @param maxEntries how many entries the caller can absorb; implementations may
     *                   return more, the surplus is dropped by the publisher
     * @return a stage completing with the batch, or exceptionally on storage failure
     */
    CompletionStage<List<RawEntry>> eventsByTag(String tag, long fromOffset, int maxEntries);

    /**
     * Adapts a blocking log by reading on the calling thread. Suitable for
     * in-memory logs whose reads never block.
     *
     * @param log the log to read from
     * @return a query returning already-completed stages
     */
    static EventsByTagQuery direct(TaggedEventLog log) {
        return new TaggedEventLogQuery(log, Runnable::run);
    }

    /**
     * Adapts a blocking log by running every read on {@code executor}.
     *
     * @param log      the log to read from
     * @param executor executor to run blocking reads on
     * @return a query completing its stages on {@code executor}
     */
    static EventsByTagQuery blocking(TaggedEventLog log, Executor executor) {
        return new TaggedEventLogQuery(log, executor);
    }
}
