package io.tagstream.journal;

import io.tagstream.model.RawEntry;
import io.tagstream.spi.EventsByTagQuery;
import io.tagstream.spi.TaggedEventLog;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Adapter that exposes a blocking {@link TaggedEventLog} as an {@link EventsByTagQuery}.
 *
 * <p>Reads run on the supplied {@link Executor}. A failing read completes the
 * returned stage exceptionally; a rejected submission is thrown to the caller.
 *
 * @see EventsByTagQuery#direct(TaggedEventLog)
 * @see EventsByTagQuery#blocking(TaggedEventLog, Executor)
 */
public final class TaggedEventLogQuery implements EventsByTagQuery {

    private final TaggedEventLog log;
    private final Executor executor;

    public TaggedEventLogQuery(TaggedEventLog log, Executor executor) {
        this.log = Objects.requireNonNull(log, "log");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletionStage<List<RawEntry>> eventsByTag(String tag, long fromOffset, int maxEntries) {
        Objects.requireNonNull(tag, "tag");
        if (maxEntries <= 0) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.supplyAsync(() -> log.readByTag(tag, fromOffset, maxEntries), executor);
    }
}
