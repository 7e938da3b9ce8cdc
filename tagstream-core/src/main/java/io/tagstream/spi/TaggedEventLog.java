package io.tagstream.spi;

import io.tagstream.model.RawEntry;

import java.util.List;
import java.util.Set;

/**
 * Blocking contract of an append-only journal whose entries carry tags.
 *
 * <p>Orderings are assigned by the log on append, are non-negative, and strictly
 * increase across the whole log (not per tag). An entry is visible under every tag
 * it was appended with.
 *
 * @see EventsByTagQuery#direct(TaggedEventLog)
 * @see EventsByTagQuery#blocking(TaggedEventLog, java.util.concurrent.Executor)
 */
public interface TaggedEventLog {

    /**
     * Appends one encoded event.
     *
     * @param serialized encoded event
     * @param tags       tags to index the event under, may be empty
     * @return the ordering assigned to the entry
     */
    long append(byte[] serialized, Set<String> tags);

    /**
     * Reads entries tagged {@code tag} with ordering {@code >= fromOrdering}, ordered
     * ascending.
     *
     * @param tag          tag to read
     * @param fromOrdering lowest ordering to return
     * @param limit        maximum number of entries, {@code > 0}
     * @return matching entries, never {@code null}
     */
    List<RawEntry> readByTag(String tag, long fromOrdering, int limit);

    /**
     * @return the highest ordering assigned so far, or {@code -1} if the log is empty
     */
    long highestOrdering();
}
