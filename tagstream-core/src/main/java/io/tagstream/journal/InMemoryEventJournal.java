package io.tagstream.journal;

import io.tagstream.model.RawEntry;
import io.tagstream.spi.TaggedEventLog;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Thread-safe in-memory {@link TaggedEventLog}.
 *
 * <p>Orderings start at {@code 0} and are shared by all tags. Each tag keeps its own
 * ordered index, so a read touches only the entries of the requested tag. Byte
 * arrays are copied on the way in and out.
 *
 * <p>Intended for tests and single-process use; nothing survives a restart.
 */
public final class InMemoryEventJournal implements TaggedEventLog {

    private final Map<String, NavigableMap<Long, byte[]>> byTag = new HashMap<>();
    private long nextOrdering;

    @Override
    public synchronized long append(byte[] serialized, Set<String> tags) {
        Objects.requireNonNull(serialized, "serialized");
        Objects.requireNonNull(tags, "tags");
        long ordering = nextOrdering++;
        byte[] copy = serialized.clone();
        for (String tag : tags) {
            if (tag == null || tag.isEmpty()) {
                throw new IllegalArgumentException("tags cannot contain null or empty values");
            }
            byTag.computeIfAbsent(tag, t -> new TreeMap<>()).put(ordering, copy);
        }
        return ordering;
    }

    @Override
    public synchronized List<RawEntry> readByTag(String tag, long fromOrdering, int limit) {
        Objects.requireNonNull(tag, "tag");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        NavigableMap<Long, byte[]> index = byTag.get(tag);
        if (index == null) {
            return List.of();
        }
        List<RawEntry> result = new ArrayList<>(Math.min(limit, index.size()));
        for (Map.Entry<Long, byte[]> entry : index.tailMap(Math.max(0L, fromOrdering), true).entrySet()) {
            if (result.size() >= limit) {
                break;
            }
            result.add(new RawEntry(entry.getKey(), entry.getValue().clone()));
        }
        return result;
    }

    @Override
    public synchronized long highestOrdering() {
        return nextOrdering - 1;
    }

    /**
     * @return number of entries indexed under {@code tag}
     */
    public synchronized int countByTag(String tag) {
        NavigableMap<Long, byte[]> index = byTag.get(tag);
        return index == null ? 0 : index.size();
    }
}
