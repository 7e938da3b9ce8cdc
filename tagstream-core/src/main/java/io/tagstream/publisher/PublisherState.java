package io.tagstream.publisher;

import java.util.Objects;

/**
 * State of the delivery state machine. Each state carries the cursor it was entered
 * with; transitions produce new values instead of mutating the current one.
 *
 * <ul>
 *   <li>{@link Active} - idle, no fetch in flight.</li>
 *   <li>{@link Polling} - one fetch outstanding; no second fetch may start.</li>
 *   <li>{@link Stopped} - terminal, reached from any state.</li>
 * </ul>
 */
public sealed interface PublisherState
        permits PublisherState.Active, PublisherState.Polling, PublisherState.Stopped {

    Cursor cursor();

    /**
     * @return short state name for logs and snapshots
     */
    String name();

    record Active(Cursor cursor) implements PublisherState {
        public Active {
            Objects.requireNonNull(cursor, "cursor");
        }

        Polling startPolling() {
            return new Polling(cursor);
        }

        @Override
        public String name() {
            return "ACTIVE";
        }
    }

    record Polling(Cursor cursor) implements PublisherState {
        public Polling {
            Objects.requireNonNull(cursor, "cursor");
        }

        /**
         * @param highestMerged highest offset merged by the completed fetch, or
         *                      {@code -1} if nothing was merged
         */
        Active complete(long highestMerged) {
            return new Active(highestMerged < 0 ? cursor : cursor.advancePast(highestMerged));
        }

        @Override
        public String name() {
            return "POLLING";
        }
    }

    /**
     * @param cursor last cursor before stopping
     * @param cause  failure that stopped the stream, {@code null} for a clean stop
     */
    record Stopped(Cursor cursor, Throwable cause) implements PublisherState {
        public Stopped {
            Objects.requireNonNull(cursor, "cursor");
        }

        @Override
        public String name() {
            return cause == null ? "STOPPED" : "FAILED";
        }
    }
}
