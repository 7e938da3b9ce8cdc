package io.tagstream.publisher;

/**
 * Requested-but-undelivered element count plus the cancellation flag of one subscription.
 *
 * <p>Demand is mutated only from the publisher's mailbox; it is volatile so snapshots
 * taken after the mailbox stopped still read the last value. The cancellation flag is
 * set directly by the subscriber's thread so delivery stops before the cancel command
 * itself is processed.
 */
final class DemandTracker {
    private volatile long outstanding;
    private volatile boolean cancelled;

    /**
     * Adds demand, saturating at {@link Long#MAX_VALUE} (unbounded).
     *
     * @param n requested elements, {@code > 0}
     */
    void add(long n) {
        if (n <= 0) {
            throw new IllegalArgumentException("request must be > 0, was " + n);
        }
        long sum = outstanding + n;
        outstanding = sum < 0 ? Long.MAX_VALUE : sum;
    }

    long outstanding() {
        return outstanding;
    }

    boolean hasDemand() {
        return outstanding > 0;
    }

    /**
     * Accounts for one delivered element. Unbounded demand stays unbounded.
     */
    void consumeOne() {
        if (outstanding <= 0) {
            throw new IllegalStateException("no outstanding demand");
        }
        if (outstanding != Long.MAX_VALUE) {
            outstanding--;
        }
    }

    void cancel() {
        cancelled = true;
    }

    boolean isCancelled() {
        return cancelled;
    }
}
