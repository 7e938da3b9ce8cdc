package io.tagstream.publisher;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic timer that asks the publisher whether a poll is warranted.
 *
 * <p>Holds no query logic: every tick only posts {@code onTick} to the publisher's
 * mailbox. The first tick fires immediately on {@link #start()}. {@link #close()} is
 * idempotent and must be called on every path that stops the publisher.
 */
final class PollScheduler implements AutoCloseable {
    private final ScheduledExecutorService scheduler;
    private final long intervalMs;
    private final Runnable onTick;

    private ScheduledFuture<?> tickTask;
    private boolean closed;

    PollScheduler(ScheduledExecutorService scheduler, Duration refreshInterval, Runnable onTick) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.onTick = Objects.requireNonNull(onTick, "onTick");
        Objects.requireNonNull(refreshInterval, "refreshInterval");
        if (refreshInterval.isNegative() || refreshInterval.isZero()) {
            throw new IllegalArgumentException("refreshInterval must be > 0");
        }
        this.intervalMs = Math.max(1L, refreshInterval.toMillis());
    }

    synchronized void start() {
        if (closed || tickTask != null) {
            return;
        }
        tickTask = scheduler.scheduleWithFixedDelay(onTick, 0L, intervalMs, TimeUnit.MILLISECONDS);
    }

    synchronized boolean isRunning() {
        return tickTask != null && !closed;
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
    }
}
