package io.tagstream.publisher;

import com.github.f4b6a3.ulid.UlidCreator;
import io.tagstream.EventDecodingException;
import io.tagstream.EventEnvelope;
import io.tagstream.EventQueryException;
import io.tagstream.model.RawEntry;
import io.tagstream.model.StoredEvent;
import io.tagstream.spi.EventCodec;
import io.tagstream.spi.EventDecoder;
import io.tagstream.spi.EventsByTagQuery;
import io.tagstream.spi.MetricsExporter;
import io.tagstream.util.NamedThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Demand-aware, polling publisher streaming the events of one tag in offset order.
 *
 * <p>A periodic tick checks whether outstanding demand exceeds what the buffer holds.
 * If so, and the buffer has room, the publisher queries the journal from its cursor,
 * decodes at most the remaining buffer capacity, appends the batch, delivers as much
 * as is demanded and advances the cursor one past the highest merged offset. Only one
 * query is in flight at a time ({@link PublisherState.Polling}).
 *
 * <p>Failure policy is fail-fast: a failed query or a single undecodable entry ends the
 * stream with {@code onError}; nothing of the failing batch is delivered and no retry
 * is attempted. Cancellation stops the publisher at once; a query still in flight is
 * left to finish and its result is discarded.
 *
 * <p>Ticks, requests, cancellation and query completions are serialized on a
 * {@link Mailbox}, so cursor, buffer and demand are only ever touched by one thread at
 * a time. By default each publisher owns a single daemon thread, released when it
 * stops; a shared {@link ScheduledExecutorService} can be supplied instead via
 * {@link Builder#scheduler}.
 *
 * <p>Accepts exactly one subscriber. Create instances via {@link #builder()}.
 *
 * @see EventsByTagQuery
 * @see EventDecoder
 */
public final class EventsByTagPublisher implements Flow.Publisher<EventEnvelope>, AutoCloseable {
    private static final Logger logger = Logger.getLogger(EventsByTagPublisher.class.getName());

    private static final Flow.Subscription NOOP_SUBSCRIPTION = new Flow.Subscription() {
        @Override
        public void request(long n) {
        }

        @Override
        public void cancel() {
        }
    };

    private final String tag;
    private final long initialOffset;
    private final int maxBufferSize;
    private final boolean live;
    private final EventsByTagQuery query;
    private final EventDecoder decoder;
    private final MetricsExporter metrics;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final String publisherId;

    private final Mailbox mailbox;
    private final PollScheduler pollScheduler;
    private final DeliveryBuffer buffer;
    private final DemandTracker demand = new DemandTracker();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final AtomicBoolean subscribed = new AtomicBoolean();

    private volatile PublisherState state;
    private volatile Flow.Subscriber<? super EventEnvelope> subscriber;
    private boolean exhausted;

    private EventsByTagPublisher(Builder builder) {
        this.tag = Objects.requireNonNull(builder.tag, "tag");
        if (tag.isEmpty()) {
            throw new IllegalArgumentException("tag cannot be empty");
        }
        if (builder.offset < 0L) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (builder.maxBufferSize <= 0) {
            throw new IllegalArgumentException("maxBufferSize must be > 0");
        }
        Duration refreshInterval = Objects.requireNonNull(builder.refreshInterval, "refreshInterval");
        if (refreshInterval.isNegative() || refreshInterval.isZero()) {
            throw new IllegalArgumentException("refreshInterval must be > 0");
        }
        this.query = Objects.requireNonNull(builder.query, "query");

        this.initialOffset = builder.offset;
        this.maxBufferSize = builder.maxBufferSize;
        this.live = builder.live;
        this.decoder = builder.decoder != null ? builder.decoder : EventCodec.getDefault();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler
                ? Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("tagstream-" + tag + "-"))
                : builder.scheduler;
        this.publisherId = UlidCreator.getMonotonicUlid().toString();

        this.mailbox = new Mailbox(tag + "/" + publisherId, scheduler);
        this.pollScheduler = new PollScheduler(scheduler, refreshInterval, () -> mailbox.post(this::onTick));
        this.buffer = new DeliveryBuffer(maxBufferSize);
        this.state = new PublisherState.Active(Cursor.at(initialOffset));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String tag() {
        return tag;
    }

    public long initialOffset() {
        return initialOffset;
    }

    /**
     * @return unique, time-ordered identifier of this publisher, used in logs
     */
    public String publisherId() {
        return publisherId;
    }

    /**
     * Subscribes the single consumer of this publisher and starts the poll schedule.
     *
     * <p>A second subscriber, or any subscriber after {@link #close()}, receives
     * {@code onSubscribe} followed by {@code onError(IllegalStateException)}.
     */
    @Override
    public void subscribe(Flow.Subscriber<? super EventEnvelope> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        if (!subscribed.compareAndSet(false, true)) {
            reject(subscriber, "EventsByTagPublisher for tag '" + tag + "' accepts a single subscriber");
            return;
        }
        mailbox.post(() -> start(subscriber),
                () -> reject(subscriber, "EventsByTagPublisher for tag '" + tag + "' has been closed"));
    }

    /**
     * Runs the periodic poll check now, in addition to the schedule. Useful for tests
     * and for callers that know new events were just written.
     */
    public void requestPollCheck() {
        mailbox.post(this::onTick);
    }

    /**
     * Returns a snapshot computed on the publisher's execution context, so it reflects
     * every command posted before this call.
     *
     * @return a future completing with the snapshot
     */
    public CompletableFuture<PublisherSnapshot> snapshot() {
        CompletableFuture<PublisherSnapshot> result = new CompletableFuture<>();
        Runnable fill = () -> result.complete(takeSnapshot());
        mailbox.post(fill, fill);
        return result;
    }

    /**
     * Returns a future that completes normally once the stream is cancelled, completed
     * or closed, and exceptionally with the terminal failure otherwise.
     *
     * @return a read-only view of the termination signal
     */
    public CompletableFuture<Void> terminationFuture() {
        return termination.copy();
    }

    /**
     * Stops the publisher. A subscribed consumer that has not cancelled receives
     * {@code onComplete}. Does not wait for the stop to be processed; use
     * {@link #terminationFuture()} for that.
     */
    @Override
    public void close() {
        mailbox.post(() -> {
            if (!(state instanceof PublisherState.Stopped)) {
                logger.log(Level.FINE, "Publisher {0} for tag {1} closed", new Object[]{publisherId, tag});
                complete();
            }
        }, () -> termination.complete(null));
    }

    // --- commands, all executed on the mailbox ---

    private void start(Flow.Subscriber<? super EventEnvelope> subscriber) {
        if (state instanceof PublisherState.Stopped) {
            reject(subscriber, "EventsByTagPublisher for tag '" + tag + "' has been closed");
            return;
        }
        // Terminal signals only reach a subscriber that has been handed its subscription.
        this.subscriber = subscriber;
        try {
            subscriber.onSubscribe(new TagSubscription());
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Subscriber for tag " + tag + " threw from onSubscribe, cancelling", t);
            demand.cancel();
            stop();
            return;
        }
        pollScheduler.start();
        logger.log(Level.FINE, "Publisher {0} started for tag {1} at offset {2}",
                new Object[]{publisherId, tag, initialOffset});
    }

    private void onTick() {
        if (!(state instanceof PublisherState.Active active) || demand.isCancelled()) {
            return;
        }
        if (buffer.size() - demand.outstanding() < 0 && buffer.remainingCapacity() > 0) {
            startPoll(active);
        } else {
            deliverBuffer();
            completeIfExhausted();
        }
    }

    private void onRequest(long n) {
        if (state instanceof PublisherState.Stopped) {
            return;
        }
        try {
            demand.add(n);
        } catch (IllegalArgumentException e) {
            fail(e);
            return;
        }
        metrics.recordOutstandingDemand(demand.outstanding());
        if (state instanceof PublisherState.Active) {
            deliverBuffer();
            completeIfExhausted();
        }
    }

    private void onCancel() {
        if (state instanceof PublisherState.Stopped) {
            return;
        }
        logger.log(Level.INFO, "Subscriber cancelled stream for tag {0} at offset {1}, stopping publisher {2}",
                new Object[]{tag, state.cursor().nextOffset(), publisherId});
        stop();
    }

    private void startPoll(PublisherState.Active active) {
        PublisherState.Polling polling = active.startPolling();
        state = polling;
        long fromOffset = polling.cursor().nextOffset();
        int capacity = buffer.remainingCapacity();
        metrics.incrementPollsIssued();
        logger.log(Level.FINE, "Polling tag {0} from offset {1} with capacity {2}",
                new Object[]{tag, fromOffset, capacity});

        CompletionStage<List<RawEntry>> fetch;
        try {
            fetch = query.eventsByTag(tag, fromOffset, capacity);
        } catch (RuntimeException e) {
            failPoll(new EventQueryException("Query for tag '" + tag + "' from offset " + fromOffset + " failed", e));
            return;
        }
        if (fetch == null) {
            failPoll(new EventQueryException("Query for tag '" + tag + "' returned no result"));
            return;
        }
        fetch.whenComplete((entries, error) -> mailbox.post(() -> onFetchCompleted(polling, entries, error),
                () -> logger.log(Level.FINE, "Discarding query result for tag {0}, publisher {1} is stopped",
                        new Object[]{tag, publisherId})));
    }

    private void onFetchCompleted(PublisherState.Polling issuedIn, List<RawEntry> entries, Throwable error) {
        if (state != issuedIn) {
            logger.log(Level.FINE, "Discarding late query result for tag {0}, state is {1}",
                    new Object[]{tag, state.name()});
            return;
        }
        long fromOffset = issuedIn.cursor().nextOffset();
        if (error != null) {
            failPoll(new EventQueryException("Query for tag '" + tag + "' from offset " + fromOffset + " failed",
                    unwrap(error)));
            return;
        }
        if (entries == null) {
            failPoll(new EventQueryException("Query for tag '" + tag + "' returned a null batch"));
            return;
        }

        List<EventEnvelope> batch;
        try {
            batch = toEnvelopes(issuedIn.cursor(), entries);
        } catch (EventDecodingException | EventQueryException e) {
            failPoll(e);
            return;
        }
        buffer.appendAll(batch);
        metrics.recordEntriesFetched(batch.size());
        long highestMerged = batch.isEmpty() ? -1L : batch.get(batch.size() - 1).offset();
        logger.log(Level.FINE, "Merged {0} entries for tag {1}, buffer holds {2}",
                new Object[]{batch.size(), tag, buffer.size()});

        deliverBuffer();
        if (state != issuedIn) {
            return;
        }
        PublisherState.Active next = issuedIn.complete(highestMerged);
        state = next;
        metrics.recordCursorOffset(next.cursor().nextOffset());
        exhausted = batch.isEmpty();
        completeIfExhausted();
    }

    /**
     * Sorts the batch, skips entries the cursor has already passed, and decodes at most
     * the remaining buffer capacity. Any decoding failure fails the whole batch.
     */
    private List<EventEnvelope> toEnvelopes(Cursor cursor, List<RawEntry> entries) {
        List<RawEntry> sorted = new ArrayList<>(entries.size());
        for (RawEntry entry : entries) {
            if (entry == null) {
                throw new EventQueryException("Query for tag '" + tag + "' returned a null entry");
            }
            sorted.add(entry);
        }
        sorted.sort(Comparator.comparingLong(RawEntry::ordering));

        int capacity = buffer.remainingCapacity();
        List<EventEnvelope> batch = new ArrayList<>(Math.min(capacity, sorted.size()));
        long last = cursor.nextOffset() - 1;
        for (RawEntry entry : sorted) {
            if (batch.size() >= capacity) {
                break;
            }
            if (entry.ordering() <= last) {
                continue;
            }
            StoredEvent event;
            try {
                event = decoder.decode(entry.serialized());
            } catch (RuntimeException e) {
                throw new EventDecodingException(tag, entry.ordering(), e);
            }
            if (event == null) {
                throw new EventDecodingException(tag, entry.ordering(),
                        new NullPointerException("decoder returned null"));
            }
            batch.add(new EventEnvelope(entry.ordering(), event.entityId(), event.sequenceNumber(), event.payload()));
            last = entry.ordering();
        }
        return batch;
    }

    private void deliverBuffer() {
        while (demand.hasDemand() && !buffer.isEmpty() && !demand.isCancelled()
                && !(state instanceof PublisherState.Stopped)) {
            EventEnvelope envelope = buffer.poll();
            demand.consumeOne();
            metrics.incrementEnvelopesDelivered();
            try {
                subscriber.onNext(envelope);
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Subscriber for tag " + tag + " threw from onNext, cancelling", t);
                demand.cancel();
                stop();
                return;
            }
        }
        metrics.recordBufferDepth(buffer.size());
        metrics.recordOutstandingDemand(demand.outstanding());
    }

    private void completeIfExhausted() {
        if (!live && exhausted && buffer.isEmpty() && state instanceof PublisherState.Active) {
            logger.log(Level.FINE, "Tag {0} exhausted at offset {1}, completing",
                    new Object[]{tag, state.cursor().nextOffset()});
            complete();
        }
    }

    private void failPoll(Throwable cause) {
        metrics.incrementPollsFailed();
        fail(cause);
    }

    private void fail(Throwable cause) {
        if (state instanceof PublisherState.Stopped) {
            return;
        }
        logger.log(Level.WARNING, "Stream for tag " + tag + " failed at offset "
                + state.cursor().nextOffset() + ", stopping publisher " + publisherId, cause);
        halt(cause);
        Flow.Subscriber<? super EventEnvelope> target = subscriber;
        if (target != null && !demand.isCancelled()) {
            try {
                target.onError(cause);
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Subscriber for tag " + tag + " threw from onError", t);
            }
        }
        termination.completeExceptionally(cause);
    }

    private void complete() {
        halt(null);
        Flow.Subscriber<? super EventEnvelope> target = subscriber;
        if (target != null && !demand.isCancelled()) {
            try {
                target.onComplete();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Subscriber for tag " + tag + " threw from onComplete", t);
            }
        }
        termination.complete(null);
    }

    /**
     * Stops without signalling the subscriber, as required once it cancelled or broke
     * the subscriber contract.
     */
    private void stop() {
        halt(null);
        termination.complete(null);
    }

    /**
     * Enters the terminal state and releases the timer and, when owned, the thread.
     */
    private void halt(Throwable cause) {
        state = new PublisherState.Stopped(state.cursor(), cause);
        pollScheduler.close();
        buffer.clear();
        if (ownsScheduler) {
            scheduler.shutdown();
        }
    }

    private PublisherSnapshot takeSnapshot() {
        PublisherState current = state;
        return new PublisherSnapshot(current.name(), current.cursor().nextOffset(),
                current instanceof PublisherState.Stopped ? 0 : buffer.size(), demand.outstanding());
    }

    private static void reject(Flow.Subscriber<? super EventEnvelope> subscriber, String reason) {
        try {
            subscriber.onSubscribe(NOOP_SUBSCRIPTION);
        } finally {
            subscriber.onError(new IllegalStateException(reason));
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private final class TagSubscription implements Flow.Subscription {
        @Override
        public void request(long n) {
            if (!demand.isCancelled()) {
                mailbox.post(() -> onRequest(n));
            }
        }

        @Override
        public void cancel() {
            if (demand.isCancelled()) {
                return;
            }
            demand.cancel();
            mailbox.post(EventsByTagPublisher.this::onCancel);
        }
    }

    /**
     * Builder for {@link EventsByTagPublisher}.
     */
    public static final class Builder {
        private String tag;
        private long offset;
        private Duration refreshInterval = Duration.ofSeconds(3);
        private int maxBufferSize = 500;
        private boolean live = true;
        private EventsByTagQuery query;
        private EventDecoder decoder;
        private MetricsExporter metrics;
        private ScheduledExecutorService scheduler;

        private Builder() {
        }

        /**
         * Sets the tag to stream.
         *
         * <p><b>Required.</b> Must not be empty.
         *
         * @param tag the tag
         * @return this builder
         */
        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        /**
         * Sets the offset of the first entry to stream (inclusive).
         *
         * <p>Optional. Defaults to {@code 0}. Must be &ge; 0.
         *
         * @param offset initial offset
         * @return this builder
         */
        public Builder offset(long offset) {
            this.offset = offset;
            return this;
        }

        /**
         * Sets the period of the poll check. The first check runs on subscription.
         *
         * <p>Optional. Defaults to {@code 3s}. Must be &gt; 0.
         *
         * @param refreshInterval poll check period
         * @return this builder
         */
        public Builder refreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
            return this;
        }

        /**
         * Sets how many fetched envelopes may wait for demand.
         *
         * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
         *
         * @param maxBufferSize buffer bound
         * @return this builder
         */
        public Builder maxBufferSize(int maxBufferSize) {
            this.maxBufferSize = maxBufferSize;
            return this;
        }

        /**
         * Chooses between a live stream (polls forever, the default) and a current one
         * that completes once a poll finds nothing new and the buffer is drained.
         *
         * @param live {@code true} for a live stream
         * @return this builder
         */
        public Builder live(boolean live) {
            this.live = live;
            return this;
        }

        /**
         * Sets the storage query.
         *
         * <p><b>Required.</b>
         *
         * @param query the query gateway
         * @return this builder
         */
        public Builder query(EventsByTagQuery query) {
            this.query = query;
            return this;
        }

        /**
         * Sets the decoder applied to every fetched entry.
         *
         * <p>Optional. Defaults to {@link EventCodec#getDefault()}.
         *
         * @param decoder the decoder
         * @return this builder
         */
        public Builder decoder(EventDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Runs the publisher on a shared scheduler instead of a dedicated thread. The
         * publisher never shuts a shared scheduler down.
         *
         * <p>Optional.
         *
         * @param scheduler the shared scheduler
         * @return this builder
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Builds the publisher. Polling starts when a subscriber subscribes.
         *
         * @return a new {@link EventsByTagPublisher}
         * @throws NullPointerException     if {@code tag}, {@code query} or {@code refreshInterval} is null
         * @throws IllegalArgumentException if {@code tag} is empty, {@code offset < 0},
         *                                  {@code maxBufferSize <= 0} or {@code refreshInterval <= 0}
         */
        public EventsByTagPublisher build() {
            return new EventsByTagPublisher(this);
        }
    }
}
