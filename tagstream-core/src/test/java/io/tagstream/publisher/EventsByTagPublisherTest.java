package io.tagstream.publisher;

import io.tagstream.EventDecodingException;
import io.tagstream.EventEnvelope;
import io.tagstream.EventQueryException;
import io.tagstream.journal.InMemoryEventJournal;
import io.tagstream.model.RawEntry;
import io.tagstream.model.StoredEvent;
import io.tagstream.spi.EventCodec;
import io.tagstream.spi.EventsByTagQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventsByTagPublisherTest {
    private static final String TAG = "X";

    private final EventCodec codec = EventCodec.getDefault();
    private final List<EventsByTagPublisher> publishers = new ArrayList<>();
    private InMemoryEventJournal journal;
    private ScheduledExecutorService sharedScheduler;

    @BeforeEach
    void setup() {
        journal = new InMemoryEventJournal();
    }

    @AfterEach
    void teardown() {
        publishers.forEach(EventsByTagPublisher::close);
        if (sharedScheduler != null) {
            sharedScheduler.shutdownNow();
        }
    }

    // --- scenarios ---

    @Test
    void deliversAllEntriesWhenDemandAndCapacitySuffice() throws Exception {
        writeEvents(3, TAG);
        StubQuery query = StubQuery.delegatingTo(EventsByTagQuery.direct(journal));
        EventsByTagPublisher publisher = track(builder(query).maxBufferSize(10).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(5);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitItems(3));
        PublisherSnapshot snapshot = publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(List.of(0L, 1L, 2L), subscriber.offsets());
        assertEquals(3L, snapshot.nextOffset());
        assertEquals(0, snapshot.bufferSize());
        assertEquals(2L, snapshot.demand());
        assertEquals("ACTIVE", snapshot.state());
        assertEquals(1, query.calls.size());
        assertEquals(new StubQuery.Call(TAG, 0L, 10), query.calls.get(0));

        publisher.requestPollCheck();
        publisher.snapshot().get(5, TimeUnit.SECONDS);

        assertEquals(2, query.calls.size());
        assertEquals(3L, query.calls.get(1).fromOffset());
        assertEquals(3L, publisher.snapshot().get(5, TimeUnit.SECONDS).nextOffset());
        assertEquals(3, subscriber.items().size());
    }

    @Test
    void smallBufferDefersRemainingEntriesToNextPoll() throws Exception {
        writeEvents(3, TAG);
        StubQuery query = StubQuery.delegatingTo(EventsByTagQuery.direct(journal));
        EventsByTagPublisher publisher = track(builder(query).maxBufferSize(2).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(5);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitItems(2));
        PublisherSnapshot first = publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(List.of(0L, 1L), subscriber.offsets());
        assertEquals(2L, first.nextOffset());
        assertEquals(0, first.bufferSize());
        assertEquals(new StubQuery.Call(TAG, 0L, 2), query.calls.get(0));

        publisher.requestPollCheck();

        assertTrue(subscriber.awaitItems(3));
        PublisherSnapshot second = publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(List.of(0L, 1L, 2L), subscriber.offsets());
        assertEquals(3L, second.nextOffset());
        assertEquals(new StubQuery.Call(TAG, 2L, 2), query.calls.get(1));
    }

    @Test
    void noPollWithoutDemand() throws Exception {
        writeEvents(2, TAG);
        StubQuery query = StubQuery.delegatingTo(EventsByTagQuery.direct(journal));
        EventsByTagPublisher publisher = track(builder(query).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(0);

        publisher.subscribe(subscriber);
        assertTrue(subscriber.awaitSubscribed());
        publisher.requestPollCheck();
        publisher.snapshot().get(5, TimeUnit.SECONDS);

        assertTrue(query.calls.isEmpty());

        subscriber.request(1);
        publisher.requestPollCheck();

        assertTrue(subscriber.awaitItems(1));
        publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(List.of(0L), subscriber.offsets());
        assertEquals(1, query.calls.size());
    }

    @Test
    void undecodableEntryFailsWholeBatch() throws Exception {
        writeEvents(1, TAG);
        journal.append("not json".getBytes(StandardCharsets.UTF_8), Set.of(TAG));
        StubQuery query = StubQuery.delegatingTo(EventsByTagQuery.direct(journal));
        RecordingMetrics metrics = new RecordingMetrics();
        EventsByTagPublisher publisher = track(builder(query).metrics(metrics).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(5);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitTerminated());
        EventDecodingException error = assertInstanceOf(EventDecodingException.class, subscriber.error);
        assertEquals(TAG, error.tag());
        assertEquals(1L, error.ordering());
        assertTrue(subscriber.items().isEmpty());
        ExecutionException terminal = assertThrows(ExecutionException.class,
                () -> publisher.terminationFuture().get(5, TimeUnit.SECONDS));
        assertSame(error, terminal.getCause());

        publisher.requestPollCheck();
        PublisherSnapshot snapshot = publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals("FAILED", snapshot.state());
        assertEquals(1, query.calls.size());
        assertEquals(1, metrics.pollsFailed.get());
        assertEquals(0, metrics.delivered.get());
    }

    @Test
    void cancelDuringPollDiscardsLateResult() throws Exception {
        CompletableFuture<List<RawEntry>> pending = new CompletableFuture<>();
        StubQuery query = new StubQuery(call -> pending);
        EventsByTagPublisher publisher = track(builder(query).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(5);

        publisher.subscribe(subscriber);
        assertNotNull(query.awaitCall());
        assertEquals("POLLING", publisher.snapshot().get(5, TimeUnit.SECONDS).state());

        subscriber.cancel();
        publisher.terminationFuture().get(5, TimeUnit.SECONDS);
        pending.complete(List.of(entry(0, "late")));

        PublisherSnapshot snapshot = publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals("STOPPED", snapshot.state());
        assertEquals(0L, snapshot.nextOffset());
        assertTrue(subscriber.items().isEmpty());
        assertEquals(0, subscriber.terminalSignals());
    }

    @Test
    void cancelDuringPollOnSharedSchedulerDiscardsLateResult() throws Exception {
        sharedScheduler = Executors.newScheduledThreadPool(2);
        CompletableFuture<List<RawEntry>> pending = new CompletableFuture<>();
        StubQuery query = new StubQuery(call -> pending);
        EventsByTagPublisher publisher = track(builder(query).scheduler(sharedScheduler).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(5);

        publisher.subscribe(subscriber);
        assertNotNull(query.awaitCall());

        subscriber.cancel();
        publisher.terminationFuture().get(5, TimeUnit.SECONDS);
        pending.complete(List.of(entry(0, "late")));

        PublisherSnapshot snapshot = publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals("STOPPED", snapshot.state());
        assertEquals(0L, snapshot.nextOffset());
        assertTrue(subscriber.items().isEmpty());
        assertFalse(sharedScheduler.isShutdown());
    }

    // --- ordering and bounds ---

    @Test
    void sortsAndDeduplicatesUnorderedBatch() throws Exception {
        StubQuery query = StubQuery.returning(List.of(entry(2, "c"), entry(0, "a"), entry(1, "b"), entry(1, "b")));
        EventsByTagPublisher publisher = track(builder(query).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(10);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitItems(3));
        PublisherSnapshot snapshot = publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(List.of(0L, 1L, 2L), subscriber.offsets());
        assertEquals("a", subscriber.items().get(0).payload());
        assertEquals(3L, snapshot.nextOffset());
    }

    @Test
    void skipsEntriesBelowInitialOffset() throws Exception {
        StubQuery query = StubQuery.returning(List.of(entry(3, "old"), entry(5, "first"), entry(6, "second")));
        EventsByTagPublisher publisher = track(builder(query).offset(5).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(10);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitItems(2));
        publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(List.of(5L, 6L), subscriber.offsets());
        assertEquals(5L, query.calls.get(0).fromOffset());
    }

    @Test
    void oversizedBatchIsTruncatedToCapacity() throws Exception {
        List<RawEntry> five = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            five.add(entry(i, "e" + i));
        }
        StubQuery query = StubQuery.returning(five);
        EventsByTagPublisher publisher = track(builder(query).maxBufferSize(2).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(1);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitItems(1));
        PublisherSnapshot snapshot = publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(List.of(0L), subscriber.offsets());
        assertEquals(2L, snapshot.nextOffset());
        assertEquals(1, snapshot.bufferSize());
        assertEquals(0L, snapshot.demand());
    }

    @Test
    void doesNotPollWhileBufferCoversDemand() throws Exception {
        writeEvents(5, TAG);
        StubQuery query = StubQuery.delegatingTo(EventsByTagQuery.direct(journal));
        EventsByTagPublisher publisher = track(builder(query).maxBufferSize(3).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(1);

        publisher.subscribe(subscriber);
        assertTrue(subscriber.awaitItems(1));
        publisher.requestPollCheck();
        PublisherSnapshot saturated = publisher.snapshot().get(5, TimeUnit.SECONDS);

        assertEquals(1, query.calls.size());
        assertEquals(2, saturated.bufferSize());
        assertEquals(3L, saturated.nextOffset());

        subscriber.request(1);
        publisher.requestPollCheck();
        assertTrue(subscriber.awaitItems(2));
        publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(1, query.calls.size());

        subscriber.request(5);
        publisher.requestPollCheck();

        assertTrue(subscriber.awaitItems(5));
        PublisherSnapshot drained = publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(List.of(0L, 1L, 2L, 3L, 4L), subscriber.offsets());
        assertEquals(2, query.calls.size());
        assertEquals(new StubQuery.Call(TAG, 3L, 3), query.calls.get(1));
        assertEquals(2L, drained.demand());
    }

    @Test
    void neverDeliversMoreThanRequested() throws Exception {
        writeEvents(6, TAG);
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal)).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(2);

        publisher.subscribe(subscriber);
        assertTrue(subscriber.awaitItems(2));
        publisher.requestPollCheck();
        PublisherSnapshot snapshot = publisher.snapshot().get(5, TimeUnit.SECONDS);

        assertEquals(2, subscriber.items().size());
        assertEquals(4, snapshot.bufferSize());

        subscriber.request(3);
        assertTrue(subscriber.awaitItems(5));
        publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(5, subscriber.items().size());
    }

    @Test
    void livePublisherPicksUpNewWrites() throws Exception {
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal))
                .refreshInterval(Duration.ofMillis(20))
                .build());
        RecordingSubscriber subscriber = new RecordingSubscriber(Long.MAX_VALUE);

        publisher.subscribe(subscriber);
        writeEvents(2, TAG);
        writeEvents(1, "other");
        assertTrue(subscriber.awaitItems(2));

        writeEvents(1, TAG);

        assertTrue(subscriber.awaitItems(3));
        assertEquals(List.of(0L, 1L, 3L), subscriber.offsets());
        assertFalse(subscriber.isTerminated());
    }

    // --- failures ---

    @Test
    void failedQueryTerminatesWithQueryException() throws Exception {
        IllegalStateException cause = new IllegalStateException("storage down");
        StubQuery query = new StubQuery(call -> CompletableFuture.failedFuture(cause));
        RecordingMetrics metrics = new RecordingMetrics();
        EventsByTagPublisher publisher = track(builder(query).metrics(metrics).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(1);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitTerminated());
        EventQueryException error = assertInstanceOf(EventQueryException.class, subscriber.error);
        assertSame(cause, error.getCause());
        assertEquals(1, metrics.pollsIssued.get());
        assertEquals(1, metrics.pollsFailed.get());
    }

    @Test
    void queryThrowingSynchronouslyTerminatesStream() throws Exception {
        StubQuery query = new StubQuery(call -> {
            throw new IllegalStateException("boom");
        });
        EventsByTagPublisher publisher = track(builder(query).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(1);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitTerminated());
        assertInstanceOf(EventQueryException.class, subscriber.error);
        assertInstanceOf(IllegalStateException.class, subscriber.error.getCause());
    }

    @Test
    void decoderReturningNullFailsStream() throws Exception {
        StubQuery query = StubQuery.returning(List.of(entry(0, "a")));
        EventsByTagPublisher publisher = track(builder(query).decoder(bytes -> null).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(1);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitTerminated());
        assertInstanceOf(EventDecodingException.class, subscriber.error);
        assertTrue(subscriber.items().isEmpty());
    }

    @Test
    void nonPositiveRequestFailsStream() throws Exception {
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal)).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(0);

        publisher.subscribe(subscriber);
        assertTrue(subscriber.awaitSubscribed());
        subscriber.request(0);

        assertTrue(subscriber.awaitTerminated());
        assertInstanceOf(IllegalArgumentException.class, subscriber.error);
        assertThrows(ExecutionException.class, () -> publisher.terminationFuture().get(5, TimeUnit.SECONDS));
    }

    @Test
    void throwingOnNextStopsPublisherWithoutErrorSignal() throws Exception {
        writeEvents(3, TAG);
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal)).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(5) {
            @Override
            public void onNext(EventEnvelope item) {
                super.onNext(item);
                throw new IllegalStateException("consumer bug");
            }
        };

        publisher.subscribe(subscriber);

        publisher.terminationFuture().get(5, TimeUnit.SECONDS);
        assertEquals(List.of(0L), subscriber.offsets());
        assertEquals(0, subscriber.terminalSignals());
    }

    // --- lifecycle ---

    @Test
    void cancelStopsDeliveryAndCompletesTermination() throws Exception {
        writeEvents(2, TAG);
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal)).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(1);

        publisher.subscribe(subscriber);
        assertTrue(subscriber.awaitItems(1));
        subscriber.cancel();
        subscriber.request(5);

        assertNull(publisher.terminationFuture().get(5, TimeUnit.SECONDS));
        assertEquals(List.of(0L), subscriber.offsets());
        assertEquals(0, subscriber.terminalSignals());
        assertEquals("STOPPED", publisher.snapshot().get(5, TimeUnit.SECONDS).state());
    }

    @Test
    void closeCompletesSubscriber() throws Exception {
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal)).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(1);

        publisher.subscribe(subscriber);
        assertTrue(subscriber.awaitSubscribed());
        publisher.close();

        assertTrue(subscriber.awaitTerminated());
        assertTrue(subscriber.completed);
        assertNull(subscriber.error);
        publisher.terminationFuture().get(5, TimeUnit.SECONDS);
    }

    @Test
    void currentStreamCompletesOnceCaughtUp() throws Exception {
        writeEvents(3, TAG);
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal)).live(false).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(Long.MAX_VALUE);

        publisher.subscribe(subscriber);
        assertTrue(subscriber.awaitItems(3));
        publisher.requestPollCheck();

        assertTrue(subscriber.awaitTerminated());
        assertTrue(subscriber.completed);
        assertEquals(List.of(0L, 1L, 2L), subscriber.offsets());
    }

    @Test
    void currentStreamOnEmptyTagCompletesImmediately() throws Exception {
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal)).live(false).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(1);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitTerminated());
        assertTrue(subscriber.completed);
        assertTrue(subscriber.items().isEmpty());
    }

    @Test
    void liveStreamDoesNotCompleteOnEmptyPoll() throws Exception {
        StubQuery query = StubQuery.returning(List.of());
        EventsByTagPublisher publisher = track(builder(query).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(1);

        publisher.subscribe(subscriber);
        assertNotNull(query.awaitCall());
        // the fetch result is queued before the first snapshot runs
        publisher.snapshot().get(5, TimeUnit.SECONDS);
        PublisherSnapshot snapshot = publisher.snapshot().get(5, TimeUnit.SECONDS);

        assertEquals("ACTIVE", snapshot.state());
        assertFalse(subscriber.isTerminated());
    }

    @Test
    void rejectsSecondSubscriber() throws Exception {
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal)).build());
        RecordingSubscriber first = new RecordingSubscriber(0);
        RecordingSubscriber second = new RecordingSubscriber(0);

        publisher.subscribe(first);
        publisher.subscribe(second);

        assertTrue(second.awaitTerminated());
        assertInstanceOf(IllegalStateException.class, second.error);
        assertTrue(first.awaitSubscribed());
        assertFalse(first.isTerminated());
    }

    @Test
    void rejectsSubscriberAfterClose() throws Exception {
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal)).build());
        publisher.close();
        publisher.terminationFuture().get(5, TimeUnit.SECONDS);
        RecordingSubscriber subscriber = new RecordingSubscriber(1);

        publisher.subscribe(subscriber);

        assertTrue(subscriber.awaitTerminated());
        assertInstanceOf(IllegalStateException.class, subscriber.error);
    }

    @Test
    void subscriberQueuedBehindCloseSeesSubscriptionBeforeError() throws Exception {
        sharedScheduler = Executors.newSingleThreadScheduledExecutor();
        CountDownLatch release = new CountDownLatch(1);
        sharedScheduler.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal))
                .scheduler(sharedScheduler)
                .build());
        List<String> signals = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch terminated = new CountDownLatch(1);
        Flow.Subscriber<EventEnvelope> subscriber = new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                signals.add("onSubscribe");
            }

            @Override
            public void onNext(EventEnvelope item) {
                signals.add("onNext");
            }

            @Override
            public void onError(Throwable throwable) {
                signals.add("onError");
                terminated.countDown();
            }

            @Override
            public void onComplete() {
                signals.add("onComplete");
                terminated.countDown();
            }
        };

        publisher.close();
        publisher.subscribe(subscriber);
        release.countDown();

        assertTrue(terminated.await(5, TimeUnit.SECONDS));
        publisher.snapshot().get(5, TimeUnit.SECONDS);
        assertEquals(List.of("onSubscribe", "onError"), signals);
    }

    @Test
    void sharedSchedulerSurvivesPublisherStop() throws Exception {
        sharedScheduler = Executors.newScheduledThreadPool(2);
        writeEvents(2, TAG);
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal))
                .scheduler(sharedScheduler)
                .build());
        RecordingSubscriber subscriber = new RecordingSubscriber(2);

        publisher.subscribe(subscriber);
        assertTrue(subscriber.awaitItems(2));
        publisher.close();
        assertTrue(subscriber.awaitTerminated());

        assertFalse(sharedScheduler.isShutdown());
    }

    @Test
    void recordsMetrics() throws Exception {
        writeEvents(3, TAG);
        RecordingMetrics metrics = new RecordingMetrics();
        EventsByTagPublisher publisher = track(builder(EventsByTagQuery.direct(journal)).metrics(metrics).build());
        RecordingSubscriber subscriber = new RecordingSubscriber(2);

        publisher.subscribe(subscriber);
        assertTrue(subscriber.awaitItems(2));
        publisher.snapshot().get(5, TimeUnit.SECONDS);

        assertEquals(1, metrics.pollsIssued.get());
        assertEquals(3, metrics.entriesFetched.get());
        assertEquals(2, metrics.delivered.get());
        assertEquals(1, metrics.bufferDepth.get());
        assertEquals(3L, metrics.cursorOffset.get());
    }

    @Test
    void publisherIdsAreUnique() {
        EventsByTagPublisher a = track(builder(EventsByTagQuery.direct(journal)).build());
        EventsByTagPublisher b = track(builder(EventsByTagQuery.direct(journal)).build());

        assertFalse(a.publisherId().equals(b.publisherId()));
        assertEquals(26, a.publisherId().length());
    }

    @Test
    void builderValidatesParameters() {
        EventsByTagQuery query = EventsByTagQuery.direct(journal);

        assertThrows(NullPointerException.class, () -> EventsByTagPublisher.builder().query(query).build());
        assertThrows(NullPointerException.class, () -> EventsByTagPublisher.builder().tag(TAG).build());
        assertThrows(IllegalArgumentException.class,
                () -> EventsByTagPublisher.builder().tag("").query(query).build());
        assertThrows(IllegalArgumentException.class,
                () -> EventsByTagPublisher.builder().tag(TAG).offset(-1).query(query).build());
        assertThrows(IllegalArgumentException.class,
                () -> EventsByTagPublisher.builder().tag(TAG).maxBufferSize(0).query(query).build());
        assertThrows(IllegalArgumentException.class,
                () -> EventsByTagPublisher.builder().tag(TAG).refreshInterval(Duration.ZERO).query(query).build());
        assertThrows(NullPointerException.class,
                () -> EventsByTagPublisher.builder().tag(TAG).refreshInterval(null).query(query).build());
    }

    private EventsByTagPublisher.Builder builder(EventsByTagQuery query) {
        return EventsByTagPublisher.builder()
                .tag(TAG)
                .refreshInterval(Duration.ofHours(1))
                .maxBufferSize(10)
                .query(query);
    }

    private EventsByTagPublisher track(EventsByTagPublisher publisher) {
        publishers.add(publisher);
        return publisher;
    }

    private void writeEvents(int count, String tag) {
        for (int i = 0; i < count; i++) {
            journal.append(codec.encode(new StoredEvent("entity-" + tag, i, "payload-" + i)), Set.of(tag));
        }
    }

    private RawEntry entry(long ordering, String payload) {
        return new RawEntry(ordering, codec.encode(new StoredEvent("entity", ordering, payload)));
    }
}
