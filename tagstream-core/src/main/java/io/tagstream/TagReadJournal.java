package io.tagstream;

import io.tagstream.model.StoredEvent;
import io.tagstream.publisher.EventsByTagPublisher;
import io.tagstream.spi.EventCodec;
import io.tagstream.spi.EventsByTagQuery;
import io.tagstream.spi.MetricsExporter;
import io.tagstream.spi.TaggedEventLog;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.ScheduledExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that writes tagged events to a {@link TaggedEventLog} and streams them
 * back per tag.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (TagReadJournal journal = TagReadJournal.builder()
 *     .eventLog(new InMemoryEventJournal())
 *     .config(ReadJournalConfig.load("tagstream.properties"))
 *     .build()) {
 *   journal.write(new StoredEvent("order-1", 1, "{\"total\":12}"), Set.of("orders"));
 *   journal.eventsByTag("orders", 0L).subscribe(subscriber);
 * }
 * }</pre>
 *
 * <p>Every publisher created here is closed by {@link #close()}.
 *
 * @see EventsByTagPublisher
 */
public final class TagReadJournal implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TagReadJournal.class.getName());

  private final TaggedEventLog eventLog;
  private final EventsByTagQuery query;
  private final EventCodec codec;
  private final ReadJournalConfig config;
  private final MetricsExporter metrics;
  private final ScheduledExecutorService scheduler;
  private final Set<EventsByTagPublisher> publishers = ConcurrentHashMap.newKeySet();
  private volatile boolean closed;

  private TagReadJournal(Builder builder) {
    this.eventLog = Objects.requireNonNull(builder.eventLog, "eventLog");
    this.codec = builder.codec != null ? builder.codec : EventCodec.getDefault();
    this.config = builder.config != null ? builder.config : new ReadJournalConfig();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.scheduler = builder.scheduler;
    this.query = builder.queryExecutor == null
        ? EventsByTagQuery.direct(eventLog)
        : EventsByTagQuery.blocking(eventLog, builder.queryExecutor);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Encodes and appends an event.
   *
   * @param event the event to store
   * @param tags  tags to index it under
   * @return the ordering assigned by the log
   */
  public long write(StoredEvent event, Set<String> tags) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(tags, "tags");
    ensureOpen();
    return eventLog.append(codec.encode(event), tags);
  }

  /**
   * Live stream of the events tagged {@code tag} from {@code offset} (inclusive); never
   * completes on its own.
   */
  public Flow.Publisher<EventEnvelope> eventsByTag(String tag, long offset) {
    return track(newPublisher(tag, offset, true));
  }

  /**
   * Stream of the events tagged {@code tag} from {@code offset} (inclusive) that
   * completes once it has caught up with the log.
   */
  public Flow.Publisher<EventEnvelope> currentEventsByTag(String tag, long offset) {
    return track(newPublisher(tag, offset, false));
  }

  private EventsByTagPublisher newPublisher(String tag, long offset, boolean live) {
    ensureOpen();
    return EventsByTagPublisher.builder()
        .tag(tag)
        .offset(offset)
        .live(live)
        .refreshInterval(config.getRefreshInterval())
        .maxBufferSize(config.getMaxBufferSize())
        .query(query)
        .decoder(codec)
        .metrics(metrics)
        .scheduler(scheduler)
        .build();
  }

  private EventsByTagPublisher track(EventsByTagPublisher publisher) {
    publishers.add(publisher);
    publisher.terminationFuture().whenComplete((ignored, error) -> publishers.remove(publisher));
    return publisher;
  }

  /**
   * @return number of publishers created here that have not terminated yet
   */
  public int activePublishers() {
    return publishers.size();
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("TagReadJournal has been closed");
    }
  }

  /**
   * Closes every publisher still running, then the metrics exporter if it is closeable.
   * The event log and any shared scheduler belong to the caller and stay open.
   */
  @Override
  public void close() {
    closed = true;
    for (EventsByTagPublisher publisher : publishers) {
      try {
        publisher.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to close publisher for tag " + publisher.tag(), e);
      }
    }
    publishers.clear();
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close metrics exporter", e);
      }
    }
  }

  /**
   * Builder for {@link TagReadJournal}.
   */
  public static final class Builder {
    private TaggedEventLog eventLog;
    private EventCodec codec;
    private ReadJournalConfig config;
    private MetricsExporter metrics;
    private ScheduledExecutorService scheduler;
    private Executor queryExecutor;

    private Builder() {
    }

    /** <b>Required.</b> The log events are written to and read from. */
    public Builder eventLog(TaggedEventLog eventLog) {
      this.eventLog = eventLog;
      return this;
    }

    /** Optional. Defaults to {@link EventCodec#getDefault()}. */
    public Builder codec(EventCodec codec) {
      this.codec = codec;
      return this;
    }

    /** Optional. Defaults to {@code new ReadJournalConfig()}. */
    public Builder config(ReadJournalConfig config) {
      this.config = config;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the journal if closeable. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Shared scheduler for all publishers; by default each owns one thread. */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Optional. Executor for blocking log reads. When unset, reads run on the
     * publisher's own thread, which suits in-memory logs.
     */
    public Builder queryExecutor(Executor queryExecutor) {
      this.queryExecutor = queryExecutor;
      return this;
    }

    public TagReadJournal build() {
      return new TagReadJournal(this);
    }
  }
}
