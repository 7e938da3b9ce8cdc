package io.tagstream.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.tagstream.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code tagstream.poll.issued} - journal queries issued</li>
 *   <li>{@code tagstream.poll.failed} - polls that ended a stream with an error</li>
 *   <li>{@code tagstream.entries.fetched} - entries merged into publisher buffers</li>
 *   <li>{@code tagstream.envelopes.delivered} - envelopes handed to subscribers</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code tagstream.buffer.depth} - envelopes waiting for demand</li>
 *   <li>{@code tagstream.demand.outstanding} - requested but undelivered envelopes</li>
 *   <li>{@code tagstream.cursor.offset} - next offset to poll from</li>
 * </ul>
 *
 * <p>Gauges hold the last value reported by any publisher; give each publisher its
 * own exporter with a distinct prefix to observe them separately.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter pollsIssued;
  private final Counter pollsFailed;
  private final Counter entriesFetched;
  private final Counter envelopesDelivered;
  private final Gauge bufferDepthGauge;
  private final Gauge demandGauge;
  private final Gauge cursorGauge;

  private final AtomicInteger bufferDepth = new AtomicInteger();
  private final AtomicLong outstandingDemand = new AtomicLong();
  private final AtomicLong cursorOffset = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "tagstream"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "tagstream");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.tagstream"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.pollsIssued = Counter.builder(namePrefix + ".poll.issued")
        .description("Journal queries issued by tag publishers")
        .register(registry);
    this.pollsFailed = Counter.builder(namePrefix + ".poll.failed")
        .description("Polls that terminated a stream")
        .register(registry);
    this.entriesFetched = Counter.builder(namePrefix + ".entries.fetched")
        .description("Entries merged into publisher buffers")
        .register(registry);
    this.envelopesDelivered = Counter.builder(namePrefix + ".envelopes.delivered")
        .description("Envelopes delivered to subscribers")
        .register(registry);

    this.bufferDepthGauge = Gauge.builder(namePrefix + ".buffer.depth", bufferDepth, AtomicInteger::get)
        .register(registry);
    this.demandGauge = Gauge.builder(namePrefix + ".demand.outstanding", outstandingDemand, AtomicLong::get)
        .register(registry);
    this.cursorGauge = Gauge.builder(namePrefix + ".cursor.offset", cursorOffset, AtomicLong::get)
        .register(registry);
  }

  @Override
  public void incrementPollsIssued() {
    if (closed) return;
    pollsIssued.increment();
  }

  @Override
  public void incrementPollsFailed() {
    if (closed) return;
    pollsFailed.increment();
  }

  @Override
  public void recordEntriesFetched(int count) {
    if (closed || count <= 0) return;
    entriesFetched.increment(count);
  }

  @Override
  public void incrementEnvelopesDelivered() {
    if (closed) return;
    envelopesDelivered.increment();
  }

  @Override
  public void recordBufferDepth(int depth) {
    if (closed) return;
    bufferDepth.set(depth);
  }

  @Override
  public void recordOutstandingDemand(long demand) {
    if (closed) return;
    outstandingDemand.set(demand);
  }

  @Override
  public void recordCursorOffset(long nextOffset) {
    if (closed) return;
    cursorOffset.set(nextOffset);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link io.tagstream.TagReadJournal#close()} when the exporter is
   * passed to its builder.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(pollsIssued, pollsFailed, entriesFetched, envelopesDelivered,
        bufferDepthGauge, demandGauge, cursorGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
