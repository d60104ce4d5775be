package courier.micrometer;

import courier.FailureReason;
import courier.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code courier.envelopes.emitted}: envelopes accepted by {@code emit}</li>
 *   <li>{@code courier.envelopes.transmitted}: deliver frames handed to a transport</li>
 *   <li>{@code courier.envelopes.acked}: acks that cleared an in-flight envelope</li>
 *   <li>{@code courier.envelopes.retried}: retransmissions after an ack timeout</li>
 *   <li>{@code courier.envelopes.queued}: envelopes parked in a pending queue</li>
 *   <li>{@code courier.envelopes.failed}: terminal failures, tagged {@code reason}</li>
 *   <li>{@code courier.sidestore.errors}: failed side-store operations</li>
 *   <li>{@code courier.connections.liveness.timeouts}: connections closed for missed probes</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code courier.connections.live}: registered connections</li>
 *   <li>{@code courier.queue.pending.depth}: envelopes across all pending queues</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code courier.ack.latency.ms}: first transmission to ack</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter emitted;
  private final Counter transmitted;
  private final Counter acked;
  private final Counter retried;
  private final Counter queued;
  private final Map<FailureReason, Counter> failed = new EnumMap<>(FailureReason.class);
  private final Counter sideStoreErrors;
  private final Counter livenessTimeouts;
  private final Gauge liveConnectionsGauge;
  private final Gauge pendingDepthGauge;
  private final DistributionSummary ackLatency;

  private final AtomicInteger liveConnections = new AtomicInteger();
  private final AtomicInteger pendingDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "courier"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "courier");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "chat.courier"})
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
    this.emitted = Counter.builder(namePrefix + ".envelopes.emitted")
        .description("Envelopes accepted for delivery")
        .register(registry);
    this.transmitted = Counter.builder(namePrefix + ".envelopes.transmitted")
        .description("Deliver frames handed to a transport, retries included")
        .register(registry);
    this.acked = Counter.builder(namePrefix + ".envelopes.acked")
        .description("Envelopes acknowledged by the client")
        .register(registry);
    this.retried = Counter.builder(namePrefix + ".envelopes.retried")
        .description("Retransmissions after an ack timeout")
        .register(registry);
    this.queued = Counter.builder(namePrefix + ".envelopes.queued")
        .description("Envelopes parked for an offline principal")
        .register(registry);
    for (FailureReason reason : FailureReason.values()) {
      failed.put(reason, Counter.builder(namePrefix + ".envelopes.failed")
          .description("Envelopes terminally failed")
          .tag("reason", reason.name().toLowerCase())
          .register(registry));
    }
    this.sideStoreErrors = Counter.builder(namePrefix + ".sidestore.errors")
        .description("Side-store operations that failed")
        .register(registry);
    this.livenessTimeouts = Counter.builder(namePrefix + ".connections.liveness.timeouts")
        .description("Connections closed after missing liveness probes")
        .register(registry);

    this.liveConnectionsGauge = Gauge.builder(namePrefix + ".connections.live", liveConnections, AtomicInteger::get)
        .register(registry);
    this.pendingDepthGauge = Gauge.builder(namePrefix + ".queue.pending.depth", pendingDepth, AtomicInteger::get)
        .register(registry);

    this.ackLatency = DistributionSummary.builder(namePrefix + ".ack.latency.ms")
        .description("Time from first transmission to ack in milliseconds")
        .register(registry);
  }

  @Override
  public void incrementEmitted() {
    if (closed) return;
    emitted.increment();
  }

  @Override
  public void incrementTransmitted() {
    if (closed) return;
    transmitted.increment();
  }

  @Override
  public void incrementAcked() {
    if (closed) return;
    acked.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementQueued() {
    if (closed) return;
    queued.increment();
  }

  @Override
  public void incrementFailed(FailureReason reason) {
    if (closed) return;
    failed.get(Objects.requireNonNull(reason, "reason")).increment();
  }

  @Override
  public void incrementSideStoreErrors() {
    if (closed) return;
    sideStoreErrors.increment();
  }

  @Override
  public void incrementLivenessTimeouts() {
    if (closed) return;
    livenessTimeouts.increment();
  }

  @Override
  public void recordLiveConnections(int count) {
    if (closed) return;
    liveConnections.set(count);
  }

  @Override
  public void recordPendingDepth(int depth) {
    if (closed) return;
    pendingDepth.set(depth);
  }

  @Override
  public void recordAckLatencyMs(long latencyMs) {
    if (closed) return;
    ackLatency.record(latencyMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link courier.Courier#close()} calls this for the exporter it was built with.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(emitted, transmitted, acked, retried, queued,
        sideStoreErrors, livenessTimeouts, liveConnectionsGauge, pendingDepthGauge, ackLatency));
    meters.addAll(failed.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
