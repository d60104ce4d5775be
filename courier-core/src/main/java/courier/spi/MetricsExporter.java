package courier.spi;

import courier.FailureReason;

/**
 * Observability hook for exporting delivery counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /** An envelope was accepted by {@code emit}. */
  void incrementEmitted();

  /** A deliver frame was handed to a transport (first attempt or retry). */
  void incrementTransmitted();

  /** An ack removed an envelope from a connection's in-flight set. */
  void incrementAcked();

  /** An ack timeout scheduled a retransmission. */
  void incrementRetried();

  /** An envelope was appended to a principal's pending queue. */
  void incrementQueued();

  /** An envelope was terminally failed. */
  void incrementFailed(FailureReason reason);

  /** A durable side-store operation failed and delivery degraded to memory-only. */
  void incrementSideStoreErrors();

  /** A connection was force-closed after missing liveness probes. */
  default void incrementLivenessTimeouts() {
  }

  /**
   * Records the number of registered connections.
   *
   * @param count current connection count
   */
  void recordLiveConnections(int count);

  /**
   * Records the total number of envelopes across all pending queues.
   *
   * @param depth current pending depth
   */
  default void recordPendingDepth(int depth) {
  }

  /**
   * Records the time from first transmission to ack.
   *
   * @param latencyMs latency in milliseconds (always non-negative)
   */
  default void recordAckLatencyMs(long latencyMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEmitted() {
    }

    @Override
    public void incrementTransmitted() {
    }

    @Override
    public void incrementAcked() {
    }

    @Override
    public void incrementRetried() {
    }

    @Override
    public void incrementQueued() {
    }

    @Override
    public void incrementFailed(FailureReason reason) {
    }

    @Override
    public void incrementSideStoreErrors() {
    }

    @Override
    public void recordLiveConnections(int count) {
    }
  }
}
