package courier;

import courier.spi.MetricsExporter;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Counting {@link MetricsExporter} for assertions. */
public final class RecordingMetrics implements MetricsExporter {
  public final AtomicInteger emitted = new AtomicInteger();
  public final AtomicInteger transmitted = new AtomicInteger();
  public final AtomicInteger acked = new AtomicInteger();
  public final AtomicInteger retried = new AtomicInteger();
  public final AtomicInteger queued = new AtomicInteger();
  public final AtomicInteger sideStoreErrors = new AtomicInteger();
  public final AtomicInteger livenessTimeouts = new AtomicInteger();
  public volatile int liveConnections;
  private final Map<FailureReason, Integer> failed = new EnumMap<>(FailureReason.class);

  @Override
  public void incrementEmitted() {
    emitted.incrementAndGet();
  }

  @Override
  public void incrementTransmitted() {
    transmitted.incrementAndGet();
  }

  @Override
  public void incrementAcked() {
    acked.incrementAndGet();
  }

  @Override
  public void incrementRetried() {
    retried.incrementAndGet();
  }

  @Override
  public void incrementQueued() {
    queued.incrementAndGet();
  }

  @Override
  public synchronized void incrementFailed(FailureReason reason) {
    failed.merge(reason, 1, Integer::sum);
  }

  @Override
  public void incrementSideStoreErrors() {
    sideStoreErrors.incrementAndGet();
  }

  @Override
  public void incrementLivenessTimeouts() {
    livenessTimeouts.incrementAndGet();
  }

  @Override
  public void recordLiveConnections(int count) {
    liveConnections = count;
  }

  public synchronized int failed(FailureReason reason) {
    return failed.getOrDefault(reason, 0);
  }
}
