package courier.micrometer;

import courier.Courier;
import courier.FailureReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void deliveryCounters() {
    exporter.incrementEmitted();
    exporter.incrementEmitted();
    exporter.incrementTransmitted();
    exporter.incrementAcked();
    exporter.incrementRetried();
    exporter.incrementQueued();
    exporter.incrementSideStoreErrors();
    exporter.incrementLivenessTimeouts();

    assertEquals(2.0, counter("courier.envelopes.emitted").count());
    assertEquals(1.0, counter("courier.envelopes.transmitted").count());
    assertEquals(1.0, counter("courier.envelopes.acked").count());
    assertEquals(1.0, counter("courier.envelopes.retried").count());
    assertEquals(1.0, counter("courier.envelopes.queued").count());
    assertEquals(1.0, counter("courier.sidestore.errors").count());
    assertEquals(1.0, counter("courier.connections.liveness.timeouts").count());
  }

  @Test
  void failuresAreTaggedByReason() {
    exporter.incrementFailed(FailureReason.RETRIES_EXHAUSTED);
    exporter.incrementFailed(FailureReason.RETRIES_EXHAUSTED);
    exporter.incrementFailed(FailureReason.EXPIRED);

    assertEquals(2.0, registry.get("courier.envelopes.failed").tag("reason", "retries_exhausted").counter().count());
    assertEquals(1.0, registry.get("courier.envelopes.failed").tag("reason", "expired").counter().count());
    assertEquals(0.0, registry.get("courier.envelopes.failed").tag("reason", "evicted").counter().count());
  }

  @Test
  void gauges() {
    exporter.recordLiveConnections(12);
    exporter.recordPendingDepth(40);
    assertEquals(12.0, gauge("courier.connections.live").value());
    assertEquals(40.0, gauge("courier.queue.pending.depth").value());

    exporter.recordLiveConnections(0);
    assertEquals(0.0, gauge("courier.connections.live").value());
  }

  @Test
  void ackLatency() {
    exporter.recordAckLatencyMs(120);
    exporter.recordAckLatencyMs(80);

    DistributionSummary summary = registry.find("courier.ack.latency.ms").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(200.0, summary.totalAmount());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "chat.courier");
    custom.incrementEmitted();
    custom.recordLiveConnections(3);

    assertEquals(1.0, counter("chat.courier.envelopes.emitted").count());
    assertEquals(3.0, gauge("chat.courier.connections.live").value());
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "courier."));
  }

  @Test
  void closeRemovesMetersAndIgnoresLateUpdates() {
    exporter.close();

    assertNull(registry.find("courier.envelopes.emitted").counter());
    assertNull(registry.find("courier.connections.live").gauge());
    assertTrue(registry.find("courier.envelopes.failed").counters().isEmpty());
    assertDoesNotThrow(() -> {
      exporter.incrementEmitted();
      exporter.incrementFailed(FailureReason.EXPIRED);
      exporter.recordLiveConnections(5);
    });
  }

  @Test
  void courierReportsThroughExporterAndRemovesItOnClose() {
    Courier courier = Courier.builder().metrics(exporter).build();
    courier.connectionOpened("c1", new courier.spi.TransportHandle() {
      @Override
      public boolean send(courier.protocol.Frame frame) {
        return true;
      }

      @Override
      public void close(String reason) {
      }
    });
    assertEquals(1.0, gauge("courier.connections.live").value());

    courier.close();

    assertNull(registry.find("courier.connections.live").gauge());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
