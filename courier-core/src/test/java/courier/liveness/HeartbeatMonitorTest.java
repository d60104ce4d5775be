package courier.liveness;

import courier.DeliveryTarget;
import courier.RecordingMetrics;
import courier.RecordingTransport;
import courier.SendOptions;
import courier.dispatch.DeliveryEngine;
import courier.protocol.Frame;
import courier.registry.Connection;
import courier.registry.ConnectionRegistry;
import courier.util.ManualScheduler;
import courier.util.TimerScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatMonitorTest {
  private static final String P = "user-1";

  private ManualScheduler scheduler;
  private ConnectionRegistry registry;
  private DeliveryEngine engine;
  private HeartbeatMonitor monitor;
  private RecordingMetrics metrics;
  private RecordingTransport transport;

  @BeforeEach
  void setUp() {
    scheduler = new ManualScheduler();
    metrics = new RecordingMetrics();
    registry = new ConnectionRegistry(scheduler.clock());
    engine = DeliveryEngine.builder()
        .registry(registry)
        .scheduler(scheduler)
        .ackTimeout(Duration.ofMinutes(10))
        .metrics(metrics)
        .build();
    monitor = new HeartbeatMonitor(engine, Duration.ofSeconds(1), 3, metrics);
    transport = new RecordingTransport();
    registry.register(new Connection("c1", transport, scheduler.now(), new TimerScope(scheduler, "c1")));
    engine.principalIdentified("c1", P);
    monitor.monitor("c1");
  }

  @Test
  void threeMissedProbesCloseConnectionAndQueueInFlight() {
    engine.send(DeliveryTarget.principal(P), "a", "", SendOptions.defaults());
    engine.send(DeliveryTarget.principal(P), "b", "", SendOptions.defaults());
    Connection connection = registry.find("c1");

    scheduler.advance(3_999);
    assertTrue(connection.isLive());
    assertEquals(2, connection.missedProbes());
    assertEquals(3, transport.frames(Frame.Ping.class).size());

    scheduler.advance(1);

    assertNull(registry.find("c1"));
    assertEquals("liveness timeout", transport.closedReason());
    assertEquals(2, engine.pendingQueue().size(P));
    assertTrue(connection.timers().isClosed());
    assertEquals(0, scheduler.pendingTasks());
    assertEquals(1, metrics.livenessTimeouts.get());
  }

  @Test
  void answeredProbesKeepConnectionAlive() {
    for (int i = 0; i < 10; i++) {
      scheduler.advance(1_000);
      monitor.responseReceived("c1");
    }

    Connection connection = registry.find("c1");
    assertNotNull(connection);
    assertTrue(connection.isLive());
    assertEquals(0, connection.missedProbes());
    assertEquals(10, transport.frames(Frame.Ping.class).size());
  }

  @Test
  void responseResetsMissedCount() {
    scheduler.advance(3_000);
    assertEquals(2, registry.find("c1").missedProbes());

    monitor.responseReceived("c1");
    scheduler.advance(3_000);

    assertNotNull(registry.find("c1"));
    assertEquals(2, registry.find("c1").missedProbes());
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> new HeartbeatMonitor(engine, Duration.ZERO, 3, metrics));
    assertThrows(IllegalArgumentException.class,
        () -> new HeartbeatMonitor(engine, Duration.ofSeconds(1), 0, metrics));
  }
}
