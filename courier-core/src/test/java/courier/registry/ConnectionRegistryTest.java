package courier.registry;

import courier.Envelope;
import courier.RecordingMetrics;
import courier.RecordingTransport;
import courier.util.ManualScheduler;
import courier.util.TimerScope;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionRegistryTest {
  private final ManualScheduler scheduler = new ManualScheduler();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final ConnectionRegistry registry = new ConnectionRegistry(scheduler.clock(), 0, metrics);

  private Connection register(String id) {
    Connection connection = new Connection(id, new RecordingTransport(), scheduler.now(),
        new TimerScope(scheduler, id));
    registry.register(connection);
    return connection;
  }

  @Test
  void registerStartsOpenAndRejectsDuplicates() {
    Connection connection = register("c1");

    assertEquals(ConnectionState.OPEN, connection.state());
    assertSame(connection, registry.find("c1"));
    assertEquals(1, metrics.liveConnections);
    assertThrows(IllegalStateException.class, () -> register("c1"));
  }

  @Test
  void attributeIndexesByPrincipalOldestFirst() {
    register("c1");
    scheduler.advance(10);
    register("c2");

    assertTrue(registry.attribute("c2", "p"));
    assertTrue(registry.attribute("c1", "p"));
    assertTrue(registry.attribute("c1", "p"));

    assertEquals(List.of("c1", "c2"), registry.findByPrincipal("p"));
    assertEquals(ConnectionState.IDENTIFIED, registry.find("c1").state());
    assertFalse(registry.attribute("missing", "p"));
  }

  @Test
  void reattributingMovesConnectionBetweenPrincipals() {
    register("c1");
    registry.attribute("c1", "p");

    registry.attribute("c1", "q");

    assertTrue(registry.findByPrincipal("p").isEmpty());
    assertEquals(List.of("c1"), registry.findByPrincipal("q"));
  }

  @Test
  void perPrincipalCapRefusesExtraConnections() {
    ConnectionRegistry capped = new ConnectionRegistry(scheduler.clock(), 1, metrics);
    capped.register(new Connection("c1", new RecordingTransport(), scheduler.now(), new TimerScope(scheduler, "c1")));
    capped.register(new Connection("c2", new RecordingTransport(), scheduler.now(), new TimerScope(scheduler, "c2")));

    assertTrue(capped.attribute("c1", "p"));
    assertFalse(capped.attribute("c2", "p"));
    assertTrue(capped.attribute("c2", "q"));

    capped.unregister("c1");
    assertTrue(capped.attribute("c2", "p"));
  }

  @Test
  void unregisterClosesTimersAndReturnsInFlightInOrder() {
    Connection connection = register("c1");
    registry.attribute("c1", "p");
    Envelope first = Envelope.builder("a").createdAt(scheduler.now()).ttl(Duration.ofMinutes(1)).build();
    Envelope second = Envelope.builder("b").createdAt(scheduler.now()).ttl(Duration.ofMinutes(1)).build();
    connection.runLocked(() -> {
      connection.putInFlight(new InFlightDelivery(first, scheduler.now()));
      connection.putInFlight(new InFlightDelivery(second, scheduler.now()));
      connection.timers().schedule("ack:" + first.envelopeId(), 1_000, () -> fail("timer fired after close"));
    });

    List<Envelope> inFlight = registry.unregister("c1");

    assertEquals(List.of(first, second), inFlight);
    assertEquals(ConnectionState.CLOSED, connection.state());
    assertTrue(connection.timers().isClosed());
    assertEquals(0, connection.inFlightCount());
    assertNull(registry.find("c1"));
    assertTrue(registry.findByPrincipal("p").isEmpty());
    assertEquals(0, metrics.liveConnections);
    assertTrue(registry.unregister("c1").isEmpty());
    scheduler.advance(5_000);
  }

  @Test
  void closedConnectionCannotBeAttributed() {
    Connection connection = register("c1");
    registry.unregister("c1");

    assertFalse(connection.isLive());
    assertFalse(registry.attribute("c1", "p"));
  }

  @Test
  void staleWhenNoAckWithinTimeout() {
    register("c1");
    Duration timeout = Duration.ofSeconds(30);

    scheduler.advance(30_000);
    assertFalse(registry.isStale("c1", timeout));
    scheduler.advance(1);
    assertTrue(registry.isStale("c1", timeout));

    registry.recordHeartbeatSent("c1");
    registry.recordHeartbeatAck("c1");
    assertFalse(registry.isStale("c1", timeout));
    assertTrue(registry.isStale("unknown", timeout));
  }

  @Test
  void heartbeatBookkeeping() {
    Connection connection = register("c1");

    registry.recordHeartbeatSent("c1");
    assertTrue(connection.probeOutstanding());
    connection.runLocked(connection::recordMissedProbe);
    assertEquals(1, connection.missedProbes());

    scheduler.advance(5);
    registry.recordHeartbeatAck("c1");

    assertFalse(connection.probeOutstanding());
    assertEquals(0, connection.missedProbes());
    assertEquals(scheduler.now(), connection.lastHeartbeatAckAt());
  }

  @Test
  void markStaleKeepsConnectionRegisteredUntilClosed() {
    Connection connection = register("c1");

    registry.markStale("c1");

    assertEquals(ConnectionState.STALE, connection.state());
    assertFalse(connection.isLive());
    assertSame(connection, registry.find("c1"));
  }
}
