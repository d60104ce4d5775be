package courier.registry;

import courier.Envelope;
import courier.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server-side bookkeeping of every live connection: owning principal, heartbeat
 * timestamps and in-flight envelopes.
 *
 * <p>Lookups are lock-free across connections. Mutations of a single connection take its
 * lock. {@link #unregister} is the only way a connection leaves the registry and always
 * closes the connection's timer scope.
 *
 * <p>This class is thread-safe.
 */
public final class ConnectionRegistry {
  private static final Logger logger = Logger.getLogger(ConnectionRegistry.class.getName());

  private final Map<String, Connection> connections = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> byPrincipal = new ConcurrentHashMap<>();
  private final Clock clock;
  private final int maxConnectionsPerPrincipal;
  private final MetricsExporter metrics;

  public ConnectionRegistry(Clock clock) {
    this(clock, 0, MetricsExporter.NOOP);
  }

  /**
   * @param clock                      time source for heartbeat bookkeeping
   * @param maxConnectionsPerPrincipal cap on live connections per principal, {@code 0} for none
   * @param metrics                    metrics sink for the live connection gauge
   */
  public ConnectionRegistry(Clock clock, int maxConnectionsPerPrincipal, MetricsExporter metrics) {
    if (maxConnectionsPerPrincipal < 0) {
      throw new IllegalArgumentException("maxConnectionsPerPrincipal must be >= 0");
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    this.maxConnectionsPerPrincipal = maxConnectionsPerPrincipal;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Adds a newly opened connection in state {@link ConnectionState#OPEN}.
   *
   * @throws IllegalStateException if a connection with the same id is registered
   */
  public void register(Connection connection) {
    Objects.requireNonNull(connection, "connection");
    Connection existing = connections.putIfAbsent(connection.connectionId(), connection);
    if (existing != null) {
      throw new IllegalStateException("Connection already registered: " + connection.connectionId());
    }
    metrics.recordLiveConnections(connections.size());
  }

  /**
   * Attributes a connection to a principal, moving it to {@link ConnectionState#IDENTIFIED}.
   * Re-attributing to the same principal is a no-op; attributing to a different one moves
   * the connection between principal indexes.
   *
   * @return {@code false} if the connection is unknown or no longer live, or the principal
   *     already holds {@code maxConnectionsPerPrincipal} live connections
   */
  public boolean attribute(String connectionId, String principalId) {
    Objects.requireNonNull(principalId, "principalId");
    Connection connection = connections.get(connectionId);
    if (connection == null) {
      return false;
    }
    return connection.callLocked(() -> {
      if (!connection.isLive()) {
        return false;
      }
      String previous = connection.principalId();
      if (principalId.equals(previous)) {
        return true;
      }
      boolean[] admitted = {true};
      byPrincipal.compute(principalId, (key, ids) -> {
        Set<String> set = ids != null ? ids : ConcurrentHashMap.newKeySet();
        if (maxConnectionsPerPrincipal > 0 && set.size() >= maxConnectionsPerPrincipal) {
          admitted[0] = false;
          return ids;
        }
        set.add(connectionId);
        return set;
      });
      if (!admitted[0]) {
        logger.log(Level.WARNING, "Principal {0} already has {1} live connections; refusing {2}",
            new Object[]{principalId, maxConnectionsPerPrincipal, connectionId});
        return false;
      }
      if (previous != null) {
        removeFromIndex(previous, connectionId);
      }
      connection.attribute(principalId);
      return true;
    });
  }

  /**
   * Removes a connection, marks it {@link ConnectionState#CLOSED}, cancels all of its
   * timers and returns its in-flight envelopes in first-transmission order for hand-off
   * to the pending queue. Returns an empty list for unknown connections.
   */
  public List<Envelope> unregister(String connectionId) {
    Connection connection = connections.remove(connectionId);
    if (connection == null) {
      return List.of();
    }
    metrics.recordLiveConnections(connections.size());
    List<Envelope> inFlight = connection.callLocked(() -> {
      connection.markClosed();
      connection.timers().close();
      return connection.drainInFlight();
    });
    String principalId = connection.principalId();
    if (principalId != null) {
      removeFromIndex(principalId, connectionId);
    }
    return inFlight;
  }

  private void removeFromIndex(String principalId, String connectionId) {
    byPrincipal.computeIfPresent(principalId, (key, ids) -> {
      ids.remove(connectionId);
      return ids.isEmpty() ? null : ids;
    });
  }

  /** Returns the registered connection, or {@code null}. */
  public Connection find(String connectionId) {
    return connectionId == null ? null : connections.get(connectionId);
  }

  /**
   * Returns the ids of the principal's live connections, oldest first.
   */
  public List<String> findByPrincipal(String principalId) {
    Set<String> ids = byPrincipal.get(principalId);
    if (ids == null) {
      return List.of();
    }
    List<Connection> live = new ArrayList<>(ids.size());
    for (String id : ids) {
      Connection connection = connections.get(id);
      if (connection != null && connection.isLive()) {
        live.add(connection);
      }
    }
    live.sort(Comparator.comparing(Connection::createdAt));
    List<String> result = new ArrayList<>(live.size());
    for (Connection connection : live) {
      result.add(connection.connectionId());
    }
    return result;
  }

  public void recordHeartbeatSent(String connectionId) {
    Connection connection = connections.get(connectionId);
    if (connection != null) {
      Instant now = clock.instant();
      connection.runLocked(() -> connection.heartbeatSent(now));
    }
  }

  public void recordHeartbeatAck(String connectionId) {
    Connection connection = connections.get(connectionId);
    if (connection != null) {
      Instant now = clock.instant();
      connection.runLocked(() -> connection.heartbeatAcked(now));
    }
  }

  /**
   * Whether the connection has gone longer than {@code timeout} without a heartbeat ack
   * (measured from creation if it never acked). Unknown connections count as stale.
   */
  public boolean isStale(String connectionId, Duration timeout) {
    Connection connection = connections.get(connectionId);
    if (connection == null || !connection.isLive()) {
      return true;
    }
    Instant lastAck = connection.lastHeartbeatAckAt();
    Instant reference = lastAck != null ? lastAck : connection.createdAt();
    return Duration.between(reference, clock.instant()).compareTo(timeout) > 0;
  }

  /** Moves a live connection to {@link ConnectionState#STALE} ahead of its forced close. */
  public void markStale(String connectionId) {
    Connection connection = connections.get(connectionId);
    if (connection != null) {
      connection.runLocked(connection::markStale);
    }
  }

  public int size() {
    return connections.size();
  }

  public Clock clock() {
    return clock;
  }

  /** Snapshot of every registered connection id. */
  public List<String> connectionIds() {
    return List.copyOf(connections.keySet());
  }
}
