package courier.liveness;

import courier.dispatch.DeliveryEngine;
import courier.protocol.Frame;
import courier.registry.CloseReason;
import courier.registry.Connection;
import courier.registry.ConnectionRegistry;
import courier.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server-side liveness probing.
 *
 * <p>Each monitored connection gets one repeating probe timer in its own
 * {@link courier.util.TimerScope}. On every tick an unanswered previous probe counts as
 * missed; once {@code missedProbeThreshold} consecutive probes are missed the connection
 * is marked STALE, its transport is closed and the engine hands its in-flight envelopes
 * to the pending queue. Otherwise a {@code ping} is sent and the timer re-arms.
 *
 * <p>Because the probe lives in the connection's timer scope, it stops on every close path.
 */
public final class HeartbeatMonitor {
  private static final Logger logger = Logger.getLogger(HeartbeatMonitor.class.getName());

  public static final Duration DEFAULT_PROBE_INTERVAL = Duration.ofSeconds(25);
  public static final int DEFAULT_MISSED_PROBE_THRESHOLD = 3;

  static final String PROBE_TIMER = "liveness-probe";

  private final DeliveryEngine engine;
  private final ConnectionRegistry registry;
  private final long probeIntervalMs;
  private final int missedProbeThreshold;
  private final MetricsExporter metrics;

  /**
   * @param engine               engine whose registry holds the monitored connections
   * @param probeInterval        time between probes
   * @param missedProbeThreshold consecutive missed probes that close the connection
   * @param metrics              metrics sink
   */
  public HeartbeatMonitor(DeliveryEngine engine, Duration probeInterval, int missedProbeThreshold,
      MetricsExporter metrics) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.registry = engine.registry();
    Objects.requireNonNull(probeInterval, "probeInterval");
    if (probeInterval.isZero() || probeInterval.isNegative()) {
      throw new IllegalArgumentException("probeInterval must be positive");
    }
    if (missedProbeThreshold < 1) {
      throw new IllegalArgumentException("missedProbeThreshold must be >= 1");
    }
    this.probeIntervalMs = probeInterval.toMillis();
    this.missedProbeThreshold = missedProbeThreshold;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /** Starts probing a registered connection. The first probe goes out after one interval. */
  public void monitor(String connectionId) {
    Connection connection = registry.find(connectionId);
    if (connection != null) {
      arm(connection);
    }
  }

  /**
   * Records a {@code pong} (or any liveness response) from the connection, resetting its
   * missed-probe count.
   */
  public void responseReceived(String connectionId) {
    registry.recordHeartbeatAck(connectionId);
  }

  /**
   * Sends a probe immediately instead of waiting for the next tick. The regular schedule
   * continues from now.
   */
  public void probeNow(String connectionId) {
    Connection connection = registry.find(connectionId);
    if (connection != null) {
      tick(connection);
    }
  }

  public long probeIntervalMs() {
    return probeIntervalMs;
  }

  public int missedProbeThreshold() {
    return missedProbeThreshold;
  }

  private void arm(Connection connection) {
    connection.timers().schedule(PROBE_TIMER, probeIntervalMs, () -> tick(connection));
  }

  private void tick(Connection connection) {
    boolean timedOut = connection.callLocked(() -> {
      if (!connection.isLive()) {
        return false;
      }
      if (connection.probeOutstanding()) {
        int missed = connection.recordMissedProbe();
        logger.log(Level.FINE, "Connection {0} missed probe {1}/{2}",
            new Object[]{connection.connectionId(), missed, missedProbeThreshold});
        if (missed >= missedProbeThreshold) {
          registry.markStale(connection.connectionId());
          return true;
        }
      }
      DeliveryEngine.sendFrame(connection, new Frame.Ping(registry.clock().instant()));
      registry.recordHeartbeatSent(connection.connectionId());
      arm(connection);
      return false;
    });
    if (timedOut) {
      logger.log(Level.WARNING, "Connection {0} missed {1} liveness probes; closing",
          new Object[]{connection.connectionId(), missedProbeThreshold});
      metrics.incrementLivenessTimeouts();
      try {
        connection.handle().close("liveness timeout");
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Transport close failed on " + connection.connectionId(), e);
      }
      engine.connectionClosed(connection.connectionId(), CloseReason.LIVENESS_TIMEOUT);
    }
  }
}
