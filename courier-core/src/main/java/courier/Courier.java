package courier;

import courier.dispatch.DeliveryEngine;
import courier.dispatch.RetryPolicy;
import courier.liveness.HeartbeatMonitor;
import courier.protocol.Frame;
import courier.queue.DurableMirror;
import courier.queue.PendingQueue;
import courier.registry.CloseReason;
import courier.registry.Connection;
import courier.registry.ConnectionRegistry;
import courier.spi.MetricsExporter;
import courier.spi.SideStore;
import courier.spi.TransportHandle;
import courier.util.ExecutorTaskScheduler;
import courier.util.TaskScheduler;
import courier.util.TimerScope;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite server-side entry point that wires a {@link ConnectionRegistry},
 * {@link DeliveryEngine} and {@link HeartbeatMonitor} into a single {@link AutoCloseable}
 * unit.
 *
 * <p>The transport layer reports session events through the inbound methods
 * ({@link #connectionOpened}, {@link #frameReceived}, {@link #connectionClosed}, ...);
 * application code calls {@link #emit}. A periodic sweep drops expired queued envelopes.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Courier courier = Courier.builder()
 *     .sideStore(new JdbcSideStore(connectionProvider))
 *     .failureListener((envelope, reason) -> log(envelope, reason))
 *     .build()) {
 *   courier.connectionOpened(sessionId, handle);
 *   courier.principalIdentified(sessionId, userId);
 *   courier.emit(DeliveryTarget.principal(userId), "order.shipped", json, SendOptions.defaults());
 * }
 * }</pre>
 *
 * @see Courier.Builder
 */
public final class Courier implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Courier.class.getName());

  public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);

  private static final String SWEEP_TIMER = "expiry-sweep";

  private final ConnectionRegistry registry;
  private final DeliveryEngine engine;
  private final HeartbeatMonitor heartbeat;
  private final TaskScheduler scheduler;
  private final ExecutorTaskScheduler ownedScheduler;
  private final TimerScope maintenance;
  private final long sweepIntervalMs;
  private final MetricsExporter metrics;
  private final ClientEventListener clientEventListener;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private Courier(Builder builder) {
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clientEventListener = builder.clientEventListener != null
        ? builder.clientEventListener : ClientEventListener.NOOP;
    this.sweepIntervalMs = builder.sweepInterval.toMillis();
    this.ownedScheduler = builder.scheduler == null
        ? new ExecutorTaskScheduler(builder.timerThreads, "courier-timer-") : null;
    this.scheduler = builder.scheduler != null ? builder.scheduler : ownedScheduler;
    try {
      this.registry = new ConnectionRegistry(scheduler.clock(), builder.maxConnectionsPerPrincipal, metrics);
      DeliveryEngine.Builder eb = DeliveryEngine.builder()
          .registry(registry)
          .scheduler(scheduler)
          .ackTimeout(builder.ackTimeout)
          .defaultTtl(builder.defaultTtl)
          .defaultMaxRetries(builder.defaultMaxRetries)
          .defaultRequiresAck(builder.defaultRequiresAck)
          .batchSize(builder.batchSize)
          .batchWindow(builder.batchWindow)
          .queueCapacity(builder.queueCapacity)
          .keyPrefix(builder.keyPrefix)
          .keyTtl(builder.keyTtl)
          .failureListener(builder.failureListener)
          .metrics(metrics);
      if (builder.sideStore != null) {
        eb.sideStore(builder.sideStore);
      }
      if (builder.retryPolicy != null) {
        eb.retryPolicy(builder.retryPolicy);
      }
      this.engine = eb.build();
      this.heartbeat = new HeartbeatMonitor(engine, builder.probeInterval, builder.missedProbeThreshold, metrics);
      this.maintenance = new TimerScope(scheduler, "courier-maintenance");
    } catch (RuntimeException e) {
      if (ownedScheduler != null) {
        ownedScheduler.close();
      }
      throw e;
    }
    armSweep();
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── inbound: transport events ────────────────────────────────────

  /**
   * Registers a new transport session and starts liveness probing for it.
   *
   * @throws IllegalStateException if the id is already registered or this courier is closed
   */
  public void connectionOpened(String connectionId, TransportHandle handle) {
    ensureOpen();
    Connection connection = new Connection(connectionId, handle, scheduler.clock().instant(),
        new TimerScope(scheduler, "connection-" + connectionId));
    registry.register(connection);
    heartbeat.monitor(connectionId);
    logger.log(Level.FINE, "Connection {0} opened", connectionId);
  }

  /** Unregisters a session; its in-flight envelopes are queued for its principal. */
  public void connectionClosed(String connectionId, CloseReason reason) {
    engine.connectionClosed(connectionId, reason);
  }

  /**
   * Attributes a session to a principal and delivers the principal's backlog.
   *
   * @return {@code false} if the connection is unknown or was refused by the per-principal cap
   */
  public boolean principalIdentified(String connectionId, String principalId) {
    return engine.principalIdentified(connectionId, principalId);
  }

  public boolean ackReceived(String connectionId, String envelopeId) {
    return engine.ackReceived(connectionId, envelopeId);
  }

  public void livenessResponseReceived(String connectionId) {
    heartbeat.responseReceived(connectionId);
  }

  public int resumeRequested(String connectionId, Instant since) {
    return engine.resumeRequested(connectionId, since);
  }

  /**
   * Routes a decoded client frame. A client {@code ping} is answered with {@code pong}; a
   * client {@code deliver} goes to the {@link ClientEventListener}. Frames a client is not
   * expected to send are logged and ignored.
   */
  public void frameReceived(String connectionId, Frame frame) {
    Objects.requireNonNull(frame, "frame");
    if (frame instanceof Frame.Ack ack) {
      engine.ackReceived(connectionId, ack.envelopeId());
    } else if (frame instanceof Frame.Pong) {
      heartbeat.responseReceived(connectionId);
    } else if (frame instanceof Frame.Ping ping) {
      Connection connection = registry.find(connectionId);
      if (connection != null) {
        connection.runLocked(() -> {
          if (connection.isLive()) {
            DeliveryEngine.sendFrame(connection, new Frame.Pong(ping.sentAt()));
          }
        });
      }
    } else if (frame instanceof Frame.Resume resume) {
      engine.resumeRequested(connectionId, resume.since());
    } else if (frame instanceof Frame.Deliver deliver) {
      Connection connection = registry.find(connectionId);
      if (connection == null) {
        logger.log(Level.FINE, "Dropping client event from unknown connection {0}", connectionId);
        return;
      }
      try {
        clientEventListener.eventReceived(connectionId, connection.principalId(),
            deliver.event(), deliver.payload());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Client event listener threw for " + deliver.envelopeId(), e);
      }
    } else {
      logger.log(Level.FINE, "Ignoring unexpected {0} frame from {1}",
          new Object[]{frame.type(), connectionId});
    }
  }

  // ── outbound ─────────────────────────────────────────────────────

  /**
   * Emits an event to a connection or principal.
   *
   * @return the envelope id
   * @throws IllegalStateException if this courier is closed
   */
  public String emit(DeliveryTarget target, String event, String payload, SendOptions options) {
    ensureOpen();
    return engine.send(target, event, payload, options);
  }

  public ConnectionRegistry registry() {
    return registry;
  }

  public DeliveryEngine engine() {
    return engine;
  }

  public HeartbeatMonitor heartbeat() {
    return heartbeat;
  }

  /**
   * Closes every connection with {@link CloseReason#SHUTDOWN}, queueing (and mirroring)
   * their in-flight envelopes, then stops the sweep and the owned scheduler.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    maintenance.close();
    for (String connectionId : registry.connectionIds()) {
      try {
        engine.connectionClosed(connectionId, CloseReason.SHUTDOWN);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (ownedScheduler != null) {
      try {
        ownedScheduler.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private void armSweep() {
    maintenance.schedule(SWEEP_TIMER, sweepIntervalMs, () -> {
      try {
        engine.purgeExpired();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Expiry sweep failed", e);
      }
      armSweep();
    });
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Courier has been closed");
    }
  }

  /**
   * Builder for {@link Courier}. Every setting is optional.
   */
  public static final class Builder {
    private TaskScheduler scheduler;
    private int timerThreads = 2;
    private SideStore sideStore;
    private RetryPolicy retryPolicy;
    private Duration ackTimeout = Duration.ofMillis(DeliveryEngine.DEFAULT_ACK_TIMEOUT_MS);
    private Duration defaultTtl = DeliveryEngine.DEFAULT_TTL;
    private int defaultMaxRetries = DeliveryEngine.DEFAULT_MAX_RETRIES;
    private boolean defaultRequiresAck = true;
    private int queueCapacity = PendingQueue.DEFAULT_CAPACITY;
    private int batchSize = DeliveryEngine.DEFAULT_BATCH_SIZE;
    private Duration batchWindow = Duration.ZERO;
    private String keyPrefix = DurableMirror.DEFAULT_KEY_PREFIX;
    private Duration keyTtl = DurableMirror.DEFAULT_KEY_TTL;
    private int maxConnectionsPerPrincipal;
    private Duration probeInterval = HeartbeatMonitor.DEFAULT_PROBE_INTERVAL;
    private int missedProbeThreshold = HeartbeatMonitor.DEFAULT_MISSED_PROBE_THRESHOLD;
    private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
    private DeliveryFailureListener failureListener;
    private ClientEventListener clientEventListener;
    private MetricsExporter metrics;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the scheduler for every timer. When unset, the courier creates and owns an
     * {@link ExecutorTaskScheduler}.
     */
    public Builder scheduler(TaskScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /** Threads of the owned scheduler. Defaults to {@code 2}. */
    public Builder timerThreads(int timerThreads) {
      this.timerThreads = timerThreads;
      return this;
    }

    /** Defaults to a process-local {@link courier.queue.InMemorySideStore}. */
    public Builder sideStore(SideStore sideStore) {
      this.sideStore = sideStore;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder ackTimeout(Duration ackTimeout) {
      this.ackTimeout = Objects.requireNonNull(ackTimeout, "ackTimeout");
      return this;
    }

    public Builder defaultTtl(Duration defaultTtl) {
      this.defaultTtl = defaultTtl;
      return this;
    }

    public Builder defaultMaxRetries(int defaultMaxRetries) {
      this.defaultMaxRetries = defaultMaxRetries;
      return this;
    }

    public Builder defaultRequiresAck(boolean defaultRequiresAck) {
      this.defaultRequiresAck = defaultRequiresAck;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Zero (default) sends live envelopes at once; see {@link DeliveryEngine}. */
    public Builder batchWindow(Duration batchWindow) {
      this.batchWindow = Objects.requireNonNull(batchWindow, "batchWindow");
      return this;
    }

    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder keyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
      return this;
    }

    public Builder keyTtl(Duration keyTtl) {
      this.keyTtl = keyTtl;
      return this;
    }

    /** Cap on live connections per principal; {@code 0} (default) for none. */
    public Builder maxConnectionsPerPrincipal(int maxConnectionsPerPrincipal) {
      this.maxConnectionsPerPrincipal = maxConnectionsPerPrincipal;
      return this;
    }

    public Builder probeInterval(Duration probeInterval) {
      this.probeInterval = probeInterval;
      return this;
    }

    public Builder missedProbeThreshold(int missedProbeThreshold) {
      this.missedProbeThreshold = missedProbeThreshold;
      return this;
    }

    public Builder sweepInterval(Duration sweepInterval) {
      this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
      return this;
    }

    public Builder failureListener(DeliveryFailureListener failureListener) {
      this.failureListener = failureListener;
      return this;
    }

    public Builder clientEventListener(ClientEventListener clientEventListener) {
      this.clientEventListener = clientEventListener;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws IllegalStateException if build() was already called
     * @throws IllegalArgumentException if a setting is out of range
     */
    public Courier build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      validate();
      return new Courier(this);
    }

    private void validate() {
      if (scheduler == null && timerThreads < 1) {
        throw new IllegalArgumentException("timerThreads must be >= 1");
      }
      if (sweepInterval.isZero() || sweepInterval.isNegative()) {
        throw new IllegalArgumentException("sweepInterval must be positive");
      }
      if (ackTimeout.isZero() || ackTimeout.isNegative()) {
        throw new IllegalArgumentException("ackTimeout must be positive");
      }
      if (defaultMaxRetries < 0) {
        throw new IllegalArgumentException("defaultMaxRetries must be >= 0");
      }
      if (queueCapacity <= 0) {
        throw new IllegalArgumentException("queueCapacity must be > 0");
      }
      if (batchSize < 1) {
        throw new IllegalArgumentException("batchSize must be >= 1");
      }
      if (batchWindow.isNegative()) {
        throw new IllegalArgumentException("batchWindow must not be negative");
      }
      if (maxConnectionsPerPrincipal < 0) {
        throw new IllegalArgumentException("maxConnectionsPerPrincipal must be >= 0");
      }
    }
  }
}
