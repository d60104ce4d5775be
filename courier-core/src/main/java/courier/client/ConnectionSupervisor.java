package courier.client;

import com.github.f4b6a3.ulid.UlidCreator;
import courier.Priority;
import courier.protocol.Frame;
import courier.util.TaskScheduler;
import courier.util.TimerScope;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client-side owner of the connection lifecycle: connects, probes liveness, reconnects on a
 * bounded schedule and asks the server to replay what it missed.
 *
 * <p>On every transition to {@link SupervisorState#CONNECTED} a {@code resume} frame carrying
 * the creation time of the newest envelope received so far is sent. Received envelopes are
 * acked when they require it and de-duplicated by id over the last {@code dedupWindow} ids,
 * so a redelivery is acked again but reaches the {@link EnvelopeHandler} once.
 *
 * <p>All state transitions are serialized on this object. Each transport session is tagged
 * with a generation number; callbacks from an older session are ignored. All timers live in
 * one {@link TimerScope} and are cancelled on {@link #disconnect()}, which also resolves
 * every unfinished {@link #send} to {@code false}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class ConnectionSupervisor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionSupervisor.class.getName());

  public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_PONG_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(5);
  public static final int DEFAULT_DEDUP_WINDOW = 1000;

  private static final String RECONNECT_TIMER = "reconnect";
  private static final String PROBE_TIMER = "probe";
  private static final String PONG_TIMER = "pong-timeout";
  private static final String SEND_TIMER_PREFIX = "send:";

  private final ClientTransport transport;
  private final TaskScheduler scheduler;
  private final TimerScope timers;
  private final ReconnectPolicy reconnectPolicy;
  private final long pingIntervalMs;
  private final long pongTimeoutMs;
  private final long sendTimeoutMs;
  private final int dedupWindow;
  private final EnvelopeHandler envelopeHandler;
  private final SupervisorListener listener;

  private final LinkedHashSet<String> recentIds = new LinkedHashSet<>();
  // guarded by this
  private final Map<String, CompletableFuture<Boolean>> pendingSends = new HashMap<>();

  // guarded by this
  private SupervisorState state = SupervisorState.DISCONNECTED;
  private long generation;
  private int attempts;
  private boolean manuallyDisconnected = true;
  private boolean closed;
  private Instant lastKnownGood;

  private ConnectionSupervisor(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.envelopeHandler = Objects.requireNonNull(builder.envelopeHandler, "envelopeHandler");
    this.reconnectPolicy = builder.reconnectPolicy != null ? builder.reconnectPolicy : ReconnectPolicy.defaults();
    this.listener = builder.listener != null ? builder.listener : SupervisorListener.NOOP;
    this.pingIntervalMs = positiveMillis(builder.pingInterval, "pingInterval");
    this.pongTimeoutMs = positiveMillis(builder.pongTimeout, "pongTimeout");
    this.sendTimeoutMs = positiveMillis(builder.sendTimeout, "sendTimeout");
    if (builder.dedupWindow < 1) {
      throw new IllegalArgumentException("dedupWindow must be >= 1");
    }
    this.dedupWindow = builder.dedupWindow;
    this.lastKnownGood = builder.lastKnownGood;
    this.timers = new TimerScope(scheduler, "connection-supervisor");
  }

  private static long positiveMillis(Duration duration, String name) {
    Objects.requireNonNull(duration, name);
    if (duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return duration.toMillis();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts connecting. Resets the attempt count, so this also leaves
   * {@link SupervisorState#FAILED}. No effect while connecting or connected.
   *
   * @throws IllegalStateException if the supervisor is closed
   */
  public synchronized void connect() {
    if (closed) {
      throw new IllegalStateException("ConnectionSupervisor has been closed");
    }
    manuallyDisconnected = false;
    if (state == SupervisorState.CONNECTING || state == SupervisorState.CONNECTED) {
      return;
    }
    timers.cancel(RECONNECT_TIMER);
    attempts = 0;
    openSession();
  }

  /**
   * Closes the session and cancels every timer. The supervisor stays
   * {@link SupervisorState#DISCONNECTED} until {@link #connect()} is called again.
   */
  public synchronized void disconnect() {
    manuallyDisconnected = true;
    generation++;
    timers.cancelAll();
    attempts = 0;
    List<CompletableFuture<Boolean>> unfinished = new ArrayList<>(pendingSends.values());
    pendingSends.clear();
    for (CompletableFuture<Boolean> pending : unfinished) {
      pending.complete(false);
    }
    SupervisorState previous = state;
    setState(SupervisorState.DISCONNECTED);
    if (previous == SupervisorState.CONNECTED || previous == SupervisorState.CONNECTING) {
      closeTransport();
    }
  }

  /**
   * Reacts to a host environment hint: reconnects now when waiting for a scheduled attempt
   * or {@link SupervisorState#FAILED}, probes now when connected. Collapses with pending
   * timers instead of adding work.
   */
  public synchronized void signal(EnvironmentSignal signal) {
    Objects.requireNonNull(signal, "signal");
    if (closed || manuallyDisconnected) {
      return;
    }
    switch (state) {
      case CONNECTED -> {
        if (!timers.isArmed(PONG_TIMER)) {
          logger.log(Level.FINE, "{0}: probing now", signal);
          probe(generation);
        }
      }
      case FAILED -> {
        logger.log(Level.INFO, "{0}: retrying after reconnect exhaustion", signal);
        attempts = 0;
        openSession();
      }
      case DISCONNECTED -> {
        if (timers.cancel(RECONNECT_TIMER)) {
          logger.log(Level.FINE, "{0}: reconnecting now", signal);
          openSession();
        }
      }
      default -> {
      }
    }
  }

  /**
   * Sends an event upstream. Best effort: resolves to {@code true} once the transport took
   * the frame, or {@code false} when not connected, on a transport error, or when the send
   * timeout elapses first.
   */
  public CompletableFuture<Boolean> send(String event, String payload) {
    Objects.requireNonNull(event, "event");
    CompletableFuture<Boolean> result = new CompletableFuture<>();
    String id = UlidCreator.getMonotonicUlid().toString();
    synchronized (this) {
      if (state != SupervisorState.CONNECTED) {
        result.complete(false);
        return result;
      }
      pendingSends.put(id, result);
      timers.schedule(SEND_TIMER_PREFIX + id, sendTimeoutMs, () -> sendSettled(id, false));
    }
    Instant now = scheduler.clock().instant();
    Frame.Deliver frame = new Frame.Deliver(id, event,
        payload == null ? "" : payload, false, Priority.NORMAL, now, now);
    sendQuietly(frame).whenComplete((v, err) -> sendSettled(id, err == null));
    return result;
  }

  private void sendSettled(String id, boolean accepted) {
    CompletableFuture<Boolean> pending;
    synchronized (this) {
      pending = pendingSends.remove(id);
      timers.cancel(SEND_TIMER_PREFIX + id);
    }
    if (pending != null) {
      pending.complete(accepted);
    }
  }

  public synchronized SupervisorState state() {
    return state;
  }

  public synchronized int attempts() {
    return attempts;
  }

  /** Creation time of the newest envelope received, or {@code null}. */
  public synchronized Instant lastKnownGood() {
    return lastKnownGood;
  }

  /** Armed timers; zero after {@link #disconnect()}. */
  public int armedTimers() {
    return timers.armedCount();
  }

  /** Disconnects and releases the timer scope. Idempotent. */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    disconnect();
    closed = true;
    timers.close();
  }

  // ── session lifecycle (caller holds the monitor) ─────────────────

  private void openSession() {
    long gen = ++generation;
    setState(SupervisorState.CONNECTING);
    CompletableFuture<Void> opening;
    try {
      opening = transport.open(new SessionListener(gen));
    } catch (RuntimeException e) {
      opening = CompletableFuture.failedFuture(e);
    }
    opening.whenComplete((v, err) -> opened(gen, err));
  }

  private synchronized void opened(long gen, Throwable err) {
    if (gen != generation || state != SupervisorState.CONNECTING) {
      if (err == null && manuallyDisconnected) {
        closeTransport();
      }
      return;
    }
    if (err != null) {
      logger.log(Level.WARNING, "Connect attempt failed: {0}", err.toString());
      scheduleReconnect();
      return;
    }
    attempts = 0;
    setState(SupervisorState.CONNECTED);
    sendQuietly(new Frame.Resume(lastKnownGood));
    timers.schedule(PROBE_TIMER, pingIntervalMs, () -> probe(gen));
  }

  private void scheduleReconnect() {
    attempts++;
    if (attempts > reconnectPolicy.maxAttempts()) {
      int made = attempts - 1;
      logger.log(Level.SEVERE, "Giving up after {0} reconnect attempts", made);
      setState(SupervisorState.FAILED);
      notifyListener(() -> listener.reconnectExhausted(made));
      return;
    }
    Duration delay = reconnectPolicy.delayFor(attempts);
    setState(SupervisorState.DISCONNECTED);
    int attempt = attempts;
    notifyListener(() -> listener.reconnectScheduled(attempt, delay));
    timers.schedule(RECONNECT_TIMER, delay.toMillis(), this::reconnectDue);
  }

  private synchronized void reconnectDue() {
    if (!manuallyDisconnected && state == SupervisorState.DISCONNECTED) {
      openSession();
    }
  }

  private synchronized void sessionLost(long gen, Throwable cause) {
    if (gen != generation || manuallyDisconnected) {
      return;
    }
    if (state != SupervisorState.CONNECTED && state != SupervisorState.CONNECTING) {
      return;
    }
    logger.log(Level.WARNING, "Connection lost: {0}", cause == null ? "closed by server" : cause.toString());
    generation++;
    timers.cancel(PROBE_TIMER);
    timers.cancel(PONG_TIMER);
    scheduleReconnect();
  }

  private synchronized void probe(long gen) {
    if (gen != generation || state != SupervisorState.CONNECTED) {
      return;
    }
    sendQuietly(new Frame.Ping(scheduler.clock().instant()));
    timers.schedule(PONG_TIMER, pongTimeoutMs, () -> pongMissed(gen));
  }

  private synchronized void pongMissed(long gen) {
    if (gen != generation || state != SupervisorState.CONNECTED) {
      return;
    }
    closeTransport();
    sessionLost(gen, new TimeoutException("No pong within " + pongTimeoutMs + "ms"));
  }

  private synchronized void pongReceived(long gen) {
    if (gen != generation || state != SupervisorState.CONNECTED) {
      return;
    }
    timers.cancel(PONG_TIMER);
    timers.schedule(PROBE_TIMER, pingIntervalMs, () -> probe(gen));
  }

  // ── inbound frames ────────────────────────────────────────────────

  private void deliverReceived(long gen, Frame.Deliver deliver) {
    boolean fresh;
    synchronized (this) {
      if (gen != generation) {
        return;
      }
      fresh = remember(deliver.envelopeId());
      if (lastKnownGood == null || deliver.createdAt().isAfter(lastKnownGood)) {
        lastKnownGood = deliver.createdAt();
      }
    }
    if (fresh) {
      try {
        envelopeHandler.onEnvelope(deliver);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Envelope handler threw for " + deliver.envelopeId(), e);
      }
    } else {
      logger.log(Level.FINE, "Duplicate envelope {0}", deliver.envelopeId());
    }
    if (deliver.requiresAck()) {
      sendQuietly(new Frame.Ack(deliver.envelopeId()));
    }
  }

  // caller holds the monitor
  private boolean remember(String envelopeId) {
    if (!recentIds.add(envelopeId)) {
      return false;
    }
    if (recentIds.size() > dedupWindow) {
      Iterator<String> oldest = recentIds.iterator();
      oldest.next();
      oldest.remove();
    }
    return true;
  }

  private CompletableFuture<Void> sendQuietly(Frame frame) {
    try {
      return transport.send(frame).whenComplete((v, err) -> {
        if (err != null) {
          logger.log(Level.FINE, "Sending " + frame.type() + " failed", err);
        }
      });
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Transport send threw for " + frame.type(), e);
      return CompletableFuture.failedFuture(e);
    }
  }

  private void closeTransport() {
    try {
      transport.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Transport close failed", e);
    }
  }

  // caller holds the monitor
  private void setState(SupervisorState next) {
    SupervisorState previous = state;
    if (previous == next) {
      return;
    }
    state = next;
    logger.log(Level.FINE, "Supervisor {0} -> {1}", new Object[]{previous, next});
    notifyListener(() -> listener.stateChanged(previous, next));
  }

  private void notifyListener(Runnable call) {
    try {
      call.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Supervisor listener threw", e);
    }
  }

  private final class SessionListener implements ClientTransport.Listener {
    private final long gen;

    SessionListener(long gen) {
      this.gen = gen;
    }

    @Override
    public void onFrame(Frame frame) {
      if (frame instanceof Frame.Deliver deliver) {
        deliverReceived(gen, deliver);
      } else if (frame instanceof Frame.Batch batch) {
        for (Frame.Deliver entry : batch.entries()) {
          deliverReceived(gen, entry);
        }
      } else if (frame instanceof Frame.Pong) {
        pongReceived(gen);
      } else if (frame instanceof Frame.Ping ping) {
        sendQuietly(new Frame.Pong(ping.sentAt()));
      } else if (frame instanceof Frame.DeliveryFailed failed) {
        try {
          envelopeHandler.onDeliveryFailed(failed);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Envelope handler threw for " + failed.envelopeId(), e);
        }
      } else {
        logger.log(Level.FINE, "Ignoring unexpected {0} frame", frame.type());
      }
    }

    @Override
    public void onClosed(Throwable cause) {
      sessionLost(gen, cause);
    }
  }

  /**
   * Builder for {@link ConnectionSupervisor}.
   */
  public static final class Builder {
    private ClientTransport transport;
    private TaskScheduler scheduler;
    private EnvelopeHandler envelopeHandler;
    private ReconnectPolicy reconnectPolicy;
    private SupervisorListener listener;
    private Duration pingInterval = DEFAULT_PING_INTERVAL;
    private Duration pongTimeout = DEFAULT_PONG_TIMEOUT;
    private Duration sendTimeout = DEFAULT_SEND_TIMEOUT;
    private int dedupWindow = DEFAULT_DEDUP_WINDOW;
    private Instant lastKnownGood;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder transport(ClientTransport transport) {
      this.transport = transport;
      return this;
    }

    /** <b>Required.</b> */
    public Builder scheduler(TaskScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /** <b>Required.</b> */
    public Builder envelopeHandler(EnvelopeHandler envelopeHandler) {
      this.envelopeHandler = envelopeHandler;
      return this;
    }

    public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
      this.reconnectPolicy = reconnectPolicy;
      return this;
    }

    public Builder listener(SupervisorListener listener) {
      this.listener = listener;
      return this;
    }

    public Builder pingInterval(Duration pingInterval) {
      this.pingInterval = pingInterval;
      return this;
    }

    public Builder pongTimeout(Duration pongTimeout) {
      this.pongTimeout = pongTimeout;
      return this;
    }

    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    public Builder dedupWindow(int dedupWindow) {
      this.dedupWindow = dedupWindow;
      return this;
    }

    /** Resume point restored from a previous run, e.g. from local storage. */
    public Builder lastKnownGood(Instant lastKnownGood) {
      this.lastKnownGood = lastKnownGood;
      return this;
    }

    public ConnectionSupervisor build() {
      return new ConnectionSupervisor(this);
    }
  }
}
