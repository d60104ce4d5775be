package courier.dispatch;

import courier.DeliveryFailureListener;
import courier.DeliveryTarget;
import courier.Envelope;
import courier.FailureReason;
import courier.SendOptions;
import courier.protocol.Frame;
import courier.queue.DurableMirror;
import courier.queue.EnvelopeCodec;
import courier.queue.InMemorySideStore;
import courier.queue.PendingQueue;
import courier.registry.CloseReason;
import courier.registry.Connection;
import courier.registry.ConnectionRegistry;
import courier.registry.InFlightDelivery;
import courier.spi.MetricsExporter;
import courier.spi.SideStore;
import courier.util.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * At-least-once delivery of envelopes to live connections.
 *
 * <p>Every requires-ack envelope transmitted to a connection is tracked in that
 * connection's in-flight set and guarded by an ack timer kept in the connection's
 * {@link courier.util.TimerScope}. A timeout retransmits after a {@link RetryPolicy}
 * delay until the envelope's retry budget or TTL runs out, at which point it fails
 * terminally. An envelope that cannot reach its connection, or is still in flight when
 * its connection closes, goes to the principal's other live connections; only when there
 * is none does it wait in the {@link PendingQueue} until the principal next identifies.
 *
 * <p>Backlogs go out in {@link Frame.Batch} frames of up to {@code batchSize} envelopes.
 * With a positive {@code batchWindow}, live {@link courier.Priority#isBatchable() batchable}
 * envelopes also wait up to that long in the connection's buffer and leave together;
 * {@code HIGH} and {@code URGENT} ones are sent at once.
 *
 * <p>All mutation of a connection's in-flight set happens under that connection's lock;
 * the pending queue is only ever locked after it. Terminal failures found by the engine
 * are reported with no lock held.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see DeliveryEngine.Builder
 */
public final class DeliveryEngine {
  private static final Logger logger = Logger.getLogger(DeliveryEngine.class.getName());

  public static final long DEFAULT_ACK_TIMEOUT_MS = 30_000;
  public static final Duration DEFAULT_TTL = Duration.ofDays(7);
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final int DEFAULT_BATCH_SIZE = 50;

  private static final String ACK_TIMER_PREFIX = "ack:";
  static final String BATCH_TIMER = "batch-flush";

  private final ConnectionRegistry registry;
  private final TaskScheduler scheduler;
  private final Clock clock;
  private final DurableMirror mirror;
  private final PendingQueue pendingQueue;
  private final RetryPolicy retryPolicy;
  private final long ackTimeoutMs;
  private final Duration defaultTtl;
  private final int defaultMaxRetries;
  private final boolean defaultRequiresAck;
  private final int batchSize;
  private final long batchWindowMs;
  private final DeliveryFailureListener failureListener;
  private final MetricsExporter metrics;

  private DeliveryEngine(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.clock = scheduler.clock();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.failureListener = builder.failureListener != null
        ? builder.failureListener : DeliveryFailureListener.NOOP;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1_000, 2.0, 30_000, 0.0);
    if (builder.ackTimeoutMs <= 0) {
      throw new IllegalArgumentException("ackTimeoutMs must be > 0");
    }
    if (builder.defaultMaxRetries < 0) {
      throw new IllegalArgumentException("defaultMaxRetries must be >= 0");
    }
    Objects.requireNonNull(builder.defaultTtl, "defaultTtl");
    if (builder.defaultTtl.isZero() || builder.defaultTtl.isNegative()) {
      throw new IllegalArgumentException("defaultTtl must be positive");
    }
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    Objects.requireNonNull(builder.batchWindow, "batchWindow");
    if (builder.batchWindow.isNegative()) {
      throw new IllegalArgumentException("batchWindow must not be negative");
    }
    this.ackTimeoutMs = builder.ackTimeoutMs;
    this.batchSize = builder.batchSize;
    this.batchWindowMs = builder.batchWindow.toMillis();
    this.defaultTtl = builder.defaultTtl;
    this.defaultMaxRetries = builder.defaultMaxRetries;
    this.defaultRequiresAck = builder.defaultRequiresAck;

    SideStore sideStore = builder.sideStore != null ? builder.sideStore : new InMemorySideStore(clock);
    this.mirror = new DurableMirror(sideStore, new EnvelopeCodec(), clock, metrics,
        builder.keyPrefix, builder.keyTtl);
    this.pendingQueue = new PendingQueue(builder.queueCapacity, clock, mirror, failureListener, metrics,
        connectionId -> registry.find(connectionId) != null);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds an envelope and routes it to {@code target}.
   *
   * <p>A connection target delivers to that connection; if it cannot, the envelope goes to
   * the principal's other live connections or its pending queue, or fails as
   * {@link FailureReason#UNREACHABLE} when the connection is unknown or never identified.
   * A principal target fans out to every live connection of the principal, or is queued
   * when there is none. Never blocks on the network.
   *
   * @return the envelope id
   * @throws IllegalArgumentException if the event is empty or the payload is too large
   */
  public String send(DeliveryTarget target, String event, String payload, SendOptions options) {
    Objects.requireNonNull(target, "target");
    SendOptions opts = options != null ? options : SendOptions.defaults();
    Envelope.Builder builder = Envelope.builder(event)
        .payload(payload)
        .priority(opts.priority())
        .createdAt(clock.instant())
        .ttl(opts.ttl(defaultTtl))
        .requiresAck(opts.requiresAck(defaultRequiresAck))
        .maxRetries(opts.maxRetries(defaultMaxRetries));

    Envelope envelope;
    if (target.kind() == DeliveryTarget.Kind.CONNECTION) {
      Connection connection = registry.find(target.id());
      envelope = builder.principalId(connection != null ? connection.principalId() : null).build();
      metrics.incrementEmitted();
      if (connection == null || !transmit(connection, envelope)) {
        deliverOrQueue(envelope, target.id());
      }
    } else {
      envelope = builder.principalId(target.id()).build();
      metrics.incrementEmitted();
      deliverOrQueue(envelope, null);
    }
    return envelope.envelopeId();
  }

  /**
   * Records the client's ack for an envelope. Acks for unknown connections or for
   * envelopes not in flight (duplicates, late acks) are ignored.
   *
   * @return {@code true} if the ack completed an in-flight delivery
   */
  public boolean ackReceived(String connectionId, String envelopeId) {
    Connection connection = registry.find(connectionId);
    if (connection == null || envelopeId == null) {
      logger.log(Level.FINE, "Ignoring ack {0} from unknown connection {1}",
          new Object[]{envelopeId, connectionId});
      return false;
    }
    InFlightDelivery delivery = connection.callLocked(() -> {
      InFlightDelivery removed = connection.removeInFlight(envelopeId);
      if (removed != null) {
        connection.timers().cancel(ackTimerKey(envelopeId));
      }
      return removed;
    });
    if (delivery == null) {
      logger.log(Level.FINE, "Ignoring duplicate ack {0} on {1}", new Object[]{envelopeId, connectionId});
      return false;
    }
    mirror.removeInFlight(connection.principalId(), connectionId, envelopeId);
    metrics.incrementAcked();
    metrics.recordAckLatencyMs(Duration.between(delivery.firstSentAt(), clock.instant()).toMillis());
    return true;
  }

  /**
   * Attributes a connection to a principal and delivers the principal's backlog to it.
   * Envelopes already in flight on the connection are re-keyed in the side-store under
   * the principal. Attribution and drain happen under the connection lock, so no send can
   * reach the connection ahead of the backlog.
   *
   * <p>If the principal already holds the maximum number of connections, the connection
   * is closed with {@link CloseReason#CONNECTION_LIMIT}.
   *
   * @return {@code true} if the connection was attributed
   */
  public boolean principalIdentified(String connectionId, String principalId) {
    Objects.requireNonNull(principalId, "principalId");
    Connection connection = registry.find(connectionId);
    if (connection == null) {
      return false;
    }
    boolean attributed = connection.callLocked(() -> {
      String previous = connection.principalId();
      if (!registry.attribute(connectionId, principalId)) {
        return false;
      }
      if (previous == null && connection.inFlightCount() > 0) {
        rekeyInFlight(connection, principalId);
      }
      deliverBacklog(connection);
      return true;
    });
    if (!attributed) {
      if (connection.isLive()) {
        closeTransport(connection, "connection limit reached");
        connectionClosed(connectionId, CloseReason.CONNECTION_LIMIT);
      }
      return false;
    }
    return true;
  }

  /**
   * Replays queued envelopes created after {@code since} ({@code null} for all) to a
   * connection that reported a gap. The connection must be identified.
   *
   * @return number of envelopes replayed
   */
  public int resumeRequested(String connectionId, Instant since) {
    Connection connection = registry.find(connectionId);
    if (connection == null || connection.principalId() == null) {
      logger.log(Level.FINE, "Ignoring resume from unidentified connection {0}", connectionId);
      return 0;
    }
    return connection.callLocked(() -> {
      if (!connection.isLive()) {
        return 0;
      }
      List<Envelope> replay = pendingQueue.requestSince(connection.principalId(), since);
      transmitBacklog(connection, replay);
      return replay.size();
    });
  }

  /**
   * Removes a connection from the registry, cancels all of its timers and hands its
   * in-flight envelopes on: envelopes still in flight on another live connection of the
   * same principal stay with that connection, the rest go to the principal's live
   * connections or, when there is none, its pending queue. Idempotent.
   */
  public void connectionClosed(String connectionId, CloseReason reason) {
    Connection connection = registry.find(connectionId);
    if (connection == null) {
      return;
    }
    String principalId = connection.principalId();
    List<Envelope> inFlight = registry.unregister(connectionId);
    logger.log(Level.FINE, "Connection {0} closed ({1}); {2} envelopes in flight",
        new Object[]{connectionId, reason, inFlight.size()});
    if (inFlight.isEmpty()) {
      return;
    }
    List<String> ids = new ArrayList<>(inFlight.size());
    for (Envelope envelope : inFlight) {
      ids.add(envelope.envelopeId());
    }
    mirror.removeInFlight(principalId, connectionId, ids);
    for (Envelope envelope : inFlight) {
      if (principalId != null && heldElsewhere(principalId, envelope.envelopeId())) {
        continue;
      }
      deliverOrQueue(principalId == null ? envelope : envelope.withPrincipal(principalId), connectionId);
    }
  }

  /**
   * Drops expired entries from every pending queue.
   *
   * @return number of entries removed
   */
  public int purgeExpired() {
    int purged = pendingQueue.purgeExpired();
    if (purged > 0) {
      logger.log(Level.FINE, "Purged {0} expired queued envelopes", purged);
    }
    return purged;
  }

  public ConnectionRegistry registry() {
    return registry;
  }

  public PendingQueue pendingQueue() {
    return pendingQueue;
  }

  public DurableMirror mirror() {
    return mirror;
  }

  public TaskScheduler scheduler() {
    return scheduler;
  }

  /**
   * Sends a frame through the connection's transport, swallowing transport exceptions
   * into a refusal.
   */
  public static boolean sendFrame(Connection connection, Frame frame) {
    try {
      return connection.handle().send(frame);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Transport send failed on " + connection.connectionId(), e);
      return false;
    }
  }

  static String ackTimerKey(String envelopeId) {
    return ACK_TIMER_PREFIX + envelopeId;
  }

  private boolean transmit(Connection connection, Envelope envelope) {
    return connection.callLocked(() -> {
      if (!connection.isLive()) {
        return false;
      }
      if (envelope.requiresAck() && connection.hasInFlight(envelope.envelopeId())) {
        return true;
      }
      if (batchWindowMs > 0 && envelope.priority().isBatchable()) {
        buffer(connection, envelope);
        return true;
      }
      return transmitNow(connection, List.of(envelope));
    });
  }

  // caller holds the connection lock and has checked it is live
  private boolean transmitNow(Connection connection, List<Envelope> envelopes) {
    Instant now = clock.instant();
    List<Frame.Deliver> frames = new ArrayList<>(envelopes.size());
    boolean tracked = false;
    for (Envelope envelope : envelopes) {
      if (envelope.requiresAck()) {
        tracked = true;
        track(connection, envelope, now);
        String envelopeId = envelope.envelopeId();
        connection.timers().schedule(ackTimerKey(envelopeId), ackTimeoutMs,
            () -> ackTimedOut(connection, envelopeId));
      }
      frames.add(Frame.Deliver.of(envelope, now));
    }
    boolean accepted = true;
    for (int from = 0; from < frames.size(); from += batchSize) {
      List<Frame.Deliver> chunk = frames.subList(from, Math.min(frames.size(), from + batchSize));
      Frame frame = chunk.size() == 1 ? chunk.get(0) : new Frame.Batch(chunk);
      if (!sendFrame(connection, frame)) {
        accepted = false;
      }
    }
    for (int i = 0; i < envelopes.size(); i++) {
      metrics.incrementTransmitted();
    }
    if (!accepted && tracked) {
      logger.log(Level.FINE, "Transport refused {0} envelopes on {1}; awaiting ack timeout",
          new Object[]{envelopes.size(), connection.connectionId()});
    }
    return tracked || accepted;
  }

  // caller holds the connection lock
  private void track(Connection connection, Envelope envelope, Instant now) {
    if (!connection.hasInFlight(envelope.envelopeId())) {
      connection.putInFlight(new InFlightDelivery(envelope, now));
      mirror.mirrorInFlight(connection.principalId(), connection.connectionId(), envelope);
    }
  }

  // caller holds the connection lock and has checked it is live
  private void buffer(Connection connection, Envelope envelope) {
    if (envelope.requiresAck()) {
      track(connection, envelope, clock.instant());
    }
    connection.buffer(envelope);
    if (connection.bufferedCount() >= batchSize) {
      flushBuffer(connection);
    } else if (!connection.timers().isArmed(BATCH_TIMER)) {
      connection.timers().schedule(BATCH_TIMER, batchWindowMs, () -> connection.runLocked(() -> {
        if (connection.isLive()) {
          flushBuffer(connection);
        }
      }));
    }
  }

  // caller holds the connection lock and has checked it is live
  private void flushBuffer(Connection connection) {
    connection.timers().cancel(BATCH_TIMER);
    List<Envelope> buffered = connection.drainBuffer();
    if (!buffered.isEmpty()) {
      transmitNow(connection, buffered);
    }
  }

  // caller holds the connection lock
  private void deliverBacklog(Connection connection) {
    if (!connection.isLive() || connection.principalId() == null) {
      return;
    }
    List<Envelope> backlog = pendingQueue.drain(connection.principalId());
    if (!backlog.isEmpty()) {
      logger.log(Level.FINE, "Delivering {0} queued envelopes to {1}",
          new Object[]{backlog.size(), connection.connectionId()});
      transmitBacklog(connection, backlog);
    }
  }

  // caller holds the connection lock; backlog skips the live batch buffer
  private void transmitBacklog(Connection connection, List<Envelope> backlog) {
    List<Envelope> fresh = new ArrayList<>(backlog.size());
    for (Envelope envelope : backlog) {
      if (!envelope.requiresAck() || !connection.hasInFlight(envelope.envelopeId())) {
        fresh.add(envelope);
      }
    }
    if (!fresh.isEmpty()) {
      transmitNow(connection, fresh);
    }
  }

  private void ackTimedOut(Connection connection, String envelopeId) {
    Failure failure = connection.callLocked(() -> {
      if (!connection.isLive()) {
        return null;
      }
      InFlightDelivery delivery = connection.inFlight(envelopeId);
      if (delivery == null) {
        return null;
      }
      Envelope envelope = delivery.envelope();
      if (envelope.isExpired(clock.instant())) {
        return fail(connection, envelope, FailureReason.EXPIRED);
      }
      if (envelope.retriesExhausted()) {
        return fail(connection, envelope, FailureReason.RETRIES_EXHAUSTED);
      }
      Envelope next = delivery.incrementRetry();
      long delayMs = retryPolicy.computeDelayMs(next.retryCount());
      metrics.incrementRetried();
      logger.log(Level.FINE, "No ack for {0} on {1}; retry {2}/{3} in {4}ms",
          new Object[]{envelopeId, connection.connectionId(), next.retryCount(), next.maxRetries(), delayMs});
      connection.timers().schedule(ackTimerKey(envelopeId), delayMs,
          () -> retransmit(connection, envelopeId));
      return null;
    });
    if (failure != null) {
      report(failure.envelope, failure.reason);
    }
  }

  private void retransmit(Connection connection, String envelopeId) {
    Failure failure = connection.callLocked(() -> {
      if (!connection.isLive()) {
        return null;
      }
      InFlightDelivery delivery = connection.inFlight(envelopeId);
      if (delivery == null) {
        return null;
      }
      Instant now = clock.instant();
      if (delivery.envelope().isExpired(now)) {
        return fail(connection, delivery.envelope(), FailureReason.EXPIRED);
      }
      delivery.markSent(now);
      sendFrame(connection, Frame.Deliver.of(delivery.envelope(), now));
      metrics.incrementTransmitted();
      connection.timers().schedule(ackTimerKey(envelopeId), ackTimeoutMs,
          () -> ackTimedOut(connection, envelopeId));
      return null;
    });
    if (failure != null) {
      report(failure.envelope, failure.reason);
    }
  }

  // caller holds the connection lock
  private Failure fail(Connection connection, Envelope envelope, FailureReason reason) {
    String envelopeId = envelope.envelopeId();
    connection.removeInFlight(envelopeId);
    connection.timers().cancel(ackTimerKey(envelopeId));
    mirror.removeInFlight(connection.principalId(), connection.connectionId(), envelopeId);
    sendFrame(connection, new Frame.DeliveryFailed(envelopeId, reason));
    return new Failure(envelope, reason);
  }

  /**
   * Sends to the principal's live connections other than {@code skipConnectionId}, or
   * queues when none takes the envelope. A queued envelope is flushed straight away if a
   * connection identified between the lookup and the enqueue.
   */
  private void deliverOrQueue(Envelope envelope, String skipConnectionId) {
    String principalId = envelope.principalId();
    if (principalId == null) {
      unroutable(envelope);
      return;
    }
    boolean attempted = false;
    boolean delivered = false;
    for (String connectionId : registry.findByPrincipal(principalId)) {
      if (connectionId.equals(skipConnectionId)) {
        continue;
      }
      Connection connection = registry.find(connectionId);
      if (connection != null) {
        attempted = true;
        if (transmit(connection, envelope)) {
          delivered = true;
        }
      }
    }
    if (delivered) {
      return;
    }
    pendingQueue.enqueue(principalId, envelope);
    if (!attempted) {
      flushBacklog(principalId, skipConnectionId);
    }
  }

  private void flushBacklog(String principalId, String skipConnectionId) {
    for (String connectionId : registry.findByPrincipal(principalId)) {
      Connection connection = registry.find(connectionId);
      if (connection == null || connectionId.equals(skipConnectionId)) {
        continue;
      }
      if (connection.callLocked(() -> {
        if (!connection.isLive()) {
          return false;
        }
        deliverBacklog(connection);
        return true;
      })) {
        return;
      }
    }
  }

  private void unroutable(Envelope envelope) {
    if (envelope.requiresAck()) {
      report(envelope, FailureReason.UNREACHABLE);
    } else {
      logger.log(Level.FINE, "Dropping fire-and-forget envelope {0} with no reachable connection",
          envelope.envelopeId());
    }
  }

  private boolean heldElsewhere(String principalId, String envelopeId) {
    for (String connectionId : registry.findByPrincipal(principalId)) {
      Connection other = registry.find(connectionId);
      if (other != null && other.callLocked(() -> other.isLive() && other.hasInFlight(envelopeId))) {
        return true;
      }
    }
    return false;
  }

  // caller holds the connection lock
  private void rekeyInFlight(Connection connection, String principalId) {
    List<String> ids = new ArrayList<>();
    for (InFlightDelivery delivery : connection.inFlightDeliveries()) {
      ids.add(delivery.envelope().envelopeId());
    }
    mirror.removeInFlight(null, connection.connectionId(), ids);
    for (InFlightDelivery delivery : connection.inFlightDeliveries()) {
      mirror.mirrorInFlight(principalId, connection.connectionId(), delivery.envelope());
    }
  }

  private void closeTransport(Connection connection, String reason) {
    try {
      connection.handle().close(reason);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Transport close failed on " + connection.connectionId(), e);
    }
  }

  private void report(Envelope envelope, FailureReason reason) {
    metrics.incrementFailed(reason);
    logger.log(Level.WARNING, "Delivery of {0} ({1}) failed: {2} after {3} retries",
        new Object[]{envelope.envelopeId(), envelope.event(), reason, envelope.retryCount()});
    try {
      failureListener.deliveryFailed(envelope, reason);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failure listener threw for " + envelope.envelopeId(), e);
    }
  }

  private static final class Failure {
    private final Envelope envelope;
    private final FailureReason reason;

    Failure(Envelope envelope, FailureReason reason) {
      this.envelope = envelope;
      this.reason = reason;
    }
  }

  /**
   * Builder for {@link DeliveryEngine}.
   */
  public static final class Builder {
    private ConnectionRegistry registry;
    private TaskScheduler scheduler;
    private SideStore sideStore;
    private RetryPolicy retryPolicy;
    private long ackTimeoutMs = DEFAULT_ACK_TIMEOUT_MS;
    private Duration defaultTtl = DEFAULT_TTL;
    private int defaultMaxRetries = DEFAULT_MAX_RETRIES;
    private boolean defaultRequiresAck = true;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private Duration batchWindow = Duration.ZERO;
    private int queueCapacity = PendingQueue.DEFAULT_CAPACITY;
    private String keyPrefix = DurableMirror.DEFAULT_KEY_PREFIX;
    private Duration keyTtl = DurableMirror.DEFAULT_KEY_TTL;
    private DeliveryFailureListener failureListener;
    private MetricsExporter metrics;

    private Builder() {}

    public Builder registry(ConnectionRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder scheduler(TaskScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /** Side-store for queue durability; defaults to a process-local store. */
    public Builder sideStore(SideStore sideStore) {
      this.sideStore = sideStore;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder ackTimeout(Duration ackTimeout) {
      this.ackTimeoutMs = ackTimeout.toMillis();
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

    /** Most envelopes per {@link Frame.Batch} frame. Defaults to {@code 50}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * How long live {@code LOW} and {@code NORMAL} envelopes may wait to share a batch
     * frame. {@link Duration#ZERO} (default) sends every envelope at once.
     */
    public Builder batchWindow(Duration batchWindow) {
      this.batchWindow = batchWindow;
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

    public Builder failureListener(DeliveryFailureListener failureListener) {
      this.failureListener = failureListener;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public DeliveryEngine build() {
      return new DeliveryEngine(this);
    }
  }
}
