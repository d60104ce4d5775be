package courier.registry;

import courier.Envelope;
import courier.spi.TransportHandle;
import courier.util.TimerScope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Server-side record of one live session.
 *
 * <p>Every mutation of the in-flight set, the heartbeat counters and the connection's
 * timers happens under {@link #lock()}, so an ack and a retry for the same envelope can
 * never race. All timers tied to the connection live in its {@link TimerScope}, which the
 * registry closes on unregister.
 */
public final class Connection {
  private final String connectionId;
  private final TransportHandle handle;
  private final Instant createdAt;
  private final TimerScope timers;
  private final ReentrantLock lock = new ReentrantLock();

  // insertion order = first transmission order
  private final Map<String, InFlightDelivery> inFlight = new LinkedHashMap<>();
  private final List<Envelope> batchBuffer = new ArrayList<>();

  private volatile String principalId;
  private volatile ConnectionState state = ConnectionState.OPEN;
  private volatile Instant lastHeartbeatSentAt;
  private volatile Instant lastHeartbeatAckAt;
  private int missedProbes;

  public Connection(String connectionId, TransportHandle handle, Instant createdAt, TimerScope timers) {
    this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    this.timers = Objects.requireNonNull(timers, "timers");
  }

  public String connectionId() {
    return connectionId;
  }

  public TransportHandle handle() {
    return handle;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public TimerScope timers() {
    return timers;
  }

  public String principalId() {
    return principalId;
  }

  public ConnectionState state() {
    return state;
  }

  public boolean isLive() {
    return state.isLive();
  }

  public Instant lastHeartbeatSentAt() {
    return lastHeartbeatSentAt;
  }

  public Instant lastHeartbeatAckAt() {
    return lastHeartbeatAckAt;
  }

  public ReentrantLock lock() {
    return lock;
  }

  /** Runs {@code action} while holding the connection lock. */
  public void runLocked(Runnable action) {
    lock.lock();
    try {
      action.run();
    } finally {
      lock.unlock();
    }
  }

  /** Evaluates {@code action} while holding the connection lock. */
  public <T> T callLocked(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  // ── lock-guarded state, package-private mutators used by the registry ──

  void attribute(String principalId) {
    this.principalId = principalId;
    if (state == ConnectionState.OPEN) {
      state = ConnectionState.IDENTIFIED;
    }
  }

  void markStale() {
    if (state.isLive()) {
      state = ConnectionState.STALE;
    }
  }

  void markClosed() {
    state = ConnectionState.CLOSED;
  }

  void heartbeatSent(Instant at) {
    lastHeartbeatSentAt = at;
  }

  void heartbeatAcked(Instant at) {
    lastHeartbeatAckAt = at;
    missedProbes = 0;
  }

  /**
   * Counts a probe that got no response before the next one was due.
   *
   * @return the number of consecutive missed probes
   */
  public int recordMissedProbe() {
    return ++missedProbes;
  }

  public int missedProbes() {
    return missedProbes;
  }

  /** Whether a probe was sent and has not been answered yet. */
  public boolean probeOutstanding() {
    Instant sent = lastHeartbeatSentAt;
    if (sent == null) {
      return false;
    }
    Instant acked = lastHeartbeatAckAt;
    return acked == null || acked.isBefore(sent);
  }

  // ── in-flight set (caller holds the lock) ──

  public InFlightDelivery inFlight(String envelopeId) {
    return inFlight.get(envelopeId);
  }

  public boolean hasInFlight(String envelopeId) {
    return inFlight.containsKey(envelopeId);
  }

  public void putInFlight(InFlightDelivery delivery) {
    inFlight.put(delivery.envelope().envelopeId(), delivery);
  }

  public InFlightDelivery removeInFlight(String envelopeId) {
    return inFlight.remove(envelopeId);
  }

  public int inFlightCount() {
    return inFlight.size();
  }

  public Collection<InFlightDelivery> inFlightDeliveries() {
    return List.copyOf(inFlight.values());
  }

  // ── batch buffer (caller holds the lock) ──

  public void buffer(Envelope envelope) {
    batchBuffer.add(envelope);
  }

  public int bufferedCount() {
    return batchBuffer.size();
  }

  /** Removes and returns the buffered envelopes in arrival order. */
  public List<Envelope> drainBuffer() {
    List<Envelope> buffered = List.copyOf(batchBuffer);
    batchBuffer.clear();
    return buffered;
  }

  List<Envelope> drainInFlight() {
    batchBuffer.clear();
    List<Envelope> envelopes = new ArrayList<>(inFlight.size());
    for (InFlightDelivery delivery : inFlight.values()) {
      envelopes.add(delivery.envelope());
    }
    inFlight.clear();
    return envelopes;
  }

  @Override
  public String toString() {
    return "Connection{id=" + connectionId + ", principalId=" + principalId + ", state=" + state + '}';
  }
}
