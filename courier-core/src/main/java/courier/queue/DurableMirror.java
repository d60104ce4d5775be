package courier.queue;

import courier.Envelope;
import courier.spi.MetricsExporter;
import courier.spi.SideStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Mirrors pending and in-flight envelopes into the {@link SideStore}.
 *
 * <p>Keys:
 * <ul>
 *   <li>{@code <prefix>pending:<principalId>} for queued envelopes</li>
 *   <li>{@code <prefix>inflight:<principalId>} for envelopes awaiting an ack</li>
 *   <li>{@code <prefix>inflight:conn:<connectionId>} for envelopes sent to a connection
 *       that has no principal yet</li>
 * </ul>
 *
 * <p>Every store failure is caught here, logged and counted. Delivery continues from
 * memory with reduced durability, never with reduced availability.
 */
public final class DurableMirror {
  private static final Logger logger = Logger.getLogger(DurableMirror.class.getName());

  public static final String DEFAULT_KEY_PREFIX = "courier:";
  public static final Duration DEFAULT_KEY_TTL = Duration.ofDays(7);

  private final SideStore store;
  private final EnvelopeCodec codec;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final String keyPrefix;
  private final Duration keyTtl;

  public DurableMirror(SideStore store, Clock clock, MetricsExporter metrics) {
    this(store, new EnvelopeCodec(), clock, metrics, DEFAULT_KEY_PREFIX, DEFAULT_KEY_TTL);
  }

  public DurableMirror(SideStore store, EnvelopeCodec codec, Clock clock, MetricsExporter metrics,
      String keyPrefix, Duration keyTtl) {
    this.store = Objects.requireNonNull(store, "store");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
    this.keyTtl = Objects.requireNonNull(keyTtl, "keyTtl");
    if (keyTtl.isZero() || keyTtl.isNegative()) {
      throw new IllegalArgumentException("keyTtl must be positive");
    }
  }

  public String pendingKey(String principalId) {
    return keyPrefix + "pending:" + principalId;
  }

  public String inFlightKey(String principalId, String connectionId) {
    return principalId != null
        ? keyPrefix + "inflight:" + principalId
        : keyPrefix + "inflight:conn:" + connectionId;
  }

  public void mirrorPending(String principalId, Envelope envelope) {
    push(pendingKey(principalId), envelope, codec.encode(envelope));
  }

  public void removePending(String principalId, Collection<String> envelopeIds) {
    if (!envelopeIds.isEmpty()) {
      removeIds(pendingKey(principalId), Set.copyOf(envelopeIds));
    }
  }

  public void mirrorInFlight(String principalId, String connectionId, Envelope envelope) {
    push(inFlightKey(principalId, connectionId), envelope, codec.encodeInFlight(envelope, connectionId));
  }

  public void removeInFlight(String principalId, String connectionId, String envelopeId) {
    removeInFlight(principalId, connectionId, Set.of(envelopeId));
  }

  /**
   * Removes the copies of the given envelopes held by one connection.
   */
  public void removeInFlight(String principalId, String connectionId, Collection<String> envelopeIds) {
    if (envelopeIds.isEmpty()) {
      return;
    }
    Set<String> ids = Set.copyOf(envelopeIds);
    String key = inFlightKey(principalId, connectionId);
    guard("remove from " + key, () -> store.remove(key, value ->
        connectionId.equals(codec.connectionIdOf(value)) && ids.contains(codec.envelopeIdOf(value))));
  }

  /**
   * Loads everything mirrored for a principal after a restart: queued envelopes first,
   * then envelopes that were in flight when the previous process stopped. Values that
   * cannot be decoded are logged and skipped.
   */
  public List<Envelope> recover(String principalId) {
    return recover(principalId, connectionId -> false);
  }

  /**
   * Loads the principal's queued envelopes plus the in-flight copies whose owning
   * connection is not live, and removes those in-flight copies; callers re-queue the
   * returned envelopes. Copies held by a live connection stay in place until that
   * connection acks or closes.
   *
   * @param isLiveConnection tells whether a connection id belongs to a live connection
   *     of this process
   */
  public List<Envelope> recover(String principalId, Predicate<String> isLiveConnection) {
    Objects.requireNonNull(isLiveConnection, "isLiveConnection");
    List<Envelope> recovered = new ArrayList<>(decodeAll(pendingKey(principalId)));
    String inFlightKey = inFlightKey(principalId, null);
    Predicate<String> orphaned = value -> {
      String owner = codec.connectionIdOf(value);
      return owner == null || !isLiveConnection.test(owner);
    };
    List<String> values = guard("list " + inFlightKey, () -> store.list(inFlightKey));
    boolean found = false;
    if (values != null) {
      for (String value : values) {
        if (orphaned.test(value)) {
          found = true;
          decodeInto(recovered, inFlightKey, value);
        }
      }
    }
    if (found) {
      guard("clear " + inFlightKey, () -> store.remove(inFlightKey, orphaned));
    }
    return recovered;
  }

  private List<Envelope> decodeAll(String key) {
    List<String> values = guard("list " + key, () -> store.list(key));
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    List<Envelope> envelopes = new ArrayList<>(values.size());
    for (String value : values) {
      decodeInto(envelopes, key, value);
    }
    return envelopes;
  }

  private void decodeInto(List<Envelope> envelopes, String key, String value) {
    try {
      envelopes.add(codec.decode(value));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Skipping undecodable mirror entry under " + key, e);
    }
  }

  private void push(String key, Envelope envelope, String value) {
    long ttlSeconds = Math.max(keyTtl.toSeconds(),
        envelope.remainingTtl(clock.instant()).toSeconds() + 1);
    guard("push " + key, () -> {
      store.push(key, value);
      store.expire(key, ttlSeconds);
      return null;
    });
  }

  private void removeIds(String key, Set<String> envelopeIds) {
    guard("remove from " + key, () -> store.remove(key, value -> envelopeIds.contains(codec.envelopeIdOf(value))));
  }

  private <T> T guard(String action, Supplier<T> op) {
    try {
      return op.get();
    } catch (RuntimeException e) {
      metrics.incrementSideStoreErrors();
      logger.log(Level.WARNING, "Side-store " + action + " failed; continuing memory-only", e);
      return null;
    }
  }
}
