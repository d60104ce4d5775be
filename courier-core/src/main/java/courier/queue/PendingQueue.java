package courier.queue;

import courier.DeliveryFailureListener;
import courier.Envelope;
import courier.FailureReason;
import courier.spi.MetricsExporter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, per-principal backlog of envelopes that had no reachable live connection.
 *
 * <p>Entries keep queued order. On overflow the oldest entry is evicted; evicted
 * requires-ack envelopes are reported as {@link FailureReason#EVICTED}. Expired entries
 * are dropped silently when drained or swept. Each queue is mirrored in the side-store
 * and lazily hydrated from it the first time a principal is touched, which recovers what
 * a previous process left behind. A queue that empties is dropped from memory; the next
 * touch hydrates it again from the mirror, which by then holds nothing new for it except
 * in-flight copies whose connection is no longer live.
 *
 * <p>Operations on different principals run concurrently; operations on one principal are
 * serialized. Producers never block: the capacity cap is the only backpressure.
 */
public final class PendingQueue {
  private static final Logger logger = Logger.getLogger(PendingQueue.class.getName());

  public static final int DEFAULT_CAPACITY = 1000;

  private final Map<String, PrincipalQueue> queues = new ConcurrentHashMap<>();
  private final int capacity;
  private final Clock clock;
  private final DurableMirror mirror;
  private final DeliveryFailureListener evictionListener;
  private final MetricsExporter metrics;
  private final Predicate<String> isLiveConnection;
  private final AtomicInteger totalDepth = new AtomicInteger();

  /**
   * @param capacity         maximum entries per principal, {@code > 0}
   * @param clock            time source for expiry checks
   * @param mirror           durable mirror of queued envelopes
   * @param evictionListener notified for every evicted requires-ack envelope
   * @param metrics          metrics sink
   */
  public PendingQueue(int capacity, Clock clock, DurableMirror mirror,
      DeliveryFailureListener evictionListener, MetricsExporter metrics) {
    this(capacity, clock, mirror, evictionListener, metrics, connectionId -> false);
  }

  /**
   * @param isLiveConnection tells hydration which mirrored in-flight copies still belong
   *     to a live connection and must be left alone
   */
  public PendingQueue(int capacity, Clock clock, DurableMirror mirror,
      DeliveryFailureListener evictionListener, MetricsExporter metrics,
      Predicate<String> isLiveConnection) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.mirror = Objects.requireNonNull(mirror, "mirror");
    this.evictionListener = Objects.requireNonNull(evictionListener, "evictionListener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.isLiveConnection = Objects.requireNonNull(isLiveConnection, "isLiveConnection");
  }

  /**
   * Appends an envelope to the principal's queue. An envelope already queued under the
   * same id is not added twice.
   */
  public void enqueue(String principalId, Envelope envelope) {
    Objects.requireNonNull(principalId, "principalId");
    Objects.requireNonNull(envelope, "envelope");
    List<Envelope> evicted = new ArrayList<>();
    while (true) {
      PrincipalQueue queue = queueFor(principalId);
      synchronized (queue) {
        if (queue.retired) {
          continue;
        }
        evicted.addAll(hydrate(principalId, queue));
        if (queue.contains(envelope.envelopeId())) {
          break;
        }
        queue.add(envelope);
        totalDepth.incrementAndGet();
        mirror.mirrorPending(principalId, envelope);
        evicted.addAll(trimToCapacity(principalId, queue));
        metrics.incrementQueued();
        break;
      }
    }
    metrics.recordPendingDepth(totalDepth.get());
    reportEvicted(evicted);
  }

  /**
   * Removes and returns every non-expired entry in queued order. Expired entries are
   * dropped silently.
   */
  public List<Envelope> drain(String principalId) {
    List<Envelope> live = new ArrayList<>();
    List<Envelope> evicted = new ArrayList<>();
    while (true) {
      PrincipalQueue queue = queueFor(principalId);
      synchronized (queue) {
        if (queue.retired) {
          continue;
        }
        evicted.addAll(hydrate(principalId, queue));
        Instant now = clock.instant();
        List<String> removedIds = new ArrayList<>(queue.size());
        for (Envelope envelope : queue.entries()) {
          removedIds.add(envelope.envelopeId());
          if (envelope.isExpired(now)) {
            logger.log(Level.FINE, "Dropping expired queued envelope {0}", envelope.envelopeId());
          } else {
            live.add(envelope);
          }
        }
        totalDepth.addAndGet(-queue.size());
        queue.clear();
        mirror.removePending(principalId, removedIds);
        retire(principalId, queue);
        break;
      }
    }
    metrics.recordPendingDepth(totalDepth.get());
    reportEvicted(evicted);
    return live;
  }

  /**
   * Client-initiated gap recovery: removes and returns the non-expired entries created
   * strictly after {@code since} ({@code null} for all), in queued order. Older entries
   * stay queued.
   */
  public List<Envelope> requestSince(String principalId, Instant since) {
    List<Envelope> result = new ArrayList<>();
    List<Envelope> evicted = new ArrayList<>();
    while (true) {
      PrincipalQueue queue = queueFor(principalId);
      synchronized (queue) {
        if (queue.retired) {
          continue;
        }
        evicted.addAll(hydrate(principalId, queue));
        Instant now = clock.instant();
        List<String> removedIds = new ArrayList<>();
        Iterator<Envelope> it = queue.entries().iterator();
        while (it.hasNext()) {
          Envelope envelope = it.next();
          boolean expired = envelope.isExpired(now);
          if (expired || since == null || envelope.createdAt().isAfter(since)) {
            it.remove();
            removedIds.add(envelope.envelopeId());
            if (!expired) {
              result.add(envelope);
            }
          }
        }
        queue.reindex();
        totalDepth.addAndGet(-removedIds.size());
        mirror.removePending(principalId, removedIds);
        retire(principalId, queue);
        break;
      }
    }
    metrics.recordPendingDepth(totalDepth.get());
    reportEvicted(evicted);
    return result;
  }

  /**
   * Removes expired entries from every queue.
   *
   * @return number of entries removed
   */
  public int purgeExpired() {
    Instant now = clock.instant();
    int purged = 0;
    for (Map.Entry<String, PrincipalQueue> e : queues.entrySet()) {
      PrincipalQueue queue = e.getValue();
      synchronized (queue) {
        List<String> removedIds = new ArrayList<>();
        Iterator<Envelope> it = queue.entries().iterator();
        while (it.hasNext()) {
          Envelope envelope = it.next();
          if (envelope.isExpired(now)) {
            it.remove();
            removedIds.add(envelope.envelopeId());
          }
        }
        if (!removedIds.isEmpty()) {
          queue.reindex();
          totalDepth.addAndGet(-removedIds.size());
          mirror.removePending(e.getKey(), removedIds);
          purged += removedIds.size();
        }
        retire(e.getKey(), queue);
      }
    }
    if (purged > 0) {
      metrics.recordPendingDepth(totalDepth.get());
    }
    return purged;
  }

  /** Number of entries queued for the principal, expired ones included. */
  public int size(String principalId) {
    PrincipalQueue queue = queues.get(principalId);
    if (queue == null) {
      return 0;
    }
    synchronized (queue) {
      return queue.size();
    }
  }

  /** Snapshot of the principal's queue in order, without removing anything. */
  public List<Envelope> peek(String principalId) {
    PrincipalQueue queue = queues.get(principalId);
    if (queue == null) {
      return List.of();
    }
    synchronized (queue) {
      return List.copyOf(queue.entries());
    }
  }

  public int totalSize() {
    return totalDepth.get();
  }

  public int capacity() {
    return capacity;
  }

  /** Number of principals with a queue held in memory. */
  public int principalCount() {
    return queues.size();
  }

  private PrincipalQueue queueFor(String principalId) {
    return queues.computeIfAbsent(principalId, id -> new PrincipalQueue());
  }

  // caller holds the queue monitor; an empty queue that was hydrated leaves the map
  private void retire(String principalId, PrincipalQueue queue) {
    if (queue.isEmpty() && queue.hydrated) {
      queue.retired = true;
      queues.remove(principalId, queue);
    }
  }

  // caller holds the queue monitor; returns entries evicted to fit the capacity
  private List<Envelope> hydrate(String principalId, PrincipalQueue queue) {
    if (queue.hydrated) {
      return List.of();
    }
    queue.hydrated = true;
    List<Envelope> recovered = mirror.recover(principalId, isLiveConnection);
    if (recovered.isEmpty()) {
      return List.of();
    }
    Map<String, Envelope> unique = new LinkedHashMap<>();
    for (Envelope envelope : recovered) {
      unique.putIfAbsent(envelope.envelopeId(), envelope);
    }
    List<Envelope> ordered = new ArrayList<>(unique.values());
    ordered.sort(Comparator.comparing(Envelope::createdAt));
    Instant now = clock.instant();
    List<String> pendingIds = new ArrayList<>();
    for (Envelope envelope : ordered) {
      if (!envelope.isExpired(now) && !queue.contains(envelope.envelopeId())) {
        queue.add(envelope);
        totalDepth.incrementAndGet();
      }
    }
    // rewrite the pending key so recovered in-flight entries are durable as pending
    for (Envelope envelope : recovered) {
      pendingIds.add(envelope.envelopeId());
    }
    mirror.removePending(principalId, pendingIds);
    for (Envelope envelope : queue.entries()) {
      mirror.mirrorPending(principalId, envelope);
    }
    logger.log(Level.INFO, "Recovered {0} queued envelopes for principal {1}",
        new Object[]{queue.size(), principalId});
    return trimToCapacity(principalId, queue);
  }

  private List<Envelope> trimToCapacity(String principalId, PrincipalQueue queue) {
    if (queue.size() <= capacity) {
      return List.of();
    }
    List<Envelope> evicted = new ArrayList<>();
    while (queue.size() > capacity) {
      evicted.add(queue.removeOldest());
      totalDepth.decrementAndGet();
    }
    List<String> ids = new ArrayList<>(evicted.size());
    for (Envelope envelope : evicted) {
      ids.add(envelope.envelopeId());
    }
    mirror.removePending(principalId, ids);
    logger.log(Level.WARNING, "Pending queue for principal {0} over capacity {1}; evicted {2} oldest",
        new Object[]{principalId, capacity, evicted.size()});
    return evicted;
  }

  private void reportEvicted(List<Envelope> evicted) {
    for (Envelope envelope : evicted) {
      if (!envelope.requiresAck()) {
        continue;
      }
      metrics.incrementFailed(FailureReason.EVICTED);
      try {
        evictionListener.deliveryFailed(envelope, FailureReason.EVICTED);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Eviction listener failed for " + envelope.envelopeId(), e);
      }
    }
  }

  private static final class PrincipalQueue {
    private final Deque<Envelope> entries = new ArrayDeque<>();
    private final Set<String> ids = new HashSet<>();
    private boolean hydrated;
    private boolean retired;

    boolean contains(String envelopeId) {
      return ids.contains(envelopeId);
    }

    void add(Envelope envelope) {
      entries.addLast(envelope);
      ids.add(envelope.envelopeId());
    }

    Envelope removeOldest() {
      Envelope oldest = entries.removeFirst();
      ids.remove(oldest.envelopeId());
      return oldest;
    }

    Deque<Envelope> entries() {
      return entries;
    }

    void reindex() {
      ids.clear();
      for (Envelope envelope : entries) {
        ids.add(envelope.envelopeId());
      }
    }

    void clear() {
      entries.clear();
      ids.clear();
    }

    int size() {
      return entries.size();
    }

    boolean isEmpty() {
      return entries.isEmpty();
    }
  }
}
