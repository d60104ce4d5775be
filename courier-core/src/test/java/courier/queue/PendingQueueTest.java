package courier.queue;

import courier.Envelope;
import courier.FailureReason;
import courier.RecordingMetrics;
import courier.util.ManualScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PendingQueueTest {
  private static final String P = "user-1";

  private ManualScheduler scheduler;
  private InMemorySideStore store;
  private DurableMirror mirror;
  private RecordingMetrics metrics;
  private final List<Envelope> evicted = new ArrayList<>();

  @BeforeEach
  void setUp() {
    scheduler = new ManualScheduler();
    store = new InMemorySideStore(scheduler.clock());
    metrics = new RecordingMetrics();
    mirror = new DurableMirror(store, scheduler.clock(), metrics);
  }

  private PendingQueue queue(int capacity) {
    return new PendingQueue(capacity, scheduler.clock(), mirror,
        (envelope, reason) -> {
          assertEquals(FailureReason.EVICTED, reason);
          evicted.add(envelope);
        }, metrics);
  }

  private Envelope envelope(String event, Duration ttl) {
    return Envelope.builder(event).createdAt(scheduler.now()).ttl(ttl).principalId(P).build();
  }

  private Envelope envelope(String event) {
    return envelope(event, Duration.ofHours(1));
  }

  @Test
  void drainReturnsEntriesInQueuedOrder() {
    PendingQueue queue = queue(10);
    Envelope a = envelope("a");
    Envelope b = envelope("b");
    Envelope c = envelope("c");

    queue.enqueue(P, a);
    queue.enqueue(P, b);
    queue.enqueue(P, c);

    assertEquals(List.of(a, b, c), queue.drain(P));
    assertEquals(0, queue.size(P));
    assertTrue(queue.drain(P).isEmpty());
    assertTrue(store.list(mirror.pendingKey(P)).isEmpty());
  }

  @Test
  void overflowEvictsOldestAndReportsRequiresAck() {
    PendingQueue queue = queue(2);
    Envelope a = envelope("a");
    Envelope b = Envelope.builder("b").createdAt(scheduler.now()).ttl(Duration.ofHours(1))
        .requiresAck(false).build();
    Envelope c = envelope("c");
    Envelope d = envelope("d");

    queue.enqueue(P, a);
    queue.enqueue(P, b);
    queue.enqueue(P, c);
    queue.enqueue(P, d);

    assertEquals(2, queue.size(P));
    assertEquals(List.of(c, d), queue.peek(P));
    assertEquals(List.of(a), evicted, "fire-and-forget evictions are not reported");
    assertEquals(1, metrics.failed(FailureReason.EVICTED));
    assertEquals(2, store.list(mirror.pendingKey(P)).size());
  }

  @Test
  void duplicateEnqueueIsIgnored() {
    PendingQueue queue = queue(10);
    Envelope a = envelope("a");

    queue.enqueue(P, a);
    queue.enqueue(P, a);

    assertEquals(1, queue.size(P));
    assertEquals(1, store.list(mirror.pendingKey(P)).size());
  }

  @Test
  void drainSilentlyDropsExpiredEntries() {
    PendingQueue queue = queue(10);
    Envelope shortLived = envelope("short", Duration.ofSeconds(5));
    Envelope longLived = envelope("long");
    queue.enqueue(P, shortLived);
    queue.enqueue(P, longLived);

    scheduler.advance(5_000);

    assertEquals(List.of(longLived), queue.drain(P));
    assertTrue(evicted.isEmpty());
  }

  @Test
  void purgeExpiredRemovesOnlyExpired() {
    PendingQueue queue = queue(10);
    queue.enqueue(P, envelope("short", Duration.ofSeconds(5)));
    queue.enqueue("other", envelope("short", Duration.ofSeconds(5)));
    Envelope longLived = envelope("long");
    queue.enqueue(P, longLived);

    scheduler.advance(6_000);

    assertEquals(2, queue.purgeExpired());
    assertEquals(List.of(longLived), queue.peek(P));
    assertEquals(1, queue.totalSize());
    assertEquals(1, store.list(mirror.pendingKey(P)).size());
    assertEquals(0, queue.purgeExpired());
  }

  @Test
  void requestSinceTakesOnlyNewerEntries() {
    PendingQueue queue = queue(10);
    Envelope old = envelope("old");
    scheduler.advance(1_000);
    Envelope mid = envelope("mid");
    scheduler.advance(1_000);
    Envelope recent = envelope("recent");
    queue.enqueue(P, old);
    queue.enqueue(P, mid);
    queue.enqueue(P, recent);

    assertEquals(List.of(mid, recent), queue.requestSince(P, old.createdAt()));
    assertEquals(List.of(old), queue.peek(P));
    assertEquals(List.of(old), queue.requestSince(P, null));
    assertEquals(0, queue.totalSize());
  }

  @Test
  void principalsAreIndependent() {
    PendingQueue queue = queue(1);
    Envelope forP = envelope("p");
    Envelope forQ = envelope("q");

    queue.enqueue(P, forP);
    queue.enqueue("user-2", forQ);

    assertEquals(List.of(forP), queue.drain(P));
    assertEquals(List.of(forQ), queue.drain("user-2"));
    assertTrue(evicted.isEmpty());
  }

  @Test
  void hydratesFromSideStoreOnFirstTouch() {
    Envelope pending = envelope("pending");
    Envelope inFlight = envelope("inflight");
    mirror.mirrorPending(P, pending);
    mirror.mirrorInFlight(P, "old-conn", inFlight);

    PendingQueue restarted = queue(10);

    assertEquals(List.of(pending, inFlight), restarted.drain(P));
    assertEquals(0, store.keyCount());
  }

  @Test
  void hydrationLeavesCopiesHeldByLiveConnections() {
    Envelope held = envelope("held");
    Envelope orphan = envelope("orphan");
    mirror.mirrorInFlight(P, "live-conn", held);
    mirror.mirrorInFlight(P, "old-conn", orphan);
    PendingQueue queue = new PendingQueue(10, scheduler.clock(), mirror,
        (envelope, reason) -> evicted.add(envelope), metrics, "live-conn"::equals);

    assertEquals(List.of(orphan), queue.drain(P));
    assertEquals(1, store.list(mirror.inFlightKey(P, "live-conn")).size());
  }

  @Test
  void emptiedQueuesAreDropped() {
    PendingQueue queue = queue(10);
    queue.enqueue(P, envelope("a"));
    queue.enqueue("user-2", envelope("b", Duration.ofSeconds(1)));
    assertEquals(2, queue.principalCount());

    queue.drain(P);
    assertEquals(1, queue.principalCount());
    scheduler.advance(2_000);
    queue.purgeExpired();
    assertEquals(0, queue.principalCount());

    Envelope c = envelope("c");
    queue.enqueue(P, c);
    assertEquals(List.of(c), queue.peek(P));
    assertEquals(1, queue.totalSize());
  }

  @Test
  void hydrationTrimsToCapacity() {
    Envelope a = envelope("a");
    Envelope b = envelope("b");
    Envelope c = envelope("c");
    mirror.mirrorPending(P, a);
    mirror.mirrorPending(P, b);
    mirror.mirrorPending(P, c);

    PendingQueue restarted = queue(2);

    assertEquals(List.of(b, c), restarted.drain(P));
    assertEquals(List.of(a), evicted);
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> queue(0));
  }
}
