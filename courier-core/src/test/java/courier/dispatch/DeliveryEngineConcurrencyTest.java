package courier.dispatch;

import courier.DeliveryTarget;
import courier.RecordingTransport;
import courier.SendOptions;
import courier.registry.Connection;
import courier.registry.ConnectionRegistry;
import courier.util.ExecutorTaskScheduler;
import courier.util.TimerScope;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

import static org.junit.jupiter.api.Assertions.*;

/** Runs the engine on real scheduler threads. */
class DeliveryEngineConcurrencyTest {
  private static final int ENVELOPES = 500;

  @Test
  void ackRacingTheAckTimerSettlesEachEnvelopeExactlyOnce() throws Exception {
    Set<String> acked = ConcurrentHashMap.newKeySet();
    Set<String> failed = ConcurrentHashMap.newKeySet();
    AtomicInteger failureReports = new AtomicInteger();

    try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(2, "ack-race")) {
      ConnectionRegistry registry = new ConnectionRegistry(scheduler.clock());
      DeliveryEngine engine = DeliveryEngine.builder()
          .registry(registry)
          .scheduler(scheduler)
          .ackTimeout(Duration.ofMillis(1))
          .failureListener((envelope, reason) -> {
            failureReports.incrementAndGet();
            failed.add(envelope.envelopeId());
          })
          .build();
      RecordingTransport transport = new RecordingTransport();
      registry.register(new Connection("c1", transport, scheduler.clock().instant(),
          new TimerScope(scheduler, "c1")));
      assertTrue(engine.principalIdentified("c1", "user-1"));

      SendOptions once = SendOptions.builder().maxRetries(0).build();
      for (int i = 0; i < ENVELOPES; i++) {
        String id = engine.send(DeliveryTarget.connection("c1"), "evt", "", once);
        LockSupport.parkNanos((i % 4) * 300_000L);
        if (engine.ackReceived("c1", id)) {
          acked.add(id);
        }
      }

      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
      while (acked.size() + failureReports.get() < ENVELOPES && System.nanoTime() < deadline) {
        Thread.sleep(5);
      }

      assertEquals(ENVELOPES, acked.size() + failureReports.get());
      assertEquals(failureReports.get(), failed.size(), "no envelope reported twice");
      for (String id : acked) {
        assertFalse(failed.contains(id), id + " was both acked and failed");
      }
      Connection connection = registry.find("c1");
      assertEquals(0, connection.inFlightCount());
      assertEquals(0, connection.timers().armedCount());
    }
  }
}
