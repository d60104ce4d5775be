package courier.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorTaskSchedulerTest {

  @Test
  void runsScheduledTask() throws InterruptedException {
    try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(1, "test-timer-")) {
      CountDownLatch latch = new CountDownLatch(1);

      scheduler.schedule(latch::countDown, 10);

      assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void cancelledTaskDoesNotRun() throws InterruptedException {
    try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(1, "test-timer-")) {
      AtomicBoolean ran = new AtomicBoolean();
      CountDownLatch later = new CountDownLatch(1);

      scheduler.schedule(() -> ran.set(true), 100).cancel();
      scheduler.schedule(later::countDown, 200);

      assertTrue(later.await(5, TimeUnit.SECONDS));
      assertFalse(ran.get());
    }
  }

  @Test
  void cancelledTaskLeavesTheWorkQueue() {
    try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(1, "test-timer-")) {
      TaskScheduler.Cancellable first = scheduler.schedule(() -> { }, 60_000);
      TaskScheduler.Cancellable second = scheduler.schedule(() -> { }, 60_000);
      assertEquals(2, scheduler.queuedTasks());

      first.cancel();
      second.cancel();

      assertEquals(0, scheduler.queuedTasks());
    }
  }

  @Test
  void failingTaskDoesNotKillScheduler() throws InterruptedException {
    try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler(1, "test-timer-")) {
      CountDownLatch latch = new CountDownLatch(1);

      scheduler.schedule(() -> {
        throw new IllegalStateException("boom");
      }, 0);
      scheduler.schedule(latch::countDown, 10);

      assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
  }
}
