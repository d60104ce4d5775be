package courier.util;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TaskScheduler} backed by a {@link ScheduledThreadPoolExecutor} of daemon threads.
 * Cancelled timers leave the work queue at once, so ack and probe timers that are
 * disarmed long before they fall due do not pile up.
 *
 * <p>Task failures are logged and swallowed so that one misbehaving callback cannot kill
 * a timer thread shared by every connection.
 */
public final class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {
  private static final Logger logger = Logger.getLogger(ExecutorTaskScheduler.class.getName());

  private final ScheduledThreadPoolExecutor executor;
  private final Clock clock;

  public ExecutorTaskScheduler(int threads, String threadNamePrefix) {
    this(threads, threadNamePrefix, Clock.systemUTC());
  }

  public ExecutorTaskScheduler(int threads, String threadNamePrefix, Clock clock) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1");
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    this.executor = new ScheduledThreadPoolExecutor(threads,
        new DaemonThreadFactory(Objects.requireNonNull(threadNamePrefix, "threadNamePrefix")));
    this.executor.setRemoveOnCancelPolicy(true);
  }

  @Override
  public Cancellable schedule(Runnable task, long delayMs) {
    Objects.requireNonNull(task, "task");
    ScheduledFuture<?> future = executor.schedule(() -> {
      try {
        task.run();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Scheduled task failed", t);
      }
    }, Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public Clock clock() {
    return clock;
  }

  /** Tasks waiting in the work queue, cancelled ones excluded. */
  int queuedTasks() {
    return executor.getQueue().size();
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warning("Timer threads did not terminate within 5s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
