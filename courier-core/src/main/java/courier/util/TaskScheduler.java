package courier.util;

import java.time.Clock;

/**
 * Source of time and delayed tasks for every timer in the delivery layer.
 *
 * <p>Ack timeouts, retry delays, heartbeats and client reconnects all go through one
 * scheduler so they share the same notion of "now". Components normally group their
 * timers in a {@link TimerScope} rather than calling {@link #schedule} directly.
 *
 * @see ExecutorTaskScheduler
 */
public interface TaskScheduler {

  /**
   * Schedules a one-shot task.
   *
   * @param task    the task to run
   * @param delayMs delay in milliseconds (negative values are treated as zero)
   * @return a handle that cancels the task if it has not started yet
   */
  Cancellable schedule(Runnable task, long delayMs);

  /**
   * Returns the clock timestamps are taken from.
   *
   * @return the scheduler clock
   */
  Clock clock();

  /** Handle to a scheduled task. */
  @FunctionalInterface
  interface Cancellable {
    /**
     * Cancels the task. Has no effect if the task already ran or was cancelled.
     */
    void cancel();
  }
}
