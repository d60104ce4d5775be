package courier.util;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Group of keyed one-shot timers owned by a single connection or supervisor.
 *
 * <p>Scheduling under a key that is already armed replaces the previous timer. Once the
 * scope is {@linkplain #close() closed} every armed timer is cancelled, later scheduling
 * calls are ignored, and a task that was already handed to the scheduler checks the scope
 * before running, so no callback fires after close.
 *
 * <p>This class is thread-safe.
 */
public final class TimerScope implements AutoCloseable {
  private final TaskScheduler scheduler;
  private final String name;
  private final Map<String, Registration> timers = new HashMap<>();
  private boolean closed;

  public TimerScope(TaskScheduler scheduler, String name) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.name = Objects.requireNonNull(name, "name");
  }

  /**
   * Arms (or re-arms) the timer under {@code key}.
   *
   * @return {@code true} if the timer was armed, {@code false} if the scope is closed
   */
  public synchronized boolean schedule(String key, long delayMs, Runnable task) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(task, "task");
    if (closed) {
      return false;
    }
    Registration previous = timers.remove(key);
    if (previous != null) {
      previous.handle.cancel();
    }
    Registration registration = new Registration();
    timers.put(key, registration);
    registration.handle = scheduler.schedule(() -> fire(key, registration, task), delayMs);
    return true;
  }

  private void fire(String key, Registration registration, Runnable task) {
    synchronized (this) {
      if (closed || timers.get(key) != registration) {
        return;
      }
      timers.remove(key);
    }
    task.run();
  }

  /**
   * Disarms the timer under {@code key}.
   *
   * @return {@code true} if a timer was armed
   */
  public synchronized boolean cancel(String key) {
    Registration registration = timers.remove(key);
    if (registration == null) {
      return false;
    }
    registration.handle.cancel();
    return true;
  }

  /** Disarms every timer but keeps the scope open for later scheduling. */
  public synchronized void cancelAll() {
    for (Registration registration : timers.values()) {
      registration.handle.cancel();
    }
    timers.clear();
  }

  public synchronized boolean isArmed(String key) {
    return timers.containsKey(key);
  }

  public synchronized int armedCount() {
    return timers.size();
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  public String name() {
    return name;
  }

  /** Cancels every armed timer and rejects further scheduling. Idempotent. */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    cancelAll();
  }

  private static final class Registration {
    // Assigned right after scheduling, under the scope monitor
    private TaskScheduler.Cancellable handle = () -> { };
  }
}
