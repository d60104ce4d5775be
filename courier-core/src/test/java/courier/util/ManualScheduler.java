package courier.util;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.PriorityQueue;

/**
 * Virtual-time {@link TaskScheduler} for tests. Nothing runs until {@link #advance} moves
 * the clock; due tasks then run on the calling thread in due-time order.
 */
public final class ManualScheduler implements TaskScheduler {
  private final MutableClock clock;
  private final PriorityQueue<Task> tasks = new PriorityQueue<>();
  private long sequence;

  public ManualScheduler() {
    this(Instant.parse("2024-01-01T00:00:00Z"));
  }

  public ManualScheduler(Instant start) {
    this.clock = new MutableClock(start);
  }

  @Override
  public synchronized Cancellable schedule(Runnable task, long delayMs) {
    Task t = new Task(clock.instant().plusMillis(Math.max(0, delayMs)), sequence++, task);
    tasks.add(t);
    return () -> {
      synchronized (ManualScheduler.this) {
        tasks.remove(t);
      }
    };
  }

  @Override
  public Clock clock() {
    return clock;
  }

  public Instant now() {
    return clock.instant();
  }

  /** Moves time forward, running every task that falls due on the way. */
  public void advance(long millis) {
    Instant target = clock.instant().plusMillis(millis);
    while (true) {
      Task next;
      synchronized (this) {
        next = tasks.peek();
        if (next == null || next.dueAt.isAfter(target)) {
          break;
        }
        tasks.poll();
        clock.set(next.dueAt);
      }
      next.task.run();
    }
    clock.set(target);
  }

  public synchronized int pendingTasks() {
    return tasks.size();
  }

  private static final class Task implements Comparable<Task> {
    private final Instant dueAt;
    private final long seq;
    private final Runnable task;

    Task(Instant dueAt, long seq, Runnable task) {
      this.dueAt = dueAt;
      this.seq = seq;
      this.task = task;
    }

    @Override
    public int compareTo(Task o) {
      int c = dueAt.compareTo(o.dueAt);
      return c != 0 ? c : Long.compare(seq, o.seq);
    }
  }

  private static final class MutableClock extends Clock {
    private volatile Instant instant;

    MutableClock(Instant instant) {
      this.instant = instant;
    }

    void set(Instant instant) {
      this.instant = instant;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return instant;
    }
  }
}
