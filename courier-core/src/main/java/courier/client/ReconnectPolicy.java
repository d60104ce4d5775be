package courier.client;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Bounded reconnect schedule. Attempt {@code n} waits the {@code n}-th delay of the
 * schedule, repeating the last one once the schedule runs out; after {@code maxAttempts}
 * failed attempts the supervisor gives up.
 */
public final class ReconnectPolicy {
  private static final ReconnectPolicy DEFAULTS = new ReconnectPolicy(List.of(
      Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(5),
      Duration.ofSeconds(10), Duration.ofSeconds(30)), 10);

  private final List<Duration> schedule;
  private final int maxAttempts;

  /**
   * @param schedule    non-empty, non-decreasing delays
   * @param maxAttempts attempts before giving up, {@code >= 1}
   */
  public ReconnectPolicy(List<Duration> schedule, int maxAttempts) {
    Objects.requireNonNull(schedule, "schedule");
    if (schedule.isEmpty()) {
      throw new IllegalArgumentException("schedule cannot be empty");
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    Duration previous = Duration.ZERO;
    for (Duration delay : schedule) {
      Objects.requireNonNull(delay, "delay");
      if (delay.isNegative()) {
        throw new IllegalArgumentException("delays must be >= 0");
      }
      if (delay.compareTo(previous) < 0) {
        throw new IllegalArgumentException("schedule must be non-decreasing");
      }
      previous = delay;
    }
    this.schedule = List.copyOf(schedule);
    this.maxAttempts = maxAttempts;
  }

  /** 1s, 2s, 5s, 10s, 30s, then 30s, up to 10 attempts. */
  public static ReconnectPolicy defaults() {
    return DEFAULTS;
  }

  /**
   * Delay before the given attempt.
   *
   * @param attempt 1-based attempt number
   */
  public Duration delayFor(int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1");
    }
    return schedule.get(Math.min(attempt, schedule.size()) - 1);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public List<Duration> schedule() {
    return schedule;
  }
}
