package courier.client;

import java.time.Duration;

/**
 * Observer of {@link ConnectionSupervisor} lifecycle events.
 *
 * <p>Called while the supervisor's state is locked: implementations must return quickly and
 * must not call back into the supervisor from another thread and wait for it.
 */
public interface SupervisorListener {

  /** Listener that ignores every event. */
  SupervisorListener NOOP = new SupervisorListener() { };

  default void stateChanged(SupervisorState from, SupervisorState to) {
  }

  default void reconnectScheduled(int attempt, Duration delay) {
  }

  /**
   * Reconnect attempts are exhausted and the supervisor entered {@link SupervisorState#FAILED}.
   *
   * @param attempts the number of attempts made
   */
  default void reconnectExhausted(int attempts) {
  }
}
