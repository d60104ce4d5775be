package courier.client;

/**
 * Lifecycle states of a {@link ConnectionSupervisor}.
 */
public enum SupervisorState {
  /** Not connected. Initial state, the wait between reconnect attempts, and the state after {@code disconnect()}. */
  DISCONNECTED,
  /** A transport open is in progress. */
  CONNECTING,
  /** The transport is open and liveness probing runs. */
  CONNECTED,
  /** Reconnect attempts are exhausted; waits for {@code connect()} or an environment signal. */
  FAILED
}
