package courier;

/**
 * Application hook for events a client sends upstream with
 * {@code ConnectionSupervisor.send(event, payload)}.
 *
 * <p>Invoked on the transport thread that decoded the frame; implementations must not block.
 */
@FunctionalInterface
public interface ClientEventListener {

  /** Listener that ignores every event. */
  ClientEventListener NOOP = (connectionId, principalId, event, payload) -> { };

  /**
   * @param connectionId connection the event arrived on
   * @param principalId  the connection's principal, or {@code null} if not identified
   * @param event        event name
   * @param payload      opaque payload
   */
  void eventReceived(String connectionId, String principalId, String event, String payload);
}
