package courier;

/**
 * Application hook notified when an envelope is terminally failed.
 *
 * <p>Invoked from timer or transport threads; implementations must not block.
 * Exceptions thrown by the listener are logged and otherwise ignored.
 */
@FunctionalInterface
public interface DeliveryFailureListener {

  /** Listener that ignores every failure. */
  DeliveryFailureListener NOOP = (envelope, reason) -> { };

  void deliveryFailed(Envelope envelope, FailureReason reason);
}
