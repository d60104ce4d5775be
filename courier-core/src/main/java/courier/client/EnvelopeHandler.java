package courier.client;

import courier.protocol.Frame;

/**
 * Application callback for envelopes delivered to the client. Each envelope id reaches
 * {@link #onEnvelope} at most once within the supervisor's de-duplication window.
 */
@FunctionalInterface
public interface EnvelopeHandler {

  void onEnvelope(Frame.Deliver envelope);

  /** The server gave up on an envelope. */
  default void onDeliveryFailed(Frame.DeliveryFailed failure) {
  }
}
