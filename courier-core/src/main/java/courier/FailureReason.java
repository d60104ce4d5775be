package courier;

/**
 * Why an envelope was terminally failed. Terminal failures are reported once via
 * {@link DeliveryFailureListener} and never retried.
 */
public enum FailureReason {
  /** Ack timeouts reached {@code maxRetries}. */
  RETRIES_EXHAUSTED,
  /** The envelope outlived its TTL while in flight. */
  EXPIRED,
  /** The principal's pending queue overflowed and this was its oldest entry. */
  EVICTED,
  /** No live connection and no principal to queue for. */
  UNREACHABLE
}
