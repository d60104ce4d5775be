package courier.registry;

/**
 * Why a connection left the registry.
 */
public enum CloseReason {
  /** The peer or transport closed the session normally. */
  TRANSPORT_CLOSED,
  /** The transport reported an I/O error. */
  TRANSPORT_ERROR,
  /** Liveness probes went unanswered. */
  LIVENESS_TIMEOUT,
  /** The principal already had the maximum number of live connections. */
  CONNECTION_LIMIT,
  /** The delivery layer is shutting down. */
  SHUTDOWN
}
