package courier.registry;

/**
 * Lifecycle of a server-side connection: {@code OPEN -> IDENTIFIED -> STALE -> CLOSED}.
 * {@code CLOSED} is terminal; a {@code STALE} connection is always force-closed.
 */
public enum ConnectionState {
  OPEN,
  IDENTIFIED,
  STALE,
  CLOSED;

  public boolean isLive() {
    return this == OPEN || this == IDENTIFIED;
  }
}
