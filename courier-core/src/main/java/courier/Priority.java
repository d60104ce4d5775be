package courier;

/**
 * Delivery priority of an envelope.
 *
 * <p>When live batching is enabled, {@link #LOW} and {@link #NORMAL} envelopes wait in the
 * connection's batch buffer and {@link #HIGH} and {@link #URGENT} ones go out at once.
 * The server does not reorder a principal's pending queue by priority.
 */
public enum Priority {
  LOW,
  NORMAL,
  HIGH,
  URGENT;

  /** Whether an envelope of this priority may wait for a batch flush. */
  public boolean isBatchable() {
    return this == LOW || this == NORMAL;
  }
}
