package courier.spi;

import courier.protocol.Frame;

/**
 * Server-side handle to one live transport session, supplied by the transport layer in
 * {@code connectionOpened}.
 *
 * <p>Both methods are called while the connection's lock is held and must not block:
 * implementations hand the frame to the transport's own write loop and return.
 */
public interface TransportHandle {

  /**
   * Queues a frame for writing.
   *
   * @return {@code false} if the transport refused the frame (closed, buffer full);
   *     the delivery layer then relies on its ack timeout to retry
   */
  boolean send(Frame frame);

  /**
   * Closes the underlying transport. Called when the delivery layer force-closes a
   * connection, e.g. after a liveness timeout.
   */
  void close(String reason);
}
