package courier.client;

import courier.protocol.Frame;

import java.util.concurrent.CompletableFuture;

/**
 * Client side of one transport session (WebSocket, TCP, ...). Implementations encode frames
 * with {@link courier.protocol.FrameCodec} or an equivalent.
 *
 * <p>One {@link #open} call per session. None of the methods may block.
 */
public interface ClientTransport {

  /**
   * Opens a new session. The returned future completes when the session is usable, or
   * exceptionally if it could not be opened.
   */
  CompletableFuture<Void> open(Listener listener);

  /** Writes a frame; completes when the frame was handed to the network. */
  CompletableFuture<Void> send(Frame frame);

  /** Closes the current session, if any. Does not call {@link Listener#onClosed}. */
  void close();

  /** Inbound side of a session. */
  interface Listener {

    void onFrame(Frame frame);

    /**
     * The session ended without {@link #close()} being called.
     *
     * @param cause the error, or {@code null} for a clean close by the server
     */
    void onClosed(Throwable cause);
  }
}
