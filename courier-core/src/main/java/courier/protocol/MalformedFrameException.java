package courier.protocol;

/**
 * Thrown by {@link FrameCodec#decode} for text that is not a well-formed frame.
 */
public final class MalformedFrameException extends RuntimeException {
  public MalformedFrameException(String message) {
    super(message);
  }

  public MalformedFrameException(String message, Throwable cause) {
    super(message, cause);
  }
}
