package courier.spi;

/**
 * Unchecked exception thrown by {@link SideStore} implementations when the backing store
 * is unreachable or rejects an operation.
 */
public class SideStoreException extends RuntimeException {
  public SideStoreException(String message) {
    super(message);
  }

  public SideStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
