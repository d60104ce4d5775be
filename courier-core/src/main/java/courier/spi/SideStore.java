package courier.spi;

import java.util.List;
import java.util.function.Predicate;

/**
 * Durable key/value-list store that mirrors in-flight and queued envelopes so that a
 * process restart does not lose them.
 *
 * <p>Any store exposing these four primitives satisfies the contract, e.g. a
 * Redis-compatible list store or a relational table ({@code courier.jdbc.JdbcSideStore}).
 * Implementations report failures with the unchecked {@link SideStoreException}; callers
 * treat the store as best-effort and keep delivering from memory when it fails.
 */
public interface SideStore {

  /**
   * Appends a value to the tail of the list stored at {@code key}, creating it if needed.
   */
  void push(String key, String value);

  /**
   * Returns the values stored at {@code key} in insertion order, or an empty list when the
   * key is absent or expired.
   */
  List<String> list(String key);

  /**
   * Removes every value at {@code key} matching the predicate.
   *
   * @return the number of values removed
   */
  int remove(String key, Predicate<String> predicate);

  /**
   * Sets the time-to-live of the whole key. The key and all its values disappear once the
   * TTL elapses unless it is refreshed.
   */
  void expire(String key, long ttlSeconds);
}
