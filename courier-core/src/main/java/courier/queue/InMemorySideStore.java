package courier.queue;

import courier.spi.SideStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Process-local {@link SideStore}. Survives connection churn but not a process restart;
 * used when no durable store is configured and in tests.
 *
 * <p>This class is thread-safe.
 */
public final class InMemorySideStore implements SideStore {
  private final Clock clock;
  private final Map<String, Entry> entries = new HashMap<>();

  public InMemorySideStore() {
    this(Clock.systemUTC());
  }

  public InMemorySideStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized void push(String key, String value) {
    Objects.requireNonNull(value, "value");
    Entry entry = live(key);
    if (entry == null) {
      entry = new Entry();
      entries.put(key, entry);
    }
    entry.values.add(value);
  }

  @Override
  public synchronized List<String> list(String key) {
    Entry entry = live(key);
    return entry == null ? List.of() : List.copyOf(entry.values);
  }

  @Override
  public synchronized int remove(String key, Predicate<String> predicate) {
    Entry entry = live(key);
    if (entry == null) {
      return 0;
    }
    int before = entry.values.size();
    entry.values.removeIf(predicate);
    int removed = before - entry.values.size();
    if (entry.values.isEmpty()) {
      entries.remove(key);
    }
    return removed;
  }

  @Override
  public synchronized void expire(String key, long ttlSeconds) {
    Entry entry = live(key);
    if (entry != null) {
      entry.expiresAt = clock.instant().plusSeconds(ttlSeconds);
    }
  }

  public synchronized int keyCount() {
    Instant now = clock.instant();
    entries.values().removeIf(e -> e.expiresAt != null && !now.isBefore(e.expiresAt));
    return entries.size();
  }

  private Entry live(String key) {
    Objects.requireNonNull(key, "key");
    Entry entry = entries.get(key);
    if (entry == null) {
      return null;
    }
    if (entry.expiresAt != null && !clock.instant().isBefore(entry.expiresAt)) {
      entries.remove(key);
      return null;
    }
    return entry;
  }

  private static final class Entry {
    private final List<String> values = new ArrayList<>();
    private Instant expiresAt;
  }
}
