package courier.jdbc;

import courier.spi.SideStore;
import courier.spi.SideStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SideStore} backed by a relational table, one row per list value.
 *
 * <p>Rows keep their insertion order through an auto-increment {@code entry_id}. A key's
 * time-to-live is stored on each of its rows; rows whose {@code expires_at} has passed are
 * invisible and are deleted lazily on access or in bulk by {@link #purgeExpired()}. The DML
 * is portable across H2, MySQL and PostgreSQL; the DDL for each lives under
 * {@code schema/} on the classpath.
 *
 * <p>Every call borrows a connection from the {@link ConnectionProvider} in auto-commit
 * mode. This class is thread-safe.
 */
public final class JdbcSideStore implements SideStore {
  private static final Logger logger = Logger.getLogger(JdbcSideStore.class.getName());

  public static final String DEFAULT_TABLE = "courier_side_store";
  // concatenated into SQL
  private static final Pattern TABLE_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final Clock clock;

  public JdbcSideStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, DEFAULT_TABLE);
  }

  public JdbcSideStore(ConnectionProvider connectionProvider, String tableName) {
    this(connectionProvider, tableName, Clock.systemUTC());
  }

  /**
   * @throws IllegalArgumentException if {@code tableName} is not a plain SQL identifier
   */
  public JdbcSideStore(ConnectionProvider connectionProvider, String tableName, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    Objects.requireNonNull(tableName, "tableName");
    if (!TABLE_NAME.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public void push(String key, String value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    try (Connection conn = connectionProvider.getConnection()) {
      Timestamp now = now();
      // New values inherit the key's current expiry.
      List<Timestamp> expiry = JdbcTemplate.query(conn,
          "SELECT MAX(expires_at) AS expires_at FROM " + tableName +
              " WHERE store_key=? AND expires_at > ?",
          rs -> rs.getTimestamp("expires_at"), key, now);
      Timestamp expiresAt = expiry.isEmpty() ? null : expiry.get(0);
      if (expiresAt == null) {
        JdbcTemplate.update(conn,
            "INSERT INTO " + tableName + " (store_key, entry_value, created_at, expires_at)" +
                " VALUES (?,?,?,NULL)",
            key, value, now);
      } else {
        JdbcTemplate.update(conn,
            "INSERT INTO " + tableName + " (store_key, entry_value, created_at, expires_at)" +
                " VALUES (?,?,?,?)",
            key, value, now, expiresAt);
      }
    } catch (SQLException e) {
      throw new SideStoreException("Failed to push to " + key, e);
    }
  }

  @Override
  public List<String> list(String key) {
    Objects.requireNonNull(key, "key");
    try (Connection conn = connectionProvider.getConnection()) {
      Timestamp now = now();
      deleteExpired(conn, key, now);
      return JdbcTemplate.query(conn,
          "SELECT entry_value FROM " + tableName +
              " WHERE store_key=? AND (expires_at IS NULL OR expires_at > ?) ORDER BY entry_id",
          rs -> rs.getString("entry_value"), key, now);
    } catch (SQLException e) {
      throw new SideStoreException("Failed to list " + key, e);
    }
  }

  @Override
  public int remove(String key, Predicate<String> predicate) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(predicate, "predicate");
    try (Connection conn = connectionProvider.getConnection()) {
      List<Row> rows = JdbcTemplate.query(conn,
          "SELECT entry_id, entry_value FROM " + tableName +
              " WHERE store_key=? AND (expires_at IS NULL OR expires_at > ?) ORDER BY entry_id",
          rs -> new Row(rs.getLong("entry_id"), rs.getString("entry_value")), key, now());
      List<Object[]> doomed = new ArrayList<>();
      for (Row row : rows) {
        if (predicate.test(row.value)) {
          doomed.add(new Object[]{row.entryId});
        }
      }
      return JdbcTemplate.batchUpdate(conn, "DELETE FROM " + tableName + " WHERE entry_id=?", doomed);
    } catch (SQLException e) {
      throw new SideStoreException("Failed to remove from " + key, e);
    }
  }

  @Override
  public void expire(String key, long ttlSeconds) {
    Objects.requireNonNull(key, "key");
    try (Connection conn = connectionProvider.getConnection()) {
      Instant now = clock.instant();
      JdbcTemplate.update(conn,
          "UPDATE " + tableName + " SET expires_at=?" +
              " WHERE store_key=? AND (expires_at IS NULL OR expires_at > ?)",
          Timestamp.from(now.plusSeconds(ttlSeconds)), key, Timestamp.from(now));
    } catch (SQLException e) {
      throw new SideStoreException("Failed to expire " + key, e);
    }
  }

  /**
   * Deletes every expired row across all keys.
   *
   * @return the number of rows deleted
   */
  public int purgeExpired() {
    try (Connection conn = connectionProvider.getConnection()) {
      int deleted = JdbcTemplate.update(conn,
          "DELETE FROM " + tableName + " WHERE expires_at <= ?", now());
      if (deleted > 0) {
        logger.log(Level.FINE, "Purged {0} expired side-store rows from {1}",
            new Object[]{deleted, tableName});
      }
      return deleted;
    } catch (SQLException e) {
      throw new SideStoreException("Failed to purge expired rows", e);
    }
  }

  private void deleteExpired(Connection conn, String key, Timestamp now) {
    JdbcTemplate.update(conn,
        "DELETE FROM " + tableName + " WHERE store_key=? AND expires_at <= ?", key, now);
  }

  private Timestamp now() {
    return Timestamp.from(clock.instant());
  }

  private record Row(long entryId, String value) {
  }
}
