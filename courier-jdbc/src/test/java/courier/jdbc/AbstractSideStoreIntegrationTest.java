package courier.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Side-store behaviour every supported database must share. Subclasses provide a
 * {@link DataSource} whose schema was created from the matching {@code schema/*.sql}.
 */
abstract class AbstractSideStoreIntegrationTest {

  private MutableClock clock;
  private JdbcSideStore store;

  abstract DataSource dataSource();

  @BeforeEach
  void setUpStore() throws SQLException {
    try (Connection conn = dataSource().getConnection(); Statement st = conn.createStatement()) {
      st.execute("DELETE FROM " + JdbcSideStore.DEFAULT_TABLE);
    }
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    store = new JdbcSideStore(dataSource()::getConnection, JdbcSideStore.DEFAULT_TABLE, clock);
  }

  @Test
  void keepsInsertionOrderPerKey() {
    store.push("courier:pending:u1", "{\"envelopeId\":\"a\"}");
    store.push("courier:pending:u2", "{\"envelopeId\":\"x\"}");
    store.push("courier:pending:u1", "{\"envelopeId\":\"b\"}");

    assertEquals(List.of("{\"envelopeId\":\"a\"}", "{\"envelopeId\":\"b\"}"), store.list("courier:pending:u1"));
  }

  @Test
  void removesMatchingValues() {
    store.push("k", "a");
    store.push("k", "b");

    assertEquals(1, store.remove("k", "a"::equals));
    assertEquals(List.of("b"), store.list("k"));
  }

  @Test
  void expiresWholeKey() {
    store.push("k", "a");
    store.push("k", "b");
    store.expire("k", 30);

    clock.advance(Duration.ofSeconds(29));
    assertEquals(2, store.list("k").size());
    clock.advance(Duration.ofSeconds(1));
    assertTrue(store.list("k").isEmpty());
  }

  @Test
  void storesLargeValues() {
    String large = "x".repeat(64 * 1024);
    store.push("k", large);

    assertEquals(List.of(large), store.list("k"));
  }

  @Test
  void purgesExpiredRows() {
    store.push("a", "1");
    store.expire("a", 1);
    store.push("b", "2");
    clock.advance(Duration.ofSeconds(1));

    assertEquals(1, store.purgeExpired());
    assertEquals(List.of("2"), store.list("b"));
  }

  static void runScript(DataSource dataSource, String resource) throws IOException, SQLException {
    String script;
    try (InputStream in = AbstractSideStoreIntegrationTest.class.getResourceAsStream(resource)) {
      if (in == null) throw new IOException("Resource not found: " + resource);
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      for (String stmt : script.split(";")) {
        String trimmed = stmt.trim();
        if (!trimmed.isEmpty()) {
          st.execute(trimmed);
        }
      }
    }
  }
}
