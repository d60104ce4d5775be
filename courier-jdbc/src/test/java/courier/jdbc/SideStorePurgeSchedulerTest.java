package courier.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SideStorePurgeSchedulerTest {

  private MutableClock clock;
  private JdbcSideStore store;

  @BeforeEach
  void setUp() throws Exception {
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    store = new JdbcSideStore(H2Schema.newDataSource()::getConnection,
        JdbcSideStore.DEFAULT_TABLE, clock);
  }

  @Test
  void runOnceDeletesExpiredRows() {
    store.push("gone", "a");
    store.expire("gone", 5);
    store.push("kept", "b");
    clock.advance(Duration.ofSeconds(5));

    try (SideStorePurgeScheduler purge = SideStorePurgeScheduler.builder().sideStore(store).build()) {
      assertEquals(1, purge.runOnce());
      assertEquals(0, purge.runOnce());
    }
    assertEquals(List.of("b"), store.list("kept"));
  }

  @Test
  void failuresAreLoggedNotThrown() {
    JdbcSideStore broken = new JdbcSideStore(() -> {
      throw new SQLException("down");
    });

    try (SideStorePurgeScheduler purge = SideStorePurgeScheduler.builder().sideStore(broken).build()) {
      assertEquals(0, purge.runOnce());
    }
  }

  @Test
  void lifecycle() {
    SideStorePurgeScheduler purge = SideStorePurgeScheduler.builder()
        .sideStore(store)
        .interval(Duration.ofMinutes(10))
        .build();
    purge.start();
    purge.start();
    assertTrue(purge.isRunning());

    purge.close();

    assertFalse(purge.isRunning());
    assertEquals(0, purge.runOnce());
    assertThrows(IllegalStateException.class, purge::start);
  }

  @Test
  void validatesSettings() {
    assertThrows(NullPointerException.class, () -> SideStorePurgeScheduler.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> SideStorePurgeScheduler.builder().sideStore(store).interval(Duration.ofMillis(500)).build());
  }
}
