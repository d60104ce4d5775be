package courier.jdbc;

import courier.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically deletes expired rows from a {@link JdbcSideStore}.
 *
 * <p>Reads skip expired rows on their own; this only reclaims space held by keys nobody
 * reads again, e.g. principals that never reconnect.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SideStorePurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SideStorePurgeScheduler.class.getName());

  private final JdbcSideStore sideStore;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private SideStorePurgeScheduler(Builder builder) {
    this.sideStore = Objects.requireNonNull(builder.sideStore, "sideStore");
    Objects.requireNonNull(builder.interval, "interval");
    if (builder.interval.getSeconds() <= 0L) {
      throw new IllegalArgumentException("interval must be at least one second");
    }
    this.intervalSeconds = builder.interval.getSeconds();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SideStorePurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("courier-side-store-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Runs one purge cycle. Failures are logged; the next cycle runs as scheduled.
   *
   * @return rows deleted, or {@code 0} when closed or on failure
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      int deleted = sideStore.purgeExpired();
      if (deleted > 0) {
        logger.log(Level.INFO, "Purged {0} expired rows from {1}",
            new Object[]{deleted, sideStore.tableName()});
      }
      return deleted;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Side-store purge cycle failed", e);
      return 0;
    }
  }

  public synchronized boolean isRunning() {
    return purgeTask != null;
  }

  /** Cancels the schedule and shuts down the purge thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link SideStorePurgeScheduler}. */
  public static final class Builder {
    private JdbcSideStore sideStore;
    private Duration interval = Duration.ofHours(1);

    private Builder() {}

    /** <b>Required.</b> */
    public Builder sideStore(JdbcSideStore sideStore) {
      this.sideStore = sideStore;
      return this;
    }

    /**
     * Time between purge cycles. Optional, defaults to one hour; must be at least a second.
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public SideStorePurgeScheduler build() {
      return new SideStorePurgeScheduler(this);
    }
  }
}
