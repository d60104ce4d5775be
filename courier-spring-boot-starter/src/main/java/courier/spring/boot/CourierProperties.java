package courier.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the delivery layer.
 *
 * @see CourierAutoConfiguration
 */
@ConfigurationProperties(prefix = "courier")
public class CourierProperties {

  /**
   * How long a transmitted envelope waits for its ack before a retry is scheduled.
   */
  private Duration ackTimeout = Duration.ofSeconds(30);

  /**
   * Lifetime of an envelope when the emitter gives none.
   */
  private Duration defaultTtl = Duration.ofDays(7);

  /**
   * Retransmissions allowed per envelope when the emitter gives none.
   */
  private int maxRetries = 3;

  /**
   * Whether envelopes require an ack unless the emitter says otherwise.
   */
  private boolean requiresAck = true;

  /**
   * Maximum envelopes queued per offline principal; the oldest is evicted beyond this.
   */
  private int queueCapacity = 1000;

  /**
   * Cap on live connections per principal, 0 for none.
   */
  private int maxConnectionsPerPrincipal;

  /**
   * Interval of the sweep that fails expired envelopes.
   */
  private Duration sweepInterval = Duration.ofMinutes(1);

  /**
   * Threads of the timer pool driving ack timeouts, retries and probes.
   */
  private int timerThreads = 2;

  private final Retry retry = new Retry();
  private final Liveness liveness = new Liveness();
  private final Batch batch = new Batch();
  private final SideStore sideStore = new SideStore();
  private final Metrics metrics = new Metrics();

  public Duration getAckTimeout() {
    return ackTimeout;
  }

  public void setAckTimeout(Duration ackTimeout) {
    this.ackTimeout = ackTimeout;
  }

  public Duration getDefaultTtl() {
    return defaultTtl;
  }

  public void setDefaultTtl(Duration defaultTtl) {
    this.defaultTtl = defaultTtl;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public boolean isRequiresAck() {
    return requiresAck;
  }

  public void setRequiresAck(boolean requiresAck) {
    this.requiresAck = requiresAck;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }

  public int getMaxConnectionsPerPrincipal() {
    return maxConnectionsPerPrincipal;
  }

  public void setMaxConnectionsPerPrincipal(int maxConnectionsPerPrincipal) {
    this.maxConnectionsPerPrincipal = maxConnectionsPerPrincipal;
  }

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public void setSweepInterval(Duration sweepInterval) {
    this.sweepInterval = sweepInterval;
  }

  public int getTimerThreads() {
    return timerThreads;
  }

  public void setTimerThreads(int timerThreads) {
    this.timerThreads = timerThreads;
  }

  public Retry getRetry() {
    return retry;
  }

  public Liveness getLiveness() {
    return liveness;
  }

  public Batch getBatch() {
    return batch;
  }

  public SideStore getSideStore() {
    return sideStore;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public enum SideStoreType {
    JDBC,
    MEMORY
  }

  public static class Retry {
    private Duration baseDelay = Duration.ofSeconds(1);
    private double multiplier = 2.0;
    private Duration maxDelay = Duration.ofSeconds(30);
    private double jitter;

    public Duration getBaseDelay() {
      return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public double getJitter() {
      return jitter;
    }

    public void setJitter(double jitter) {
      this.jitter = jitter;
    }
  }

  public static class Liveness {
    private Duration probeInterval = Duration.ofSeconds(25);
    private int missedProbeThreshold = 3;

    public Duration getProbeInterval() {
      return probeInterval;
    }

    public void setProbeInterval(Duration probeInterval) {
      this.probeInterval = probeInterval;
    }

    public int getMissedProbeThreshold() {
      return missedProbeThreshold;
    }

    public void setMissedProbeThreshold(int missedProbeThreshold) {
      this.missedProbeThreshold = missedProbeThreshold;
    }
  }

  public static class Batch {
    /**
     * Most envelopes per message_batch frame.
     */
    private int size = 50;

    /**
     * How long live LOW and NORMAL envelopes wait to share a frame; zero sends at once.
     */
    private Duration window = Duration.ZERO;

    public int getSize() {
      return size;
    }

    public void setSize(int size) {
      this.size = size;
    }

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }
  }

  public static class SideStore {
    /**
     * JDBC uses the application's DataSource when there is one; MEMORY never persists.
     */
    private SideStoreType type = SideStoreType.JDBC;
    private String tableName = "courier_side_store";
    private String keyPrefix = "courier:";
    private Duration keyTtl = Duration.ofDays(7);
    private boolean purgeEnabled = true;
    private Duration purgeInterval = Duration.ofHours(1);

    public SideStoreType getType() {
      return type;
    }

    public void setType(SideStoreType type) {
      this.type = type;
    }

    public String getTableName() {
      return tableName;
    }

    public void setTableName(String tableName) {
      this.tableName = tableName;
    }

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }

    public Duration getKeyTtl() {
      return keyTtl;
    }

    public void setKeyTtl(Duration keyTtl) {
      this.keyTtl = keyTtl;
    }

    public boolean isPurgeEnabled() {
      return purgeEnabled;
    }

    public void setPurgeEnabled(boolean purgeEnabled) {
      this.purgeEnabled = purgeEnabled;
    }

    public Duration getPurgeInterval() {
      return purgeInterval;
    }

    public void setPurgeInterval(Duration purgeInterval) {
      this.purgeInterval = purgeInterval;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "courier";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
