package courier;

import java.time.Duration;

/**
 * Per-emit delivery options. Unset values fall back to the engine defaults.
 */
public final class SendOptions {
  private static final SendOptions DEFAULTS = builder().build();

  private final Boolean requiresAck;
  private final Priority priority;
  private final Duration ttl;
  private final Integer maxRetries;

  private SendOptions(Builder builder) {
    if (builder.ttl != null && (builder.ttl.isZero() || builder.ttl.isNegative())) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    if (builder.maxRetries != null && builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.requiresAck = builder.requiresAck;
    this.priority = builder.priority;
    this.ttl = builder.ttl;
    this.maxRetries = builder.maxRetries;
  }

  public static SendOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean requiresAck(boolean fallback) {
    return requiresAck != null ? requiresAck : fallback;
  }

  public Priority priority() {
    return priority != null ? priority : Priority.NORMAL;
  }

  public Duration ttl(Duration fallback) {
    return ttl != null ? ttl : fallback;
  }

  public int maxRetries(int fallback) {
    return maxRetries != null ? maxRetries : fallback;
  }

  /** Builder for {@link SendOptions}. */
  public static final class Builder {
    private Boolean requiresAck;
    private Priority priority;
    private Duration ttl;
    private Integer maxRetries;

    private Builder() {}

    public Builder requiresAck(boolean requiresAck) {
      this.requiresAck = requiresAck;
      return this;
    }

    public Builder priority(Priority priority) {
      this.priority = priority;
      return this;
    }

    public Builder ttl(Duration ttl) {
      this.ttl = ttl;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public SendOptions build() {
      return new SendOptions(this);
    }
  }
}
