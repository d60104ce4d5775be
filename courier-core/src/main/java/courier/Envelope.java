package courier;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable deliverable unit of at-least-once delivery.
 *
 * <p>Each envelope is assigned a ULID-based {@code envelopeId} by default. The payload is
 * an opaque string of at most {@value #MAX_PAYLOAD_BYTES} bytes (UTF-8). The retry count
 * is advanced with {@link #withRetryCount(int)}, which returns a copy; it never exceeds
 * {@code maxRetries}.
 *
 * <p>Envelopes with {@code requiresAck=false} are fire-and-forget: they are never tracked
 * in flight and never retried.
 *
 * @see SendOptions
 */
public final class Envelope {
  public static final int MAX_PAYLOAD_BYTES = 1024 * 1024;

  private final String envelopeId;
  private final String event;
  private final String payload;
  private final Priority priority;
  private final Instant createdAt;
  private final Instant expiresAt;
  private final boolean requiresAck;
  private final int retryCount;
  private final int maxRetries;
  private final String principalId;

  private Envelope(Builder builder) {
    this.envelopeId = builder.envelopeId == null ? newEnvelopeId() : builder.envelopeId;
    this.event = Objects.requireNonNull(builder.event, "event");
    if (event.isEmpty()) {
      throw new IllegalArgumentException("event cannot be empty");
    }
    this.payload = builder.payload == null ? "" : builder.payload;
    if (payload.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
    }
    this.priority = builder.priority == null ? Priority.NORMAL : builder.priority;
    this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
    if (builder.expiresAt != null && builder.ttl != null) {
      throw new IllegalArgumentException("Set either expiresAt or ttl, not both");
    }
    if (builder.ttl != null) {
      if (builder.ttl.isZero() || builder.ttl.isNegative()) {
        throw new IllegalArgumentException("ttl must be positive");
      }
      this.expiresAt = createdAt.plus(builder.ttl);
    } else {
      this.expiresAt = Objects.requireNonNull(builder.expiresAt, "expiresAt or ttl");
    }
    if (expiresAt.isBefore(createdAt)) {
      throw new IllegalArgumentException("expiresAt must not be before createdAt");
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (builder.retryCount < 0 || builder.retryCount > builder.maxRetries) {
      throw new IllegalArgumentException(
          "retryCount must be within [0, " + builder.maxRetries + "], got: " + builder.retryCount);
    }
    this.requiresAck = builder.requiresAck;
    this.retryCount = builder.retryCount;
    this.maxRetries = builder.maxRetries;
    this.principalId = builder.principalId;
  }

  public static Builder builder(String event) {
    return new Builder(event);
  }

  public String envelopeId() {
    return envelopeId;
  }

  public String event() {
    return event;
  }

  public String payload() {
    return payload;
  }

  public Priority priority() {
    return priority;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  public boolean requiresAck() {
    return requiresAck;
  }

  public int retryCount() {
    return retryCount;
  }

  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Returns the principal this envelope is addressed to, or {@code null} when it was sent
   * to a connection that had not been identified yet.
   */
  public String principalId() {
    return principalId;
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public boolean retriesExhausted() {
    return retryCount >= maxRetries;
  }

  /**
   * Returns the time left until expiry, never negative.
   */
  public Duration remainingTtl(Instant now) {
    Duration remaining = Duration.between(now, expiresAt);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  public Envelope withRetryCount(int retryCount) {
    return toBuilder().retryCount(retryCount).build();
  }

  public Envelope withPrincipal(String principalId) {
    return toBuilder().principalId(principalId).build();
  }

  private Builder toBuilder() {
    return new Builder(event)
        .envelopeId(envelopeId)
        .payload(payload)
        .priority(priority)
        .createdAt(createdAt)
        .expiresAt(expiresAt)
        .requiresAck(requiresAck)
        .retryCount(retryCount)
        .maxRetries(maxRetries)
        .principalId(principalId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Envelope other)) return false;
    return envelopeId.equals(other.envelopeId) && retryCount == other.retryCount;
  }

  @Override
  public int hashCode() {
    return Objects.hash(envelopeId, retryCount);
  }

  @Override
  public String toString() {
    return "Envelope{envelopeId=" + envelopeId
        + ", event=" + event
        + ", priority=" + priority
        + ", requiresAck=" + requiresAck
        + ", retry=" + retryCount + "/" + maxRetries
        + (principalId != null ? ", principalId=" + principalId : "")
        + '}';
  }

  /**
   * Builder for {@link Envelope}.
   */
  public static final class Builder {
    private final String event;
    private String envelopeId;
    private String payload;
    private Priority priority;
    private Instant createdAt;
    private Instant expiresAt;
    private Duration ttl;
    private boolean requiresAck = true;
    private int retryCount;
    private int maxRetries = 3;
    private String principalId;

    private Builder(String event) {
      this.event = event;
    }

    /**
     * Sets a custom envelope identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     */
    public Builder envelopeId(String envelopeId) {
      this.envelopeId = envelopeId;
      return this;
    }

    public Builder payload(String payload) {
      this.payload = payload;
      return this;
    }

    public Builder priority(Priority priority) {
      this.priority = priority;
      return this;
    }

    /**
     * Sets the creation timestamp.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     */
    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    /**
     * Sets an absolute expiry. Mutually exclusive with {@link #ttl}.
     */
    public Builder expiresAt(Instant expiresAt) {
      this.expiresAt = expiresAt;
      return this;
    }

    /**
     * Sets a time-to-live relative to {@code createdAt}. Mutually exclusive with
     * {@link #expiresAt}. One of the two is required.
     */
    public Builder ttl(Duration ttl) {
      this.ttl = ttl;
      return this;
    }

    /**
     * Optional. Defaults to {@code true}.
     */
    public Builder requiresAck(boolean requiresAck) {
      this.requiresAck = requiresAck;
      return this;
    }

    public Builder retryCount(int retryCount) {
      this.retryCount = retryCount;
      return this;
    }

    /**
     * Optional. Defaults to {@code 3}. Must be &ge; 0.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder principalId(String principalId) {
      this.principalId = principalId;
      return this;
    }

    /**
     * Builds an immutable {@link Envelope}.
     *
     * @throws IllegalArgumentException if the event is empty, the payload is too large,
     *     neither or both of {@code ttl}/{@code expiresAt} are set, or the retry bounds
     *     are inconsistent
     */
    public Envelope build() {
      return new Envelope(this);
    }
  }

  private static String newEnvelopeId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
