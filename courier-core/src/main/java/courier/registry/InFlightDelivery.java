package courier.registry;

import courier.Envelope;

import java.time.Instant;
import java.util.Objects;

/**
 * One envelope awaiting an ack on one connection. Mutated only while the owning
 * {@link Connection}'s lock is held.
 */
public final class InFlightDelivery {
  private Envelope envelope;
  private final Instant firstSentAt;
  private Instant lastSentAt;

  public InFlightDelivery(Envelope envelope, Instant sentAt) {
    this.envelope = Objects.requireNonNull(envelope, "envelope");
    this.firstSentAt = Objects.requireNonNull(sentAt, "sentAt");
    this.lastSentAt = sentAt;
  }

  public Envelope envelope() {
    return envelope;
  }

  public Instant firstSentAt() {
    return firstSentAt;
  }

  public Instant lastSentAt() {
    return lastSentAt;
  }

  /**
   * Advances the retry count by one.
   *
   * @return the updated envelope
   * @throws IllegalStateException if retries are already exhausted
   */
  public Envelope incrementRetry() {
    if (envelope.retriesExhausted()) {
      throw new IllegalStateException("Retries exhausted for " + envelope.envelopeId());
    }
    envelope = envelope.withRetryCount(envelope.retryCount() + 1);
    return envelope;
  }

  public void markSent(Instant sentAt) {
    this.lastSentAt = sentAt;
  }
}
