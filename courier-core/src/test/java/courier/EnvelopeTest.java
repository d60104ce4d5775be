package courier;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeTest {
  private final Instant now = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  void defaults() {
    Envelope envelope = Envelope.builder("evt").createdAt(now).ttl(Duration.ofMinutes(1)).build();

    assertNotNull(envelope.envelopeId());
    assertEquals("", envelope.payload());
    assertEquals(Priority.NORMAL, envelope.priority());
    assertTrue(envelope.requiresAck());
    assertEquals(0, envelope.retryCount());
    assertEquals(3, envelope.maxRetries());
    assertNull(envelope.principalId());
    assertEquals(now.plusSeconds(60), envelope.expiresAt());
  }

  @Test
  void idsAreUniqueAndOrdered() {
    Envelope first = Envelope.builder("evt").createdAt(now).ttl(Duration.ofMinutes(1)).build();
    Envelope second = Envelope.builder("evt").createdAt(now).ttl(Duration.ofMinutes(1)).build();

    assertNotEquals(first.envelopeId(), second.envelopeId());
    assertTrue(first.envelopeId().compareTo(second.envelopeId()) < 0);
  }

  @Test
  void expiryIsInclusiveOfDeadline() {
    Envelope envelope = Envelope.builder("evt").createdAt(now).ttl(Duration.ofSeconds(10)).build();

    assertFalse(envelope.isExpired(now.plusMillis(9_999)));
    assertTrue(envelope.isExpired(now.plusSeconds(10)));
    assertEquals(Duration.ZERO, envelope.remainingTtl(now.plusSeconds(30)));
    assertEquals(Duration.ofSeconds(4), envelope.remainingTtl(now.plusSeconds(6)));
  }

  @Test
  void retryCountNeverExceedsMaxRetries() {
    Envelope envelope = Envelope.builder("evt").createdAt(now).ttl(Duration.ofSeconds(10)).maxRetries(1).build();

    Envelope retried = envelope.withRetryCount(1);

    assertTrue(retried.retriesExhausted());
    assertEquals(envelope.envelopeId(), retried.envelopeId());
    assertThrows(IllegalArgumentException.class, () -> envelope.withRetryCount(2));
  }

  @Test
  void validatesArguments() {
    assertThrows(NullPointerException.class, () -> Envelope.builder(null).ttl(Duration.ofSeconds(1)).build());
    assertThrows(IllegalArgumentException.class, () -> Envelope.builder("").ttl(Duration.ofSeconds(1)).build());
    assertThrows(NullPointerException.class, () -> Envelope.builder("evt").build());
    assertThrows(IllegalArgumentException.class,
        () -> Envelope.builder("evt").ttl(Duration.ofSeconds(1)).expiresAt(now).build());
    assertThrows(IllegalArgumentException.class, () -> Envelope.builder("evt").ttl(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class,
        () -> Envelope.builder("evt").ttl(Duration.ofSeconds(1)).maxRetries(-1).build());
    String oversized = "x".repeat(Envelope.MAX_PAYLOAD_BYTES + 1);
    assertThrows(IllegalArgumentException.class,
        () -> Envelope.builder("evt").ttl(Duration.ofSeconds(1)).payload(oversized).build());
  }
}
