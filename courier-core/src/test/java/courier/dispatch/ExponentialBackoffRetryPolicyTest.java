package courier.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstRetryUsesBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10_000);

    assertEquals(100, policy.computeDelayMs(1));
  }

  @Test
  void delayGrowsByMultiplier() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 3.0, 100_000, 0.0);

    assertEquals(100, policy.computeDelayMs(1));
    assertEquals(300, policy.computeDelayMs(2));
    assertEquals(900, policy.computeDelayMs(3));
  }

  @Test
  void delayIsMonotonicAndCapped() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 2.0, 5_000, 0.0);

    long previous = 0;
    for (int retry = 1; retry <= 64; retry++) {
      long delay = policy.computeDelayMs(retry);
      assertTrue(delay >= previous, "retry " + retry + " went down: " + delay);
      assertTrue(delay <= 5_000, "retry " + retry + " over cap: " + delay);
      previous = delay;
    }
    assertEquals(5_000, previous);
  }

  @Test
  void jitterStaysWithinRatioAndCap() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1_000, 2.0, 1_200, 0.5);

    for (int i = 0; i < 100; i++) {
      long delay = policy.computeDelayMs(1);
      assertTrue(delay >= 500 && delay <= 1_200, "got " + delay);
    }
  }

  @Test
  void handlesAttemptCountAtOverflowBoundary() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 60_000);

    assertEquals(60_000, policy.computeDelayMs(31));
    assertEquals(60_000, policy.computeDelayMs(2_000));
  }

  @Test
  void nonPositiveRetryCountReturnsZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 1_000);

    assertEquals(0, policy.computeDelayMs(0));
    assertEquals(0, policy.computeDelayMs(-1));
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(-1, 1_000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1_000, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 0.5, 1_000, 0.0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 2.0, 1_000, 1.0));
  }
}
