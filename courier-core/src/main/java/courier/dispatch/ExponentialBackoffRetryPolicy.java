package courier.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using capped exponential backoff.
 *
 * <p>Delay formula: {@code min(baseDelay * multiplier^(retryCount-1), maxDelay)}. With a
 * positive {@code jitterRatio} the result is scaled by a random factor in
 * {@code [1 - jitterRatio, 1 + jitterRatio)} and capped again at {@code maxDelay}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final double multiplier;
  private final long maxDelayMs;
  private final double jitterRatio;

  /**
   * Doubling backoff without jitter.
   *
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, 2.0, maxDelayMs, 0.0);
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param multiplier  growth factor per retry, {@code >= 1}
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitterRatio random spread in {@code [0, 1)}, {@code 0} for deterministic delays
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, double multiplier, long maxDelayMs,
      double jitterRatio) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (multiplier < 1.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitterRatio < 0.0 || jitterRatio >= 1.0) {
      throw new IllegalArgumentException("jitterRatio must be in [0, 1), got: " + jitterRatio);
    }
    this.baseDelayMs = baseDelayMs;
    this.multiplier = multiplier;
    this.maxDelayMs = maxDelayMs;
    this.jitterRatio = jitterRatio;
  }

  @Override
  public long computeDelayMs(int retryCount) {
    if (retryCount <= 0) {
      return 0L;
    }
    // Computed in double space; overflow saturates to infinity and the cap applies
    double expDelay = baseDelayMs * Math.pow(multiplier, retryCount - 1);
    long capped = (long) Math.min((double) maxDelayMs, expDelay);
    if (jitterRatio == 0.0) {
      return capped;
    }
    double jitter = ThreadLocalRandom.current().nextDouble(1.0 - jitterRatio, 1.0 + jitterRatio);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
  }
}
