package courier.dispatch;

/**
 * Strategy for computing the delay before retransmitting an unacknowledged envelope.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the given retry.
     *
     * @param retryCount the retry about to be made (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retryCount);
}
