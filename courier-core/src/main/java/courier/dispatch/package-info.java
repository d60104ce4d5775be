/**
 * Reliable delivery: transmission, ack tracking, retry with backoff and terminal failure.
 *
 * <p>{@link courier.dispatch.DeliveryEngine} owns the send/ack/retry cycle for every live
 * connection. Each requires-ack envelope is tracked in its connection's in-flight set and
 * guarded by one ack timer; a timeout schedules a retransmit after
 * {@link courier.dispatch.RetryPolicy#computeDelayMs(int)} until the envelope's retry
 * budget runs out. Closed connections hand their in-flight envelopes to the
 * {@link courier.queue.PendingQueue}.
 *
 * @see courier.dispatch.DeliveryEngine
 * @see courier.dispatch.ExponentialBackoffRetryPolicy
 */
package courier.dispatch;
