/**
 * Per-principal offline queues and their durable mirror.
 *
 * @see courier.queue.PendingQueue
 * @see courier.queue.DurableMirror
 */
package courier.queue;
