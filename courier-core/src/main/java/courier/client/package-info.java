/**
 * Client side of the delivery protocol.
 *
 * <p>{@link courier.client.ConnectionSupervisor} keeps one logical session alive over a
 * pluggable {@link courier.client.ClientTransport}: it reconnects on the
 * {@link courier.client.ReconnectPolicy} schedule, probes liveness, resumes from the last
 * envelope it saw and de-duplicates redeliveries before they reach the
 * {@link courier.client.EnvelopeHandler}.
 */
package courier.client;
