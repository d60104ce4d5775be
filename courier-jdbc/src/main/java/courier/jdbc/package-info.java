/**
 * Relational {@link courier.spi.SideStore} for durable mirroring of queued and in-flight
 * envelopes.
 *
 * @see courier.jdbc.JdbcSideStore
 */
package courier.jdbc;
