/**
 * Spring Boot auto-configuration for the delivery layer.
 *
 * <p>Add the starter and a {@link javax.sql.DataSource} to get a {@link courier.Courier}
 * whose queued and in-flight envelopes survive restarts. Tune it under the
 * {@code courier.*} properties, see {@link courier.spring.boot.CourierProperties}.
 *
 * @see courier.spring.boot.CourierAutoConfiguration
 * @see courier.spring.boot.CourierMicrometerAutoConfiguration
 */
package courier.spring.boot;
