/**
 * Micrometer bridge for exporting delivery metrics to Prometheus, Grafana, and other backends.
 *
 * @see courier.micrometer.MicrometerMetricsExporter
 */
package courier.micrometer;
