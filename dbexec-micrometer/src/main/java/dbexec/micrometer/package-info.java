/**
 * Micrometer bridge for exporting executor metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link dbexec.micrometer.MicrometerExecutorMetrics} implements the
 * {@link dbexec.spi.ExecutorMetrics} SPI using Micrometer counters and timers.
 *
 * @see dbexec.micrometer.MicrometerExecutorMetrics
 */
package dbexec.micrometer;
