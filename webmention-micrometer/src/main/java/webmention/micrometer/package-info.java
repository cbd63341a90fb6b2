/**
 * Micrometer bridge for exporting webmention metrics.
 *
 * <p>{@link webmention.micrometer.MicrometerMetricsExporter} implements the
 * {@link webmention.spi.MetricsExporter} SPI with Micrometer counters and a timer.
 */
package webmention.micrometer;
