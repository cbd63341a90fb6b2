/**
 * Service Provider Interfaces (SPI) for plugging webmention processing into an application.
 *
 * <p>Integrators implement these to supply persistence, HTTP transport and metrics.
 *
 * @see webmention.spi.WebmentionStore
 * @see webmention.spi.HttpTransport
 * @see webmention.spi.MetricsExporter
 */
package webmention.spi;
