/**
 * JDK {@code HttpClient} implementation of the transport SPI.
 */
package webmention.http;
