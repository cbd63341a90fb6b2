/**
 * Spring Boot auto-configuration for webmention processing.
 *
 * <p>{@link webmention.spring.boot.WebmentionAutoConfiguration} wires a
 * {@link webmention.Webmentions} instance from {@code webmention.*} application properties.
 * Implement {@link webmention.spring.boot.WebmentionListener} on a bean to react to
 * stored and deleted mentions.
 *
 * @see webmention.spring.boot.WebmentionProperties
 */
package webmention.spring.boot;
