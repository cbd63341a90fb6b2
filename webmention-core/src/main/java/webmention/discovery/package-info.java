/**
 * Webmention endpoint discovery.
 *
 * @see webmention.discovery.HttpEndpointResolver
 * @see webmention.discovery.LinkHeaders
 */
package webmention.discovery;
