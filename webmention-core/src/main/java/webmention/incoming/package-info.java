/**
 * Receiving side: verification, classification and recording of notifications.
 *
 * @see webmention.incoming.IncomingHandler
 */
package webmention.incoming;
