/**
 * Sending side: diffing a resource's links against what was already announced,
 * then notifying and retracting.
 *
 * @see webmention.outgoing.OutgoingProcessor
 */
package webmention.outgoing;
