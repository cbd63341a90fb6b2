/**
 * In-process storage backend.
 */
package webmention.store;
