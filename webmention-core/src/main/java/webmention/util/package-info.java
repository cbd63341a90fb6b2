/**
 * Small helpers: URL handling, metadata encoding, worker thread naming.
 */
package webmention.util;
