/**
 * User notification hooks and their isolated dispatch.
 */
package webmention.callback;
