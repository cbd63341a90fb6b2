/**
 * The mention entity and its classification enums.
 *
 * @see webmention.model.Webmention
 * @see webmention.model.WebmentionStatus
 * @see webmention.model.MentionType
 */
package webmention.model;
