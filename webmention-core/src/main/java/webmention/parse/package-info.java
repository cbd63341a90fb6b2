/**
 * Content parsing: outbound link extraction from plain text, Markdown and HTML, with
 * microformats2 data for HTML.
 */
package webmention.parse;
