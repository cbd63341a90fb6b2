/**
 * Microformats2 parsing on top of jsoup, and the {@code h-entry} / {@code h-card} view
 * used to enrich received mentions.
 *
 * @see webmention.parse.mf2.Mf2Parser
 * @see webmention.parse.mf2.EntryReader
 */
package webmention.parse.mf2;
