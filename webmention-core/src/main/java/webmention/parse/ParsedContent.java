package webmention.parse;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import webmention.parse.mf2.HEntry;
import webmention.parse.mf2.Mf2Document;
import webmention.util.Urls;

import java.util.List;
import java.util.Optional;

/**
 * Result of {@link ContentParser#parse}: the outbound links of a document and, for
 * HTML and Markdown input, the rendered page and its microformats2 data.
 *
 * <p>Immutable apart from the jsoup {@link Document}, which callers must not modify.
 */
public final class ParsedContent {
  private final ContentFormat format;
  private final String baseUrl;
  private final String text;
  private final Document document;
  private final List<String> links;
  private final Mf2Document microformats;
  private final HEntry entry;

  ParsedContent(ContentFormat format, String baseUrl, String text, Document document,
      List<String> links, Mf2Document microformats, HEntry entry) {
    this.format = format;
    this.baseUrl = baseUrl;
    this.text = text == null ? "" : text;
    this.document = document;
    this.links = List.copyOf(links);
    this.microformats = microformats == null ? Mf2Document.EMPTY : microformats;
    this.entry = entry;
  }

  public ContentFormat format() {
    return format;
  }

  /**
   * Returns the outbound targets: absolute http(s) URLs in document order, resolved
   * against the document URL but otherwise spelled as in the content. Links that
   * normalise to the same URL appear once, in their first spelling. Links back to the
   * document itself are excluded.
   *
   * @return the links
   */
  public List<String> links() {
    return links;
  }

  /**
   * Returns the parsed HTML, or {@code null} for plain text.
   *
   * @return the document
   */
  public Document document() {
    return document;
  }

  public Mf2Document microformats() {
    return microformats;
  }

  public Optional<HEntry> entry() {
    return Optional.ofNullable(entry);
  }

  /**
   * Checks whether the content references {@code target}. HTML must carry it in an
   * {@code href} or {@code src} attribute, either verbatim or once resolved against the
   * document URL; other formats are searched as text.
   *
   * @param target the URL to look for
   * @return whether the content links to the target
   */
  public boolean references(String target) {
    if (target == null || target.isEmpty()) {
      return false;
    }
    if (document == null) {
      return text.contains(target);
    }
    for (Element el : document.select("[href], [src]")) {
      for (String attr : new String[] {"href", "src"}) {
        if (!el.hasAttr(attr)) {
          continue;
        }
        String raw = el.attr(attr).trim();
        if (raw.equals(target)) {
          return true;
        }
        if (!raw.isEmpty() && !raw.startsWith("#") && target.equals(Urls.resolve(baseUrl, raw))) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Returns the readable text: the document body text for HTML, the raw input otherwise.
   *
   * @return the text, never {@code null}
   */
  public String plainText() {
    if (document != null && document.body() != null) {
      return document.body().text();
    }
    return text;
  }
}
