package webmention.parse;

import com.vladsch.flexmark.ext.autolink.AutolinkExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.nibor.autolink.LinkExtractor;
import org.nibor.autolink.LinkSpan;
import org.nibor.autolink.LinkType;
import webmention.parse.mf2.EntryReader;
import webmention.parse.mf2.HEntry;
import webmention.parse.mf2.Mf2Document;
import webmention.parse.mf2.Mf2Parser;
import webmention.util.Urls;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Extracts outbound links and microformats2 data from plain text, Markdown or HTML.
 *
 * <p>Markdown is rendered to HTML with flexmark (bare URLs autolinked) and then handled
 * as HTML. Plain text is scanned for URLs directly. Microformats extraction is
 * best-effort: malformed or missing markup yields no entry, never an error.
 *
 * <p>A pure function of its input; instances are stateless and thread-safe.
 */
public final class ContentParser {
  private static final Logger logger = Logger.getLogger(ContentParser.class.getName());

  private static final String LINK_SELECTOR =
      "a[href], area[href], img[src], video[src], audio[src], source[src], blockquote[cite], q[cite]";

  private static final Parser MARKDOWN_PARSER = Parser.builder(markdownOptions()).build();
  private static final HtmlRenderer MARKDOWN_RENDERER = HtmlRenderer.builder(markdownOptions()).build();

  private final LinkExtractor textLinks = LinkExtractor.builder()
      .linkTypes(EnumSet.of(LinkType.URL, LinkType.WWW))
      .build();
  private final Mf2Parser mf2Parser = new Mf2Parser();
  private final EntryReader entryReader = new EntryReader();

  /**
   * Parses content.
   *
   * @param text    the body, may be {@code null} or empty
   * @param format  the format, or {@code null} to detect it from the text
   * @param baseUrl the document's own URL, used to resolve relative links; may be {@code null}
   * @return the parsed content, never {@code null}
   */
  public ParsedContent parse(String text, ContentFormat format, String baseUrl) {
    String body = text == null ? "" : text;
    ContentFormat effective = format != null ? format : ContentFormat.detect(body);
    return switch (effective) {
      case HTML -> parseHtml(body, effective, baseUrl);
      case MARKDOWN -> parseHtml(renderMarkdown(body), effective, baseUrl);
      case PLAIN -> parsePlain(body, baseUrl);
    };
  }

  /**
   * Shorthand for {@code parse(text, format, baseUrl).links()}.
   *
   * @param text    the body
   * @param format  the format, or {@code null} to detect it
   * @param baseUrl the document URL
   * @return the outbound links
   */
  public List<String> extractLinks(String text, ContentFormat format, String baseUrl) {
    return parse(text, format, baseUrl).links();
  }

  /**
   * Renders Markdown to HTML.
   *
   * @param markdown the source text
   * @return the HTML
   */
  public String renderMarkdown(String markdown) {
    Node document = MARKDOWN_PARSER.parse(markdown);
    return MARKDOWN_RENDERER.render(document);
  }

  private ParsedContent parseHtml(String html, ContentFormat format, String baseUrl) {
    Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
    Map<String, String> links = new LinkedHashMap<>();
    for (Element el : document.select(LINK_SELECTOR)) {
      addLink(links, baseUrl, rawLink(el));
    }

    Mf2Document microformats = Mf2Document.EMPTY;
    HEntry entry = null;
    try {
      microformats = mf2Parser.parse(document, baseUrl);
      entry = entryReader.read(microformats);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Ignoring unreadable microformats in " + baseUrl, e);
    }
    return new ParsedContent(format, baseUrl, html, document, new ArrayList<>(links.values()), microformats, entry);
  }

  private ParsedContent parsePlain(String text, String baseUrl) {
    Map<String, String> links = new LinkedHashMap<>();
    for (LinkSpan span : textLinks.extractLinks(text)) {
      String url = text.substring(span.getBeginIndex(), span.getEndIndex());
      if (span.getType() == LinkType.WWW) {
        url = "http://" + url;
      }
      addLink(links, baseUrl, url);
    }
    return new ParsedContent(ContentFormat.PLAIN, baseUrl, text, null, new ArrayList<>(links.values()),
        Mf2Document.EMPTY, null);
  }

  private static String rawLink(Element el) {
    return switch (el.normalName()) {
      case "a", "area" -> el.attr("href");
      case "blockquote", "q" -> el.attr("cite");
      default -> el.attr("src");
    };
  }

  /**
   * Adds a link keyed by its normalised form. The first spelling seen is kept, resolved
   * but otherwise as written: receivers look for the target in the page verbatim.
   */
  private static void addLink(Map<String, String> links, String baseUrl, String raw) {
    if (raw == null) {
      return;
    }
    String ref = raw.trim();
    if (ref.isEmpty() || ref.startsWith("#")) {
      return;
    }
    String resolved = Urls.resolve(baseUrl, ref);
    String key = Urls.normalize(resolved);
    if (key == null) {
      return;
    }
    if (baseUrl != null && Urls.sameResource(baseUrl, key)) {
      return;
    }
    links.putIfAbsent(key, resolved);
  }

  private static MutableDataSet markdownOptions() {
    return new MutableDataSet()
        .set(Parser.EXTENSIONS, List.of(AutolinkExtension.create()))
        .set(HtmlRenderer.SOFT_BREAK, "<br />\n");
  }
}
