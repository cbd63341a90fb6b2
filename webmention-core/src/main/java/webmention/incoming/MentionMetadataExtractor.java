package webmention.incoming;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import webmention.model.MentionType;
import webmention.model.Webmention;
import webmention.model.WebmentionDirection;
import webmention.parse.ParsedContent;
import webmention.parse.mf2.Citation;
import webmention.parse.mf2.HCard;
import webmention.parse.mf2.HEntry;
import webmention.parse.mf2.Location;
import webmention.parse.mf2.Mf2Dates;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills a received mention from its parsed source: the {@code h-entry} first, then
 * Open Graph and plain HTML metadata for whatever is still missing.
 *
 * <p>Metadata keys written: {@code mf2.type}, {@code mf2.url}, {@code mf2.uid},
 * {@code mf2.category}, {@code mf2.syndication}, {@code mf2.photo},
 * {@code mf2.content_html}, {@code location.*}, {@code comments.count}. List values
 * are joined with a newline.
 */
public final class MentionMetadataExtractor {
  private final int excerptLength;

  public MentionMetadataExtractor(int excerptLength) {
    if (excerptLength < 1) {
      throw new IllegalArgumentException("excerptLength must be >= 1");
    }
    this.excerptLength = excerptLength;
  }

  /**
   * Builds an incoming mention without status or timestamps.
   *
   * @param source the mentioning URL
   * @param target the mentioned URL
   * @param parsed the parsed source
   * @return a builder with identity, type, author and content fields set
   */
  public Webmention.Builder extract(String source, String target, ParsedContent parsed) {
    Webmention.Builder builder = Webmention.builder(source, target, WebmentionDirection.IN);
    Map<String, String> metadata = new LinkedHashMap<>();
    Fields fields = new Fields();

    HEntry entry = parsed.entry().orElse(null);
    if (entry != null) {
      fromEntry(entry, target, builder, fields, metadata);
    } else {
      builder.mentionType(MentionType.MENTION);
    }
    if (parsed.document() != null) {
      fromHtml(parsed.document(), fields);
    }

    if (fields.excerpt == null && fields.content != null) {
      fields.excerpt = fields.content;
    }
    return builder
        .title(fields.title)
        .content(fields.content)
        .excerpt(excerpt(fields.excerpt, excerptLength))
        .published(fields.published)
        .authorName(fields.authorName)
        .authorUrl(fields.authorUrl)
        .authorPhoto(fields.authorPhoto)
        .metadata(metadata);
  }

  private static void fromEntry(HEntry entry, String target, Webmention.Builder builder, Fields fields,
      Map<String, String> metadata) {
    MentionType type = entry.classify(target);
    builder.mentionType(type);
    if (type == MentionType.RSVP) {
      builder.rsvp(entry.rsvp());
    }

    fields.content = entry.contentText();
    String name = entry.name();
    if (name != null && !sameText(name, entry.contentText())) {
      fields.title = name;
    }
    fields.excerpt = entry.summary();
    fields.published = entry.published();
    HCard author = entry.author();
    if (author != null) {
      fields.authorName = author.name();
      fields.authorUrl = author.url();
      fields.authorPhoto = author.photo();
    }

    put(metadata, "mf2.type", String.join("\n", entry.types()));
    put(metadata, "mf2.url", entry.url());
    put(metadata, "mf2.uid", entry.uid());
    put(metadata, "mf2.category", String.join("\n", entry.categories()));
    put(metadata, "mf2.syndication", String.join("\n", entry.syndication()));
    put(metadata, "mf2.photo", String.join("\n", entry.photos()));
    put(metadata, "mf2.content_html", entry.contentHtml());
    Location location = entry.location();
    if (location != null) {
      put(metadata, "location.type", location.type());
      put(metadata, "location.name", location.name());
      put(metadata, "location.url", location.url());
      put(metadata, "location.latitude", location.latitude());
      put(metadata, "location.longitude", location.longitude());
    }
    List<Citation> comments = entry.comments();
    if (!comments.isEmpty()) {
      metadata.put("comments.count", Integer.toString(comments.size()));
    }
  }

  private static void fromHtml(Document document, Fields fields) {
    if (fields.title == null) {
      fields.title = firstNonBlank(
          meta(document, "meta[property=og:title]"),
          meta(document, "meta[name=twitter:title]"),
          document.title());
    }
    if (fields.authorName == null) {
      fields.authorName = meta(document, "meta[name=author]");
    }
    if (fields.published == null) {
      fields.published = Mf2Dates.parse(meta(document, "meta[property=article:published_time]"));
    }
    if (fields.content == null) {
      fields.content = meta(document, "meta[property=og:description]");
    }
  }

  /**
   * Collapses whitespace and truncates to {@code maxLength} characters.
   *
   * @param text      the text, may be {@code null}
   * @param maxLength the maximum length
   * @return the excerpt, or {@code null} for blank input
   */
  static String excerpt(String text, int maxLength) {
    if (text == null) {
      return null;
    }
    String collapsed = text.replaceAll("\\s+", " ").trim();
    if (collapsed.isEmpty()) {
      return null;
    }
    return collapsed.length() <= maxLength ? collapsed : collapsed.substring(0, maxLength).trim();
  }

  private static String meta(Document document, String selector) {
    Element el = document.selectFirst(selector);
    if (el == null) {
      return null;
    }
    String content = el.attr("content").trim();
    return content.isEmpty() ? null : content;
  }

  private static boolean sameText(String a, String b) {
    return b != null && a.replaceAll("\\s+", " ").trim().equals(b.replaceAll("\\s+", " ").trim());
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  private static void put(Map<String, String> metadata, String key, String value) {
    if (value != null && !value.isEmpty()) {
      metadata.put(key, value);
    }
  }

  private static final class Fields {
    String title;
    String content;
    String excerpt;
    Instant published;
    String authorName;
    String authorUrl;
    String authorPhoto;
  }
}
