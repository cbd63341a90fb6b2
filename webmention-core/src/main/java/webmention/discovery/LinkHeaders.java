package webmention.discovery;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads and writes HTTP {@code Link} header values (RFC 8288).
 *
 * <p>Parsing accepts several links per header separated by commas, quoted or unquoted
 * parameter values, and space-separated multi-valued {@code rel}. Commas inside the
 * {@code <...>} target or inside quoted strings do not split links.
 */
public final class LinkHeaders {

  /** The relation advertising a webmention endpoint. */
  public static final String WEBMENTION_REL = "webmention";

  /**
   * One parsed link: its raw (possibly relative) target and its relation types.
   */
  public record Link(String href, List<String> rels) {
    public Link {
      rels = List.copyOf(rels);
    }

    public boolean hasRel(String rel) {
      return rels.contains(rel.toLowerCase(Locale.ROOT));
    }
  }

  private LinkHeaders() {
  }

  /**
   * Parses every link of every given header value, in order.
   *
   * @param headerValues raw {@code Link} header values
   * @return the links; malformed entries are skipped
   */
  public static List<Link> parse(List<String> headerValues) {
    List<Link> links = new ArrayList<>();
    if (headerValues == null) {
      return links;
    }
    for (String value : headerValues) {
      if (value != null) {
        for (String part : splitLinks(value)) {
          Link link = parseLink(part);
          if (link != null) {
            links.add(link);
          }
        }
      }
    }
    return links;
  }

  /**
   * Returns the target of the first link with {@code rel} containing {@code webmention}.
   *
   * @param headerValues raw {@code Link} header values
   * @return the raw href, possibly relative or empty, or {@code null} if none
   */
  public static String findWebmention(List<String> headerValues) {
    for (Link link : parse(headerValues)) {
      if (link.hasRel(WEBMENTION_REL)) {
        return link.href();
      }
    }
    return null;
  }

  /**
   * Formats the header value that advertises an endpoint.
   *
   * @param endpoint the endpoint URL
   * @return e.g. {@code <https://example.com/webmention>; rel="webmention"}
   */
  public static String format(String endpoint) {
    Objects.requireNonNull(endpoint, "endpoint");
    return "<" + endpoint + ">; rel=\"" + WEBMENTION_REL + "\"";
  }

  /**
   * Appends the endpoint advertisement to an existing {@code Link} header value.
   *
   * @param existing the current value, may be {@code null} or blank
   * @param endpoint the endpoint URL
   * @return the combined value; unchanged if a webmention link is already present
   */
  public static String append(String existing, String endpoint) {
    if (existing == null || existing.isBlank()) {
      return format(endpoint);
    }
    if (findWebmention(List.of(existing)) != null) {
      return existing;
    }
    return existing + ", " + format(endpoint);
  }

  private static List<String> splitLinks(String value) {
    List<String> parts = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inTarget = false;
    boolean inQuotes = false;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (inQuotes) {
        if (c == '\\' && i + 1 < value.length()) {
          current.append(c).append(value.charAt(++i));
          continue;
        }
        if (c == '"') {
          inQuotes = false;
        }
      } else if (c == '"') {
        inQuotes = true;
      } else if (c == '<') {
        inTarget = true;
      } else if (c == '>') {
        inTarget = false;
      } else if (c == ',' && !inTarget) {
        parts.add(current.toString());
        current.setLength(0);
        continue;
      }
      current.append(c);
    }
    parts.add(current.toString());
    return parts;
  }

  private static Link parseLink(String part) {
    String trimmed = part.trim();
    int open = trimmed.indexOf('<');
    int close = trimmed.indexOf('>', open + 1);
    if (open != 0 || close < 0) {
      return null;
    }
    String href = trimmed.substring(1, close).trim();
    List<String> rels = new ArrayList<>();
    for (String param : splitParams(trimmed.substring(close + 1))) {
      int eq = param.indexOf('=');
      if (eq < 0) {
        continue;
      }
      String name = param.substring(0, eq).trim().toLowerCase(Locale.ROOT);
      if (!name.equals("rel")) {
        continue;
      }
      String relValue = unquote(param.substring(eq + 1).trim());
      Arrays.stream(relValue.split("\\s+"))
          .filter(r -> !r.isEmpty())
          .map(r -> r.toLowerCase(Locale.ROOT))
          .forEach(rels::add);
      break;
    }
    return new Link(href, rels);
  }

  private static List<String> splitParams(String params) {
    List<String> out = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inQuotes = false;
    for (int i = 0; i < params.length(); i++) {
      char c = params.charAt(i);
      if (c == '"') {
        inQuotes = !inQuotes;
      }
      if (c == ';' && !inQuotes) {
        out.add(current.toString());
        current.setLength(0);
      } else {
        current.append(c);
      }
    }
    out.add(current.toString());
    return out;
  }

  private static String unquote(String value) {
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return value.substring(1, value.length() - 1).replace("\\\"", "\"");
    }
    return value;
  }
}
