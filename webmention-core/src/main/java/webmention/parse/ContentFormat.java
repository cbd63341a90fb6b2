package webmention.parse;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text formats the content parser understands.
 */
public enum ContentFormat {
  PLAIN,
  MARKDOWN,
  HTML;

  private static final Pattern HTML_TAG = Pattern.compile("<\\s*/?\\s*[a-zA-Z][a-zA-Z0-9-]*(\\s[^>]*)?/?>");
  private static final Pattern MARKDOWN_SYNTAX = Pattern.compile(
      "(?m)^(#{1,6}\\s+.+|\\s*[-*+]\\s+.+|\\s*\\d+\\.\\s+.+|\\s*>\\s+.+)"
          + "|(```|`[^`]+`|\\*\\*[^*]+\\*\\*|\\[[^\\]]+\\]\\([^)]+\\)|<https?://[^>]+>)");

  /**
   * Maps an HTTP media type to a format.
   *
   * @param mediaType e.g. {@code text/html; charset=utf-8}
   * @return the format, or {@code null} if the type is absent or not a text format
   */
  public static ContentFormat fromMediaType(String mediaType) {
    if (mediaType == null) {
      return null;
    }
    String type = mediaType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return switch (type) {
      case "text/html", "application/xhtml+xml" -> HTML;
      case "text/markdown", "text/x-markdown" -> MARKDOWN;
      case "text/plain" -> PLAIN;
      default -> null;
    };
  }

  /**
   * Guesses the format from the shape of the text: any HTML tag means HTML, Markdown
   * block or inline syntax means Markdown, anything else is plain text.
   *
   * @param text the content, may be {@code null}
   * @return the detected format, never {@code null}
   */
  public static ContentFormat detect(String text) {
    if (text == null || text.isBlank()) {
      return PLAIN;
    }
    if (HTML_TAG.matcher(text).find()) {
      return HTML;
    }
    if (MARKDOWN_SYNTAX.matcher(text).find()) {
      return MARKDOWN;
    }
    return PLAIN;
  }
}
