package webmention.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes mention metadata as a flat JSON object of string values, the form it is
 * stored in by relational backends. Nested values are not supported; {@code null}
 * values are dropped on read.
 */
public final class MetadataJson {

  private MetadataJson() {
  }

  /**
   * Encodes a metadata map.
   *
   * @param metadata the map, may be {@code null}
   * @return the JSON text, or {@code null} for an empty map
   */
  public static String write(Map<String, String> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<String, String> entry : metadata.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("metadata cannot contain null keys");
      }
      if (sb.length() > 1) {
        sb.append(',');
      }
      quote(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        quote(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  /**
   * Decodes a metadata map.
   *
   * @param json the JSON text, may be {@code null} or blank
   * @return an unmodifiable map, empty for {@code null}
   * @throws IllegalArgumentException if the text is not a flat object of strings
   */
  public static Map<String, String> read(String json) {
    if (json == null || json.isBlank() || json.trim().equals("null")) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new Reader(json).object());
  }

  private static void quote(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  private static final class Reader {
    private final String text;
    private int pos;

    Reader(String text) {
      this.text = text;
    }

    Map<String, String> object() {
      expect('{');
      Map<String, String> result = new LinkedHashMap<>();
      if (peek() == '}') {
        pos++;
        return result;
      }
      while (true) {
        String key = string();
        expect(':');
        if (text.startsWith("null", skip())) {
          pos += 4;
        } else {
          result.put(key, string());
        }
        char next = next();
        if (next == '}') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at " + (pos - 1));
        }
      }
    }

    private String string() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < text.length()) {
        char c = text.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= text.length()) {
          break;
        }
        char escaped = text.charAt(pos++);
        switch (escaped) {
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'u' -> {
            if (pos + 4 > text.length()) {
              throw new IllegalArgumentException("Truncated unicode escape");
            }
            sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
            pos += 4;
          }
          default -> sb.append(escaped);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private void expect(char c) {
      if (next() != c) {
        throw new IllegalArgumentException("Expected '" + c + "' at " + (pos - 1));
      }
    }

    private char next() {
      skip();
      if (pos >= text.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return text.charAt(pos++);
    }

    private char peek() {
      skip();
      return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private int skip() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
      return pos;
    }
  }
}
