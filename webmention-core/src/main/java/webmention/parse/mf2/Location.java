package webmention.parse.mf2;

/**
 * Value of an entry's {@code location}: a plain string, or an {@code h-card},
 * {@code h-adr} or {@code h-geo}.
 */
public record Location(String type, String name, String url, String latitude, String longitude) {
}
