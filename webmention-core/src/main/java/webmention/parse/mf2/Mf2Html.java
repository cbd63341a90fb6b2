package webmention.parse.mf2;

/**
 * Value of an {@code e-*} property: the element's text and its inner HTML.
 */
public record Mf2Html(String text, String html) {
}
