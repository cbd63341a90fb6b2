package webmention.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * URL checks and normalisation shared by parsing, discovery and validation.
 *
 * <p>All methods are lenient: malformed input yields {@code null} or {@code false},
 * never an exception.
 */
public final class Urls {

  private Urls() {
  }

  /**
   * Returns {@code true} for an absolute {@code http} or {@code https} URL with a host.
   *
   * @param url the candidate, may be {@code null}
   * @return whether the URL can be fetched
   */
  public static boolean isHttpUrl(String url) {
    URI uri = parse(url);
    if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
      return false;
    }
    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    return scheme.equals("http") || scheme.equals("https");
  }

  /**
   * Resolves {@code href} against {@code base}. An empty href resolves to the base itself.
   *
   * @param base absolute base URL
   * @param href absolute or relative reference
   * @return the absolute URL, or {@code null} if either part is malformed
   */
  public static String resolve(String base, String href) {
    if (href == null) {
      return null;
    }
    String ref = href.trim();
    URI baseUri = parse(base);
    if (ref.isEmpty()) {
      return baseUri == null ? null : baseUri.toString();
    }
    URI refUri = parse(ref);
    if (refUri == null) {
      return null;
    }
    if (refUri.isAbsolute()) {
      return refUri.toString();
    }
    if (baseUri == null || !baseUri.isAbsolute()) {
      return null;
    }
    try {
      if (baseUri.getRawPath() == null || baseUri.getRawPath().isEmpty()) {
        baseUri = baseUri.resolve("/");
      }
      return baseUri.resolve(refUri).toString();
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  /**
   * Normalises a URL for identity comparisons: lower-case scheme and host, default port
   * removed, empty path replaced by {@code /}, fragment dropped.
   *
   * @param url an absolute URL
   * @return the normalised URL, or {@code null} if not an absolute http(s) URL
   */
  public static String normalize(String url) {
    if (!isHttpUrl(url)) {
      return null;
    }
    URI uri = parse(url);
    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    String host = uri.getHost().toLowerCase(Locale.ROOT);
    int port = uri.getPort();
    if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
      port = -1;
    }
    String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
    StringBuilder sb = new StringBuilder(scheme).append("://");
    if (uri.getRawUserInfo() != null) {
      sb.append(uri.getRawUserInfo()).append('@');
    }
    sb.append(host);
    if (port != -1) {
      sb.append(':').append(port);
    }
    sb.append(path);
    if (uri.getRawQuery() != null) {
      sb.append('?').append(uri.getRawQuery());
    }
    return sb.toString();
  }

  /**
   * Returns {@code true} if both URLs identify the same resource after normalisation.
   *
   * @param a first URL
   * @param b second URL
   * @return whether they are the same resource
   */
  public static boolean sameResource(String a, String b) {
    String na = normalize(a);
    return na != null && na.equals(normalize(b));
  }

  /**
   * Returns {@code true} if {@code url} lives under {@code baseUrl}: same host and
   * non-default port, either scheme, and a path that starts with the base path.
   *
   * @param baseUrl the site root, e.g. {@code https://example.com/blog/}
   * @param url     the URL to check
   * @return whether the URL is owned by the site
   */
  public static boolean isUnder(String baseUrl, String url) {
    String base = normalize(baseUrl);
    String candidate = normalize(url);
    if (base == null || candidate == null) {
      return false;
    }
    URI b = URI.create(base);
    URI c = URI.create(candidate);
    if (!b.getHost().equals(c.getHost()) || b.getPort() != c.getPort()) {
      return false;
    }
    String basePath = b.getRawPath();
    if (!basePath.endsWith("/")) {
      basePath = basePath + "/";
    }
    String path = c.getRawPath().endsWith("/") ? c.getRawPath() : c.getRawPath() + "/";
    return path.startsWith(basePath);
  }

  private static URI parse(String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    try {
      return new URI(url.trim());
    } catch (URISyntaxException e) {
      return null;
    }
  }
}
