package webmention.discovery;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import webmention.ResolutionFailedException;
import webmention.parse.ContentFormat;
import webmention.spi.HttpResponse;
import webmention.spi.HttpTransport;
import webmention.spi.HttpTransportException;
import webmention.util.Urls;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Endpoint discovery over HTTP.
 *
 * <ol>
 *   <li>{@code HEAD} the target; a {@code Link: <...>; rel="webmention"} header on a 2xx
 *       answer ends discovery.</li>
 *   <li>Otherwise {@code GET} the target and look at its {@code Link} header again, then at
 *       the first {@code <link>} or {@code <a>} element whose {@code rel} contains
 *       {@code webmention}. The header wins over the body.</li>
 * </ol>
 *
 * <p>Relative endpoints resolve against the final URL after redirects; an empty href
 * means the target itself. A GET failing with an exception, 5xx or 429 is a
 * {@link EndpointResolution.Failed}; any other non-2xx answer, or no endpoint at all,
 * is {@link EndpointResolution.Unsupported}.
 */
public final class HttpEndpointResolver implements EndpointResolver {
  private static final Logger logger = Logger.getLogger(HttpEndpointResolver.class.getName());

  private final HttpTransport transport;

  public HttpEndpointResolver(HttpTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  @Override
  public EndpointResolution resolve(String target) {
    if (!Urls.isHttpUrl(target)) {
      return new EndpointResolution.Unsupported(target, "not an http(s) URL");
    }

    HttpResponse head = probe(target);
    if (head != null && head.isSuccess()) {
      String endpoint = fromHeader(head);
      if (endpoint != null) {
        logger.fine(() -> "Endpoint for " + target + " found in HEAD Link header: " + endpoint);
        return new EndpointResolution.Found(target, endpoint);
      }
    }

    HttpResponse response;
    try {
      response = transport.fetch(target);
    } catch (HttpTransportException e) {
      return new EndpointResolution.Failed(target, e);
    }
    if (response.isTransientFailure()) {
      return new EndpointResolution.Failed(target,
          new ResolutionFailedException(target, response.statusCode()));
    }
    if (!response.isSuccess()) {
      return new EndpointResolution.Unsupported(target, "HTTP " + response.statusCode());
    }

    String endpoint = fromHeader(response);
    if (endpoint == null) {
      endpoint = fromBody(response);
    }
    if (endpoint == null) {
      logger.fine(() -> "No webmention endpoint advertised by " + target);
      return new EndpointResolution.Unsupported(target, "no endpoint advertised");
    }
    String found = endpoint;
    logger.fine(() -> "Endpoint for " + target + ": " + found);
    return new EndpointResolution.Found(target, endpoint);
  }

  private HttpResponse probe(String target) {
    try {
      return transport.head(target);
    } catch (HttpTransportException e) {
      logger.log(Level.FINE, "HEAD " + target + " failed, falling back to GET", e);
      return null;
    }
  }

  private static String fromHeader(HttpResponse response) {
    String href = LinkHeaders.findWebmention(response.headers("Link"));
    return usable(response.url(), href);
  }

  private static String fromBody(HttpResponse response) {
    String mediaType = response.mediaType();
    if (mediaType != null && ContentFormat.fromMediaType(mediaType) != ContentFormat.HTML) {
      return null;
    }
    Document document = Jsoup.parse(response.body(), response.url());
    for (Element el : document.select("link[rel][href], a[rel][href]")) {
      if (hasWebmentionRel(el.attr("rel"))) {
        return usable(response.url(), el.attr("href"));
      }
    }
    return null;
  }

  private static boolean hasWebmentionRel(String rel) {
    for (String token : rel.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
      if (token.equals(LinkHeaders.WEBMENTION_REL)) {
        return true;
      }
    }
    return false;
  }

  private static String usable(String baseUrl, String href) {
    if (href == null) {
      return null;
    }
    String resolved = Urls.resolve(baseUrl, href);
    return Urls.isHttpUrl(resolved) ? resolved : null;
  }
}
