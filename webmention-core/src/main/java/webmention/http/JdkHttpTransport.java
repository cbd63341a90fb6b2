package webmention.http;

import webmention.spi.HttpResponse;
import webmention.spi.HttpTimeoutException;
import webmention.spi.HttpTransport;
import webmention.spi.HttpTransportException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link HttpTransport} on top of the JDK {@link HttpClient}. Follows redirects (except
 * HTTPS to HTTP), applies one timeout to every request and sends a fixed {@code User-Agent}.
 */
public final class JdkHttpTransport implements HttpTransport {
  private static final String ACCEPT =
      "text/html, application/xhtml+xml;q=0.9, text/markdown;q=0.8, text/plain;q=0.7, */*;q=0.1";

  private final HttpClient httpClient;
  private final Duration timeout;
  private final String userAgent;

  public JdkHttpTransport(HttpClient httpClient, Duration timeout, String userAgent) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
  }

  /**
   * Creates a transport with its own client.
   *
   * @param timeout   connect and request timeout
   * @param userAgent the {@code User-Agent} header value
   * @return a new transport
   */
  public static JdkHttpTransport create(Duration timeout, String userAgent) {
    HttpClient client = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(timeout)
        .build();
    return new JdkHttpTransport(client, timeout, userAgent);
  }

  @Override
  public HttpResponse head(String url) throws HttpTransportException {
    HttpRequest request = request(url)
        .method("HEAD", HttpRequest.BodyPublishers.noBody())
        .build();
    java.net.http.HttpResponse<Void> response =
        send(request, java.net.http.HttpResponse.BodyHandlers.discarding());
    return new HttpResponse(response.uri().toString(), response.statusCode(),
        response.headers().map(), null);
  }

  @Override
  public HttpResponse fetch(String url) throws HttpTransportException {
    HttpRequest request = request(url)
        .header("Accept", ACCEPT)
        .GET()
        .build();
    return convert(send(request, java.net.http.HttpResponse.BodyHandlers.ofString()));
  }

  @Override
  public HttpResponse submitNotification(String endpoint, String source, String target)
      throws HttpTransportException {
    String form = "source=" + URLEncoder.encode(source, StandardCharsets.UTF_8)
        + "&target=" + URLEncoder.encode(target, StandardCharsets.UTF_8);
    HttpRequest request = request(endpoint)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
        .build();
    return convert(send(request, java.net.http.HttpResponse.BodyHandlers.ofString()));
  }

  private HttpRequest.Builder request(String url) throws HttpTransportException {
    try {
      return HttpRequest.newBuilder(URI.create(url))
          .timeout(timeout)
          .header("User-Agent", userAgent);
    } catch (IllegalArgumentException e) {
      throw new HttpTransportException("Invalid URL: " + url, e);
    }
  }

  private <T> java.net.http.HttpResponse<T> send(HttpRequest request,
      java.net.http.HttpResponse.BodyHandler<T> handler) throws HttpTransportException {
    try {
      return httpClient.send(request, handler);
    } catch (java.net.http.HttpTimeoutException e) {
      throw new HttpTimeoutException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HttpTransportException("Request interrupted", e);
    } catch (IOException | IllegalArgumentException e) {
      throw new HttpTransportException(request.method() + " " + request.uri() + " failed", e);
    }
  }

  private static HttpResponse convert(java.net.http.HttpResponse<String> response) {
    return new HttpResponse(response.uri().toString(), response.statusCode(),
        response.headers().map(), response.body());
  }
}
