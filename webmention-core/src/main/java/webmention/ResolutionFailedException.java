package webmention;

/**
 * A network call made on behalf of a mention failed in a way that may succeed later:
 * connection or TLS errors, timeouts, HTTP 5xx and 429 answers.
 *
 * <p>Distinct from a target that does not accept mentions, which is a normal outcome
 * and not an exception. Callers may retry.
 */
public final class ResolutionFailedException extends WebmentionException {

  private final String url;
  private final int statusCode;

  public ResolutionFailedException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
    this.statusCode = -1;
  }

  public ResolutionFailedException(String url, int statusCode) {
    super("HTTP " + statusCode + " from " + url);
    this.url = url;
    this.statusCode = statusCode;
  }

  public String url() {
    return url;
  }

  /**
   * Returns the HTTP status that caused the failure.
   *
   * @return the status code, or {@code -1} when no response was received
   */
  public int statusCode() {
    return statusCode;
  }
}
