package webmention;

/**
 * Root of the unchecked exceptions raised by protocol processing.
 *
 * @see InvalidMentionException
 * @see ResolutionFailedException
 */
public class WebmentionException extends RuntimeException {

  public WebmentionException(String message) {
    super(message);
  }

  public WebmentionException(String message, Throwable cause) {
    super(message, cause);
  }
}
