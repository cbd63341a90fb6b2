package webmention.jdbc;

import webmention.WebmentionException;

/**
 * Thrown when a JDBC statement against the mention table fails.
 * Always carries the underlying {@link java.sql.SQLException} as its cause.
 */
public class WebmentionStoreException extends WebmentionException {

  public WebmentionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
