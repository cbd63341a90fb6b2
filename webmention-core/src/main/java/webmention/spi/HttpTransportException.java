package webmention.spi;

/**
 * An HTTP exchange could not be completed: connection refused, DNS or TLS failure,
 * interrupted call. Wraps the client library's own exception.
 */
public class HttpTransportException extends Exception {

    public HttpTransportException(String message) {
        super(message);
    }

    public HttpTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public HttpTransportException(Throwable cause) {
        super(cause);
    }
}
