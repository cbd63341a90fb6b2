package webmention.spi;

/**
 * An HTTP exchange exceeded its configured timeout.
 * Lets callers tell a slow endpoint apart from an unreachable one.
 */
public class HttpTimeoutException extends HttpTransportException {

    public HttpTimeoutException(String message) {
        super(message);
    }

    public HttpTimeoutException(Throwable cause) {
        super(cause);
    }
}
