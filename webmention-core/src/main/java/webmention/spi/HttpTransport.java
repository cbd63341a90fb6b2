package webmention.spi;

/**
 * The HTTP calls protocol processing needs.
 *
 * <p>Implementations follow redirects, apply a bounded timeout to every call and
 * never throw on a non-2xx answer: the status is reported in the {@link HttpResponse}.
 * They must be thread-safe.
 */
public interface HttpTransport {

    /**
     * Issues a {@code HEAD} request.
     *
     * @param url absolute URL
     * @return the response; its body is empty
     * @throws HttpTimeoutException   if the call timed out
     * @throws HttpTransportException if no response was received
     */
    HttpResponse head(String url) throws HttpTransportException;

    /**
     * Issues a {@code GET} request and reads the body as text.
     *
     * @param url absolute URL
     * @return the response
     * @throws HttpTimeoutException   if the call timed out
     * @throws HttpTransportException if no response was received
     */
    HttpResponse fetch(String url) throws HttpTransportException;

    /**
     * POSTs a form-encoded {@code source}/{@code target} pair to a webmention endpoint.
     *
     * @param endpoint the discovered endpoint URL
     * @param source   the mentioning URL
     * @param target   the mentioned URL
     * @return the endpoint's response
     * @throws HttpTimeoutException   if the call timed out
     * @throws HttpTransportException if no response was received
     */
    HttpResponse submitNotification(String endpoint, String source, String target)
            throws HttpTransportException;
}
