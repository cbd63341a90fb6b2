package webmention.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Response of an {@link HttpTransport} call.
 *
 * <p>{@code url} is the final URL after redirects; relative links found in the
 * response are resolved against it. Header names are case-insensitive.
 */
public final class HttpResponse {
    private final String url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;

    public HttpResponse(String url, int statusCode, Map<String, List<String>> headers, String body) {
        this.url = Objects.requireNonNull(url, "url");
        this.statusCode = statusCode;
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null && values != null) {
                    copy.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values);
                }
            });
        }
        copy.replaceAll((name, values) -> List.copyOf(values));
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? "" : body;
    }

    public String url() {
        return url;
    }

    public int statusCode() {
        return statusCode;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    /**
     * Returns every value of a header, in the order received.
     *
     * @param name the header name (case-insensitive)
     * @return the values, empty if absent
     */
    public List<String> headers(String name) {
        return headers.getOrDefault(name, List.of());
    }

    /**
     * Returns the first value of a header.
     *
     * @param name the header name (case-insensitive)
     * @return the value, or {@code null} if absent
     */
    public String header(String name) {
        List<String> values = headers(name);
        return values.isEmpty() ? null : values.get(0);
    }

    public String body() {
        return body;
    }

    /**
     * Returns the media type of the {@code Content-Type} header without parameters, lower-cased.
     *
     * @return e.g. {@code "text/html"}, or {@code null} if the header is absent
     */
    public String mediaType() {
        String contentType = header("Content-Type");
        if (contentType == null) {
            return null;
        }
        int semi = contentType.indexOf(';');
        String type = semi >= 0 ? contentType.substring(0, semi) : contentType;
        type = type.trim().toLowerCase(Locale.ROOT);
        return type.isEmpty() ? null : type;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Returns {@code true} for 404 and 410, the answers that mean a resource was removed.
     *
     * @return whether the resource is gone
     */
    public boolean isGone() {
        return statusCode == 404 || statusCode == 410;
    }

    /**
     * Returns {@code true} for answers worth retrying later: 429 and every 5xx.
     *
     * @return whether the failure is transient
     */
    public boolean isTransientFailure() {
        return statusCode == 429 || statusCode >= 500;
    }

    @Override
    public String toString() {
        return "HttpResponse{url=" + url + ", status=" + statusCode + '}';
    }
}
