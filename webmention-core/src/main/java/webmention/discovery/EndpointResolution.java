package webmention.discovery;

import java.util.Objects;

/**
 * Outcome of endpoint discovery for one target.
 *
 * <ul>
 *   <li>{@link Found}: the endpoint to notify</li>
 *   <li>{@link Unsupported}: the target answered but advertises no endpoint; do not retry</li>
 *   <li>{@link Failed}: the target could not be reached or answered 5xx/429; retry later</li>
 * </ul>
 */
public sealed interface EndpointResolution
    permits EndpointResolution.Found, EndpointResolution.Unsupported, EndpointResolution.Failed {

  String target();

  record Found(String target, String endpoint) implements EndpointResolution {
    public Found {
      Objects.requireNonNull(target, "target");
      Objects.requireNonNull(endpoint, "endpoint");
    }
  }

  record Unsupported(String target, String reason) implements EndpointResolution {
  }

  record Failed(String target, Exception cause) implements EndpointResolution {
    public Failed {
      Objects.requireNonNull(cause, "cause");
    }
  }
}
