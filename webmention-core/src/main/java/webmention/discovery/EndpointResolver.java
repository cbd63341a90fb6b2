package webmention.discovery;

/**
 * Discovers the webmention endpoint of a target URL.
 *
 * <p>Implementations never throw for network problems; those are reported as
 * {@link EndpointResolution.Failed}.
 */
@FunctionalInterface
public interface EndpointResolver {

  /**
   * Resolves the endpoint of {@code target}.
   *
   * @param target absolute target URL
   * @return the outcome, never {@code null}
   */
  EndpointResolution resolve(String target);
}
