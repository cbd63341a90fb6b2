package webmention;

import webmention.callback.CallbackDispatcher;
import webmention.discovery.EndpointResolver;
import webmention.discovery.HttpEndpointResolver;
import webmention.discovery.LinkHeaders;
import webmention.http.JdkHttpTransport;
import webmention.incoming.IncomingHandler;
import webmention.incoming.IncomingResult;
import webmention.incoming.MentionMetadataExtractor;
import webmention.model.Webmention;
import webmention.model.WebmentionDirection;
import webmention.outgoing.OutgoingProcessor;
import webmention.outgoing.OutgoingReport;
import webmention.parse.ContentFormat;
import webmention.parse.ContentParser;
import webmention.spi.HttpTransport;
import webmention.spi.MetricsExporter;
import webmention.spi.WebmentionStore;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires an {@link IncomingHandler} and an {@link OutgoingProcessor}
 * over one store, transport and configuration into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Webmentions webmentions = Webmentions.builder()
 *     .store(store)
 *     .config(new WebmentionsConfig()
 *         .setBaseUrl("https://example.com/")
 *         .setOnMentionProcessed(m -> log.info(m.toString())))
 *     .build()) {
 *   webmentions.processIncoming(source, target);       // from the receiving endpoint
 *   webmentions.processOutgoing("https://example.com/post/1");  // after publishing
 * }
 * }</pre>
 *
 * @see IncomingHandler
 * @see OutgoingProcessor
 */
public final class Webmentions implements AutoCloseable {

  private final WebmentionStore store;
  private final IncomingHandler incoming;
  private final OutgoingProcessor outgoing;
  private final MetricsExporter metrics;

  private Webmentions(WebmentionStore store, IncomingHandler incoming, OutgoingProcessor outgoing,
      MetricsExporter metrics) {
    this.store = store;
    this.incoming = incoming;
    this.outgoing = outgoing;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Processes a notification received by the site's webmention endpoint.
   *
   * @param source the {@code source} form parameter
   * @param target the {@code target} form parameter
   * @return what happened to the stored record
   * @throws InvalidMentionException    if the notification is rejected; answer 400
   * @throws ResolutionFailedException  if the source could not be fetched; answer 5xx or retry
   */
  public IncomingResult processIncoming(String source, String target) {
    return incoming.process(source, target);
  }

  /**
   * Fetches a local resource and announces or retracts its links.
   *
   * @param sourceUrl the local resource URL
   * @return the outcome per target
   */
  public OutgoingReport processOutgoing(String sourceUrl) {
    return outgoing.process(sourceUrl);
  }

  /**
   * Announces or retracts the links of a local resource whose content is already at hand.
   * Pass an empty {@code text} to retract everything sent for the resource.
   *
   * @param sourceUrl the local resource URL
   * @param text      the content, or {@code null} to fetch it
   * @param format    the content format, or {@code null} to infer it
   * @return the outcome per target
   */
  public OutgoingReport processOutgoing(String sourceUrl, String text, ContentFormat format) {
    return outgoing.process(sourceUrl, text, format);
  }

  /**
   * Returns the confirmed mentions of a resource, for display.
   *
   * @param resource  the local resource URL
   * @param direction {@code IN} for mentions received by it, {@code OUT} for mentions it sent
   * @return confirmed mentions, oldest first
   */
  public List<Webmention> retrieve(String resource, WebmentionDirection direction) {
    return store.retrieve(resource, direction);
  }

  public WebmentionStore store() {
    return store;
  }

  /**
   * Returns the {@code Link} header value that advertises {@code endpoint} on local pages.
   *
   * @param endpoint the public URL of the receiving endpoint
   * @return the header value
   */
  public static String linkHeader(String endpoint) {
    return LinkHeaders.format(endpoint);
  }

  /**
   * Stops the outgoing workers, then closes the metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      outgoing.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new WebmentionException("Closing metrics failed", e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link Webmentions}. Single use.
   */
  public static final class Builder {
    private WebmentionStore store;
    private HttpTransport transport;
    private EndpointResolver resolver;
    private MetricsExporter metrics;
    private WebmentionsConfig config;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the store for received and sent mentions.
     *
     * <p><b>Required.</b>
     *
     * @param store the persistence backend
     * @return this builder
     */
    public Builder store(WebmentionStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the HTTP transport.
     *
     * <p>Optional. Defaults to a {@link JdkHttpTransport} using the configured timeout
     * and user agent.
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the endpoint resolver used for outgoing mentions.
     *
     * <p>Optional. Defaults to an {@link HttpEndpointResolver} over the transport.
     *
     * @param resolver the resolver
     * @return this builder
     */
    public Builder resolver(EndpointResolver resolver) {
      this.resolver = resolver;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Closed together with the
     * facade when it implements {@link AutoCloseable}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the options.
     *
     * <p>Optional. Defaults to {@code new WebmentionsConfig()}.
     *
     * @param config the options
     * @return this builder
     */
    public Builder config(WebmentionsConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Builds the facade.
     *
     * @return a new instance
     * @throws IllegalStateException if called twice
     * @throws NullPointerException  if no store was set
     */
    public Webmentions build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(store, "store");
      WebmentionsConfig cfg = config != null ? config : new WebmentionsConfig();
      MetricsExporter m = metrics != null ? metrics : MetricsExporter.NOOP;
      HttpTransport t = transport != null
          ? transport : JdkHttpTransport.create(cfg.getHttpTimeout(), cfg.getUserAgent());
      ContentParser parser = new ContentParser();
      CallbackDispatcher callbacks =
          new CallbackDispatcher(cfg.getOnMentionProcessed(), cfg.getOnMentionDeleted(), m);

      IncomingHandler incoming = IncomingHandler.builder()
          .store(store)
          .transport(t)
          .parser(parser)
          .extractor(new MentionMetadataExtractor(cfg.getExcerptLength()))
          .callbacks(callbacks)
          .metrics(m)
          .baseUrl(cfg.getBaseUrl())
          .initialStatus(cfg.getInitialMentionStatus())
          .build();
      OutgoingProcessor outgoing = OutgoingProcessor.builder()
          .store(store)
          .transport(t)
          .resolver(resolver != null ? resolver : new HttpEndpointResolver(t))
          .parser(parser)
          .callbacks(callbacks)
          .metrics(m)
          .concurrency(cfg.getOutgoingConcurrency())
          .notifyOnRetraction(cfg.isNotifyOnRetraction())
          .build();
      return new Webmentions(store, incoming, outgoing, m);
    }
  }
}
