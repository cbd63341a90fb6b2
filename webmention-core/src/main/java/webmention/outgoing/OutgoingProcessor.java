package webmention.outgoing;

import webmention.InvalidMentionException;
import webmention.ResolutionFailedException;
import webmention.WebmentionException;
import webmention.callback.CallbackDispatcher;
import webmention.discovery.EndpointResolution;
import webmention.discovery.EndpointResolver;
import webmention.discovery.HttpEndpointResolver;
import webmention.model.Webmention;
import webmention.model.WebmentionDirection;
import webmention.model.WebmentionStatus;
import webmention.parse.ContentFormat;
import webmention.parse.ContentParser;
import webmention.spi.HttpResponse;
import webmention.spi.HttpTransport;
import webmention.spi.HttpTransportException;
import webmention.spi.MetricsExporter;
import webmention.spi.WebmentionStore;
import webmention.util.DaemonThreadFactory;
import webmention.util.Urls;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Announces the links of a local resource and retracts the ones that disappeared.
 *
 * <p>Each run diffs the links currently in the source against the {@code OUT} mentions
 * recorded for it: new targets are resolved and notified, vanished targets are marked
 * deleted, targets present on both sides are left alone. Runs for the same source are
 * serialised; targets within a run are handled in parallel, bounded by the worker count.
 *
 * <p>A target is recorded only after its endpoint accepted the notification. Retraction
 * updates local state first and notifies best-effort afterwards. Storage failures
 * propagate to the caller; callback failures never do.
 *
 * <p>Create instances via {@link #builder()}. Thread-safe; {@link #close()} stops the workers.
 */
public final class OutgoingProcessor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OutgoingProcessor.class.getName());

  private static final long CLOSE_TIMEOUT_SECONDS = 10;

  private final WebmentionStore store;
  private final HttpTransport transport;
  private final EndpointResolver resolver;
  private final ContentParser parser;
  private final CallbackDispatcher callbacks;
  private final MetricsExporter metrics;
  private final boolean notifyOnRetraction;
  private final ExecutorService workers;
  private final SourceLocks locks = new SourceLocks();

  private OutgoingProcessor(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.resolver = builder.resolver != null ? builder.resolver : new HttpEndpointResolver(transport);
    this.parser = builder.parser != null ? builder.parser : new ContentParser();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.callbacks = builder.callbacks != null
        ? builder.callbacks : new CallbackDispatcher(null, null, metrics);
    this.notifyOnRetraction = builder.notifyOnRetraction;
    if (builder.concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1");
    }
    this.workers = Executors.newFixedThreadPool(builder.concurrency,
        new DaemonThreadFactory("webmention-outgoing-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Fetches the source and processes its links.
   *
   * @param sourceUrl the local resource URL
   * @return what was sent, skipped, failed and retracted
   * @see #process(String, String, ContentFormat)
   */
  public OutgoingReport process(String sourceUrl) {
    return process(sourceUrl, null, null);
  }

  /**
   * Processes the links of a source.
   *
   * <p>An empty {@code text} has no links and therefore retracts everything previously
   * sent for the source.
   *
   * @param sourceUrl the local resource URL
   * @param text      the current content, or {@code null} to fetch {@code sourceUrl}
   * @param format    the content format, or {@code null} to infer it
   * @return what was sent, skipped, failed and retracted
   * @throws InvalidMentionException    if the source URL is missing or not http(s), or the
   *                                    fetched source answered with a non-transient error
   * @throws ResolutionFailedException  if the source could not be fetched
   */
  public OutgoingReport process(String sourceUrl, String text, ContentFormat format) {
    if (sourceUrl == null || sourceUrl.isBlank()) {
      throw new InvalidMentionException(InvalidMentionException.Reason.MISSING_URL, sourceUrl, null,
          "Missing source URL");
    }
    if (!Urls.isHttpUrl(sourceUrl)) {
      throw new InvalidMentionException(InvalidMentionException.Reason.MALFORMED_URL, sourceUrl, null,
          "Source is not an absolute http(s) URL: " + sourceUrl);
    }
    long start = System.nanoTime();
    try {
      return locks.withLock(Urls.normalize(sourceUrl), () -> run(sourceUrl, text, format));
    } finally {
      metrics.recordOutgoingDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
  }

  private OutgoingReport run(String source, String text, ContentFormat format) {
    // keyed by normalised URL, valued by the target as spelled in the source
    Map<String, String> current = currentTargets(source, text, format);

    Map<String, Webmention> previous = new LinkedHashMap<>();
    for (Webmention mention : store.retrieve(source, WebmentionDirection.OUT)) {
      previous.put(targetKey(mention.target()), mention);
    }

    List<String> toSend = new ArrayList<>();
    List<String> unchanged = new ArrayList<>();
    current.forEach((key, target) -> {
      if (previous.containsKey(key)) {
        unchanged.add(previous.get(key).target());
      } else {
        toSend.add(target);
      }
    });
    List<Webmention> toRetract = new ArrayList<>();
    previous.forEach((key, mention) -> {
      if (!current.containsKey(key)) {
        toRetract.add(mention);
      }
    });

    List<String> retracted = new ArrayList<>();
    for (Webmention mention : toRetract) {
      store.delete(mention.source(), mention.target(), WebmentionDirection.OUT);
      retracted.add(mention.target());
      metrics.incrementOutgoingRetracted();
      logger.info(() -> "Retracted mention of " + mention.target() + " from " + source);
      callbacks.deleted(mention.withStatus(WebmentionStatus.DELETED, Instant.now()));
    }

    List<Future<TargetOutcome>> pending = new ArrayList<>();
    for (String target : toSend) {
      pending.add(workers.submit(() -> send(source, target)));
    }
    if (notifyOnRetraction) {
      for (String target : retracted) {
        pending.add(workers.submit(() -> notifyRetraction(source, target)));
      }
    }

    List<String> sent = new ArrayList<>();
    List<String> unsupported = new ArrayList<>();
    Map<String, Exception> failed = new LinkedHashMap<>();
    RuntimeException storageFailure = null;
    for (Future<TargetOutcome> future : pending) {
      TargetOutcome outcome;
      try {
        outcome = future.get();
      } catch (InterruptedException e) {
        pending.forEach(f -> f.cancel(true));
        Thread.currentThread().interrupt();
        throw new WebmentionException("Interrupted while processing " + source, e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error error) {
          throw error;
        }
        RuntimeException failure = cause instanceof RuntimeException re
            ? re : new WebmentionException("Outgoing task failed", cause);
        if (storageFailure == null) {
          storageFailure = failure;
        } else {
          storageFailure.addSuppressed(failure);
        }
        continue;
      }
      switch (outcome.kind()) {
        case SENT -> sent.add(outcome.target());
        case UNSUPPORTED -> unsupported.add(outcome.target());
        case FAILED -> failed.put(outcome.target(), outcome.cause());
        case RETRACTION_NOTIFIED -> {
        }
      }
    }
    if (storageFailure != null) {
      throw storageFailure;
    }
    return new OutgoingReport(source, sent, unsupported, failed, retracted, unchanged);
  }

  private Map<String, String> currentTargets(String source, String text, ContentFormat format) {
    String body = text;
    ContentFormat effective = format;
    if (body == null) {
      HttpResponse response;
      try {
        response = transport.fetch(source);
      } catch (HttpTransportException e) {
        throw new ResolutionFailedException(source, "Could not fetch source " + source, e);
      }
      if (response.isGone()) {
        logger.info(() -> "Source " + source + " is gone; retracting its mentions");
        return Map.of();
      }
      if (response.isTransientFailure()) {
        throw new ResolutionFailedException(source, response.statusCode());
      }
      if (!response.isSuccess()) {
        throw new InvalidMentionException(InvalidMentionException.Reason.SOURCE_REJECTED, source, null,
            "Source answered HTTP " + response.statusCode());
      }
      body = response.body();
      if (effective == null) {
        effective = ContentFormat.fromMediaType(response.mediaType());
      }
    }
    Map<String, String> targets = new LinkedHashMap<>();
    for (String link : parser.extractLinks(body, effective, source)) {
      if (!Urls.sameResource(link, source)) {
        targets.putIfAbsent(targetKey(link), link);
      }
    }
    return targets;
  }

  private static String targetKey(String target) {
    String key = Urls.normalize(target);
    return key != null ? key : target;
  }

  private TargetOutcome send(String source, String target) {
    EndpointResolution resolution = resolver.resolve(target);
    if (resolution instanceof EndpointResolution.Unsupported unsupported) {
      metrics.incrementOutgoingUnsupported();
      logger.fine(() -> "Skipping " + target + ": " + unsupported.reason());
      return TargetOutcome.of(target, Kind.UNSUPPORTED);
    }
    if (resolution instanceof EndpointResolution.Failed failedResolution) {
      return failed(source, target, failedResolution.cause());
    }
    String endpoint = ((EndpointResolution.Found) resolution).endpoint();

    HttpResponse response;
    try {
      response = transport.submitNotification(endpoint, source, target);
    } catch (HttpTransportException e) {
      return failed(source, target,
          new ResolutionFailedException(endpoint, "Could not notify " + endpoint, e));
    }
    if (response.isTransientFailure()) {
      return failed(source, target, new ResolutionFailedException(endpoint, response.statusCode()));
    }
    if (!response.isSuccess()) {
      return failed(source, target,
          new WebmentionException("Endpoint " + endpoint + " rejected the notification: HTTP "
              + response.statusCode()));
    }

    Webmention mention = Webmention.builder(source, target, WebmentionDirection.OUT)
        .status(WebmentionStatus.CONFIRMED)
        .build();
    store.store(mention);
    metrics.incrementOutgoingSent();
    logger.info(() -> "Sent mention of " + target + " from " + source + " via " + endpoint);
    callbacks.processed(mention);
    return TargetOutcome.of(target, Kind.SENT);
  }

  private TargetOutcome notifyRetraction(String source, String target) {
    EndpointResolution resolution = resolver.resolve(target);
    if (resolution instanceof EndpointResolution.Found found) {
      try {
        HttpResponse response = transport.submitNotification(found.endpoint(), source, target);
        if (!response.isSuccess()) {
          logger.warning(() -> "Retraction notice for " + target + " answered HTTP " + response.statusCode());
        }
      } catch (HttpTransportException e) {
        logger.log(Level.WARNING, "Retraction notice for " + target + " could not be sent", e);
      }
    } else if (resolution instanceof EndpointResolution.Failed failed) {
      logger.log(Level.WARNING, "Retraction notice for " + target + " could not be sent", failed.cause());
    }
    return TargetOutcome.of(target, Kind.RETRACTION_NOTIFIED);
  }

  private TargetOutcome failed(String source, String target, Exception cause) {
    metrics.incrementOutgoingFailed();
    logger.log(Level.WARNING, "Could not send mention of " + target + " from " + source, cause);
    return new TargetOutcome(target, Kind.FAILED, cause);
  }

  /**
   * Stops the worker pool, waiting for running targets to finish.
   */
  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Outgoing workers did not finish in time; forcing shutdown");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private enum Kind {
    SENT,
    UNSUPPORTED,
    FAILED,
    RETRACTION_NOTIFIED
  }

  private record TargetOutcome(String target, Kind kind, Exception cause) {
    static TargetOutcome of(String target, Kind kind) {
      return new TargetOutcome(target, kind, null);
    }
  }

  public static final class Builder {
    private WebmentionStore store;
    private HttpTransport transport;
    private EndpointResolver resolver;
    private ContentParser parser;
    private CallbackDispatcher callbacks;
    private MetricsExporter metrics;
    private int concurrency = 4;
    private boolean notifyOnRetraction = true;

    private Builder() {}

    /**
     * Sets the store holding previously sent mentions.
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
     * Sets the transport used to fetch sources and submit notifications.
     *
     * <p><b>Required.</b>
     *
     * @param transport the HTTP transport
     * @return this builder
     */
    public Builder transport(HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the endpoint resolver.
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
     * Sets the content parser.
     *
     * <p>Optional. Defaults to a new {@link ContentParser}.
     *
     * @param parser the parser
     * @return this builder
     */
    public Builder parser(ContentParser parser) {
      this.parser = parser;
      return this;
    }

    /**
     * Sets the callback dispatcher.
     *
     * <p>Optional. Defaults to one without callbacks.
     *
     * @param callbacks the dispatcher
     * @return this builder
     */
    public Builder callbacks(CallbackDispatcher callbacks) {
      this.callbacks = callbacks;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the number of worker threads resolving and notifying targets.
     *
     * <p>Optional. Defaults to 4.
     *
     * @param concurrency the worker count, at least 1
     * @return this builder
     */
    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * Sets whether retracted targets are notified again.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param notifyOnRetraction whether to notify
     * @return this builder
     */
    public Builder notifyOnRetraction(boolean notifyOnRetraction) {
      this.notifyOnRetraction = notifyOnRetraction;
      return this;
    }

    public OutgoingProcessor build() {
      return new OutgoingProcessor(this);
    }
  }
}
