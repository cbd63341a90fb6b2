package webmention.incoming;

import webmention.InvalidMentionException;
import webmention.InvalidMentionException.Reason;
import webmention.ResolutionFailedException;
import webmention.callback.CallbackDispatcher;
import webmention.model.Webmention;
import webmention.model.WebmentionDirection;
import webmention.model.WebmentionStatus;
import webmention.parse.ContentFormat;
import webmention.parse.ContentParser;
import webmention.parse.ParsedContent;
import webmention.spi.HttpResponse;
import webmention.spi.HttpTransport;
import webmention.spi.HttpTransportException;
import webmention.spi.MetricsExporter;
import webmention.spi.WebmentionStore;
import webmention.util.Urls;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Verifies and records received notifications.
 *
 * <p>Validation (URLs present and well formed, no self-mention, target owned by this site,
 * source reachable and linking to the target) happens before anything is written: a
 * rejected notification leaves no record and fires no callback.
 *
 * <p>A source that stopped linking to the target, or answers 404/410, deletes the record
 * made for an earlier notification. New records get the configured initial status; an
 * existing record keeps its status, except a deleted one which is revived with the
 * initial status. Re-processing an unchanged source writes nothing.
 *
 * <p>Thread-safe.
 */
public final class IncomingHandler {
  private static final Logger logger = Logger.getLogger(IncomingHandler.class.getName());

  private final WebmentionStore store;
  private final HttpTransport transport;
  private final ContentParser parser;
  private final MentionMetadataExtractor extractor;
  private final CallbackDispatcher callbacks;
  private final MetricsExporter metrics;
  private final String baseUrl;
  private final WebmentionStatus initialStatus;

  private IncomingHandler(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.parser = builder.parser != null ? builder.parser : new ContentParser();
    this.extractor = builder.extractor != null ? builder.extractor : new MentionMetadataExtractor(240);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.callbacks = builder.callbacks != null
        ? builder.callbacks : new CallbackDispatcher(null, null, metrics);
    this.baseUrl = builder.baseUrl;
    this.initialStatus = builder.initialStatus != null ? builder.initialStatus : WebmentionStatus.CONFIRMED;
    if (initialStatus == WebmentionStatus.DELETED) {
      throw new IllegalArgumentException("initialStatus cannot be DELETED");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Processes a received notification.
   *
   * @param source the URL claiming to mention {@code target}
   * @param target the local URL being mentioned
   * @return what happened to the stored record
   * @throws InvalidMentionException   if the notification is rejected
   * @throws ResolutionFailedException if the source could not be fetched; safe to retry
   */
  public IncomingResult process(String source, String target) {
    validate(source, target);
    Optional<Webmention> existing = store.find(source, target, WebmentionDirection.IN);

    HttpResponse response;
    try {
      response = transport.fetch(source);
    } catch (HttpTransportException e) {
      throw new ResolutionFailedException(source, "Could not fetch source " + source, e);
    }
    if (response.isGone()) {
      return removed(existing, source, target, Reason.SOURCE_GONE,
          "Source answered HTTP " + response.statusCode());
    }
    if (response.isTransientFailure()) {
      throw new ResolutionFailedException(source, response.statusCode());
    }
    if (!response.isSuccess()) {
      throw reject(Reason.SOURCE_REJECTED, source, target, "Source answered HTTP " + response.statusCode());
    }

    ParsedContent parsed = parser.parse(response.body(),
        ContentFormat.fromMediaType(response.mediaType()), response.url());
    if (!parsed.references(target)) {
      return removed(existing, source, target, Reason.TARGET_NOT_LINKED,
          "Source does not link to " + target);
    }

    Instant now = Instant.now();
    Webmention previous = existing.orElse(null);
    WebmentionStatus status = previous == null || previous.status() == WebmentionStatus.DELETED
        ? initialStatus : previous.status();
    Webmention candidate = extractor.extract(source, target, parsed)
        .status(status)
        .createdAt(previous != null ? previous.createdAt() : now)
        .updatedAt(previous != null && now.isBefore(previous.createdAt()) ? previous.createdAt() : now)
        .build();

    if (previous != null && candidate.sameContent(previous)) {
      metrics.incrementIncomingUnchanged();
      logger.fine(() -> "Mention from " + source + " to " + target + " unchanged");
      return new IncomingResult(IncomingResult.Outcome.UNCHANGED, previous);
    }

    store.store(candidate);
    metrics.incrementIncomingAccepted();
    logger.info(() -> "Accepted " + candidate.mentionType() + " from " + source + " to " + target
        + " as " + candidate.status());
    callbacks.processed(candidate);
    return new IncomingResult(previous == null
        ? IncomingResult.Outcome.CREATED : IncomingResult.Outcome.UPDATED, candidate);
  }

  private void validate(String source, String target) {
    if (source == null || source.isBlank() || target == null || target.isBlank()) {
      throw reject(Reason.MISSING_URL, source, target, "Missing source or target URL");
    }
    if (!Urls.isHttpUrl(source) || !Urls.isHttpUrl(target)) {
      throw reject(Reason.MALFORMED_URL, source, target, "Source and target must be absolute http(s) URLs");
    }
    if (source.equals(target) || Urls.sameResource(source, target)) {
      throw reject(Reason.SELF_MENTION, source, target, "Source and target are the same resource");
    }
    if (baseUrl != null && !Urls.isUnder(baseUrl, target)) {
      throw reject(Reason.TARGET_NOT_OWNED, source, target, "Target is not under " + baseUrl);
    }
  }

  /**
   * The source no longer backs the mention: delete what an earlier notification recorded,
   * or reject a first-time claim.
   */
  private IncomingResult removed(Optional<Webmention> existing, String source, String target,
      Reason reason, String message) {
    if (existing.isEmpty()) {
      throw reject(reason, source, target, message);
    }
    Webmention previous = existing.get();
    if (previous.status() == WebmentionStatus.DELETED) {
      metrics.incrementIncomingUnchanged();
      return new IncomingResult(IncomingResult.Outcome.UNCHANGED, previous);
    }
    store.delete(source, target, WebmentionDirection.IN);
    Webmention deleted = previous.withStatus(WebmentionStatus.DELETED, Instant.now());
    metrics.incrementIncomingDeleted();
    logger.info(() -> "Deleted mention from " + source + " to " + target + ": " + message);
    callbacks.deleted(deleted);
    return new IncomingResult(IncomingResult.Outcome.DELETED, deleted);
  }

  private InvalidMentionException reject(Reason reason, String source, String target, String message) {
    metrics.incrementIncomingRejected();
    logger.fine(() -> "Rejected mention from " + source + " to " + target + " (" + reason + "): " + message);
    return new InvalidMentionException(reason, source, target, message);
  }

  public static final class Builder {
    private WebmentionStore store;
    private HttpTransport transport;
    private ContentParser parser;
    private MentionMetadataExtractor extractor;
    private CallbackDispatcher callbacks;
    private MetricsExporter metrics;
    private String baseUrl;
    private WebmentionStatus initialStatus;

    private Builder() {}

    /**
     * Sets the store receiving accepted mentions.
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
     * Sets the transport used to fetch sources.
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

    public Builder parser(ContentParser parser) {
      this.parser = parser;
      return this;
    }

    /**
     * Sets the metadata extractor.
     *
     * <p>Optional. Defaults to one producing 240-character excerpts.
     *
     * @param extractor the extractor
     * @return this builder
     */
    public Builder extractor(MentionMetadataExtractor extractor) {
      this.extractor = extractor;
      return this;
    }

    public Builder callbacks(CallbackDispatcher callbacks) {
      this.callbacks = callbacks;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Restricts accepted targets to URLs under this root.
     *
     * <p>Optional. Defaults to {@code null}: any target is accepted.
     *
     * @param baseUrl the site root
     * @return this builder
     */
    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    /**
     * Sets the status of newly accepted mentions.
     *
     * <p>Optional. Defaults to {@link WebmentionStatus#CONFIRMED}.
     *
     * @param initialStatus {@code PENDING} or {@code CONFIRMED}
     * @return this builder
     */
    public Builder initialStatus(WebmentionStatus initialStatus) {
      this.initialStatus = initialStatus;
      return this;
    }

    public IncomingHandler build() {
      return new IncomingHandler(this);
    }
  }
}
