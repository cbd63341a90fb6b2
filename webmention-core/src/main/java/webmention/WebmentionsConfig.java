package webmention;

import webmention.callback.MentionCallback;
import webmention.model.WebmentionStatus;

import java.time.Duration;
import java.util.Objects;

/**
 * Options shared by incoming and outgoing processing.
 */
public final class WebmentionsConfig {
  public static final String DEFAULT_USER_AGENT = "webmention-java/0.1 (+https://www.w3.org/TR/webmention/)";

  private WebmentionStatus initialMentionStatus = WebmentionStatus.CONFIRMED;
  private String baseUrl;
  private MentionCallback onMentionProcessed;
  private MentionCallback onMentionDeleted;
  private Duration httpTimeout = Duration.ofSeconds(10);
  private String userAgent = DEFAULT_USER_AGENT;
  private int outgoingConcurrency = 4;
  private boolean notifyOnRetraction = true;
  private int excerptLength = 240;

  public WebmentionStatus getInitialMentionStatus() {
    return initialMentionStatus;
  }

  /**
   * Status given to newly received mentions. Use {@link WebmentionStatus#PENDING} to
   * hold them for moderation.
   */
  public WebmentionsConfig setInitialMentionStatus(WebmentionStatus initialMentionStatus) {
    Objects.requireNonNull(initialMentionStatus, "initialMentionStatus");
    if (initialMentionStatus == WebmentionStatus.DELETED) {
      throw new IllegalArgumentException("initialMentionStatus cannot be DELETED");
    }
    this.initialMentionStatus = initialMentionStatus;
    return this;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  /**
   * Root under which every local resource lives. Received mentions whose target is not
   * under it are rejected. {@code null} accepts any target.
   */
  public WebmentionsConfig setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
    return this;
  }

  public MentionCallback getOnMentionProcessed() {
    return onMentionProcessed;
  }

  public WebmentionsConfig setOnMentionProcessed(MentionCallback onMentionProcessed) {
    this.onMentionProcessed = onMentionProcessed;
    return this;
  }

  public MentionCallback getOnMentionDeleted() {
    return onMentionDeleted;
  }

  public WebmentionsConfig setOnMentionDeleted(MentionCallback onMentionDeleted) {
    this.onMentionDeleted = onMentionDeleted;
    return this;
  }

  public Duration getHttpTimeout() {
    return httpTimeout;
  }

  public WebmentionsConfig setHttpTimeout(Duration httpTimeout) {
    Objects.requireNonNull(httpTimeout, "httpTimeout");
    if (httpTimeout.isZero() || httpTimeout.isNegative()) {
      throw new IllegalArgumentException("httpTimeout must be positive");
    }
    this.httpTimeout = httpTimeout;
    return this;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public WebmentionsConfig setUserAgent(String userAgent) {
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    return this;
  }

  public int getOutgoingConcurrency() {
    return outgoingConcurrency;
  }

  /**
   * Upper bound on targets resolved and notified in parallel within one outgoing run.
   */
  public WebmentionsConfig setOutgoingConcurrency(int outgoingConcurrency) {
    if (outgoingConcurrency < 1) {
      throw new IllegalArgumentException("outgoingConcurrency must be >= 1");
    }
    this.outgoingConcurrency = outgoingConcurrency;
    return this;
  }

  public boolean isNotifyOnRetraction() {
    return notifyOnRetraction;
  }

  /**
   * Whether a retracted target's endpoint is notified again so it can notice the removal.
   */
  public WebmentionsConfig setNotifyOnRetraction(boolean notifyOnRetraction) {
    this.notifyOnRetraction = notifyOnRetraction;
    return this;
  }

  public int getExcerptLength() {
    return excerptLength;
  }

  public WebmentionsConfig setExcerptLength(int excerptLength) {
    if (excerptLength < 1) {
      throw new IllegalArgumentException("excerptLength must be >= 1");
    }
    this.excerptLength = excerptLength;
    return this;
  }
}
