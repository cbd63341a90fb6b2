package webmention;

import java.util.Objects;

/**
 * A notification or a send request was rejected before anything was persisted.
 *
 * <p>Never retried: the same input will be rejected again until the source or
 * target changes. The {@link #reason()} tells the receiving endpoint which
 * structured error to answer with.
 */
public final class InvalidMentionException extends WebmentionException {

  /**
   * Why a mention was rejected.
   */
  public enum Reason {
    /** {@code source} or {@code target} is missing or blank. */
    MISSING_URL,
    /** A URL is not an absolute http(s) URL. */
    MALFORMED_URL,
    /** {@code source} and {@code target} are the same resource. */
    SELF_MENTION,
    /** {@code target} is not under the configured base URL. */
    TARGET_NOT_OWNED,
    /** The source answered 404 or 410 and nothing was recorded for it. */
    SOURCE_GONE,
    /** The source does not link to the target. */
    TARGET_NOT_LINKED,
    /** The source answered with a non-success status other than 404/410. */
    SOURCE_REJECTED
  }

  private final Reason reason;
  private final String source;
  private final String target;

  public InvalidMentionException(Reason reason, String source, String target, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.source = source;
    this.target = target;
  }

  public Reason reason() {
    return reason;
  }

  public String source() {
    return source;
  }

  public String target() {
    return target;
  }
}
