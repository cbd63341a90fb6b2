package webmention.callback;

import webmention.model.Webmention;
import webmention.spi.MetricsExporter;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invokes the optional "processed" and "deleted" callbacks with full failure isolation.
 *
 * <p>A throwing callback is logged at {@link Level#WARNING} with the mention's source,
 * target and direction and counted through {@link MetricsExporter#incrementCallbackFailure()}.
 * Nothing is rethrown. {@link Error}s are not caught.
 */
public final class CallbackDispatcher {
  private static final Logger logger = Logger.getLogger(CallbackDispatcher.class.getName());

  private final MentionCallback onProcessed;
  private final MentionCallback onDeleted;
  private final MetricsExporter metrics;

  /**
   * Creates a dispatcher.
   *
   * @param onProcessed called after a mention is created or updated; may be {@code null}
   * @param onDeleted   called after a mention is marked deleted; may be {@code null}
   * @param metrics     metrics sink; {@code null} means {@link MetricsExporter#NOOP}
   */
  public CallbackDispatcher(MentionCallback onProcessed, MentionCallback onDeleted,
      MetricsExporter metrics) {
    this.onProcessed = onProcessed;
    this.onDeleted = onDeleted;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Reports a created or updated mention.
   *
   * @param mention the stored mention
   */
  public void processed(Webmention mention) {
    invoke(onProcessed, "processed", mention);
  }

  /**
   * Reports a deleted mention.
   *
   * @param mention the mention in its {@code DELETED} state
   */
  public void deleted(Webmention mention) {
    invoke(onDeleted, "deleted", mention);
  }

  private void invoke(MentionCallback callback, String kind, Webmention mention) {
    if (callback == null) {
      return;
    }
    try {
      callback.onMention(mention);
    } catch (Exception e) {
      metrics.incrementCallbackFailure();
      logger.log(Level.WARNING, "Mention " + kind + " callback failed <source=" + mention.source()
          + " target=" + mention.target() + " direction=" + mention.direction() + ">", e);
    }
  }
}
