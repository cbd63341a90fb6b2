package webmention.callback;

import webmention.model.Webmention;

/**
 * User hook invoked after a mention was persisted or deleted.
 *
 * <p>Whatever a callback throws is logged and counted, never propagated: the state
 * change it reports has already been committed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * WebmentionsConfig config = new WebmentionsConfig()
 *     .setOnMentionProcessed(m -> moderation.review(m))
 *     .setOnMentionDeleted(m -> cache.evict(m.target()));
 * }</pre>
 */
@FunctionalInterface
public interface MentionCallback {

  /**
   * Receives the affected mention.
   *
   * @param mention the mention as stored
   * @throws Exception any failure; it is isolated from protocol processing
   */
  void onMention(Webmention mention) throws Exception;
}
