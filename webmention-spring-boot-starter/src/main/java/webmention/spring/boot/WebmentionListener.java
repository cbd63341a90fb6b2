package webmention.spring.boot;

import webmention.model.Webmention;

/**
 * Spring bean notified of mention state changes.
 *
 * <p>Every bean of this type in the context is invoked, in {@code @Order} order, after a
 * mention was stored or deleted. A throwing listener does not stop the ones after it;
 * exceptions are logged and counted by the core, never propagated to the protocol caller.
 *
 * <pre>{@code
 * @Component
 * class CacheEvictingListener implements WebmentionListener {
 *   public void onMentionProcessed(Webmention mention) {
 *     pageCache.evict(mention.target());
 *   }
 * }
 * }</pre>
 */
public interface WebmentionListener {

    /**
     * A mention was created or updated.
     */
    default void onMentionProcessed(Webmention mention) throws Exception {
    }

    /**
     * A mention was marked deleted.
     */
    default void onMentionDeleted(Webmention mention) throws Exception {
    }
}
