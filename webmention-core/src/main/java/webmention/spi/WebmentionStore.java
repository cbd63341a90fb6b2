package webmention.spi;

import webmention.model.Webmention;
import webmention.model.WebmentionDirection;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for mentions.
 *
 * <p>Every call must be atomic on its own; callers never assume a transaction spans
 * two calls. Failures propagate to the caller unmodified as unchecked exceptions.
 *
 * <p>Implementations must be thread-safe.
 */
public interface WebmentionStore {

    /**
     * Inserts or updates a mention by its ({@code source}, {@code target}, {@code direction})
     * identity. An update keeps the stored {@code createdAt}.
     *
     * @param mention the mention to persist
     */
    void store(Webmention mention);

    /**
     * Marks a mention {@code DELETED} and bumps its {@code updatedAt}. The record keeps its
     * identity, so deleting again is a no-op that still succeeds.
     *
     * @param source    the mentioning URL
     * @param target    the mentioned URL
     * @param direction the direction
     * @return {@code true} if a record existed and was not already deleted
     */
    boolean delete(String source, String target, WebmentionDirection direction);

    /**
     * Returns the reader-facing mentions for a resource: only {@code CONFIRMED} records.
     * For {@link WebmentionDirection#IN} the resource is matched against {@code target},
     * for {@link WebmentionDirection#OUT} against {@code source}.
     *
     * @param resource  the local resource URL
     * @param direction the direction
     * @return confirmed mentions, oldest first
     */
    List<Webmention> retrieve(String resource, WebmentionDirection direction);

    /**
     * Looks up a single mention by identity regardless of its status.
     *
     * @param source    the mentioning URL
     * @param target    the mentioned URL
     * @param direction the direction
     * @return the stored mention, if any
     */
    Optional<Webmention> find(String source, String target, WebmentionDirection direction);
}
