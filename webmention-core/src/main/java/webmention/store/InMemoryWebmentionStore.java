package webmention.store;

import webmention.model.Webmention;
import webmention.model.WebmentionDirection;
import webmention.model.WebmentionStatus;
import webmention.spi.WebmentionStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link WebmentionStore} backed by a concurrent map. Suitable for tests and single-process
 * sites that rebuild their mentions on start-up; nothing survives a restart.
 */
public final class InMemoryWebmentionStore implements WebmentionStore {
  private final ConcurrentHashMap<Key, Webmention> mentions = new ConcurrentHashMap<>();

  @Override
  public void store(Webmention mention) {
    Objects.requireNonNull(mention, "mention");
    mentions.merge(Key.of(mention), mention, (existing, incoming) -> {
      if (existing.createdAt().equals(incoming.createdAt())) {
        return incoming;
      }
      Instant updatedAt = incoming.updatedAt().isBefore(existing.createdAt())
          ? existing.createdAt() : incoming.updatedAt();
      return incoming.toBuilder().createdAt(existing.createdAt()).updatedAt(updatedAt).build();
    });
  }

  @Override
  public boolean delete(String source, String target, WebmentionDirection direction) {
    AtomicBoolean changed = new AtomicBoolean(false);
    mentions.computeIfPresent(new Key(source, target, direction), (key, existing) -> {
      if (existing.status() == WebmentionStatus.DELETED) {
        return existing;
      }
      changed.set(true);
      return existing.withStatus(WebmentionStatus.DELETED, Instant.now());
    });
    return changed.get();
  }

  @Override
  public List<Webmention> retrieve(String resource, WebmentionDirection direction) {
    return mentions.values().stream()
        .filter(m -> m.direction() == direction)
        .filter(m -> m.status() == WebmentionStatus.CONFIRMED)
        .filter(m -> resource.equals(direction == WebmentionDirection.IN ? m.target() : m.source()))
        .sorted(Comparator.comparing(Webmention::createdAt))
        .toList();
  }

  @Override
  public Optional<Webmention> find(String source, String target, WebmentionDirection direction) {
    return Optional.ofNullable(mentions.get(new Key(source, target, direction)));
  }

  /**
   * Returns every stored mention regardless of status.
   *
   * @return a snapshot
   */
  public List<Webmention> all() {
    return List.copyOf(mentions.values());
  }

  public int size() {
    return mentions.size();
  }

  private record Key(String source, String target, WebmentionDirection direction) {
    static Key of(Webmention mention) {
      return new Key(mention.source(), mention.target(), mention.direction());
    }
  }
}
