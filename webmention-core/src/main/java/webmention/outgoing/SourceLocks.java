package webmention.outgoing;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per source URL, created on demand and dropped once no thread holds or waits
 * for it. Serialises outgoing runs for the same source while different sources proceed
 * in parallel.
 */
final class SourceLocks {
  private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();

  <T> T withLock(String key, Supplier<T> action) {
    Slot slot = slots.compute(key, (k, existing) -> {
      Slot s = existing != null ? existing : new Slot();
      s.users++;
      return s;
    });
    slot.lock.lock();
    try {
      return action.get();
    } finally {
      slot.lock.unlock();
      slots.computeIfPresent(key, (k, s) -> --s.users == 0 ? null : s);
    }
  }

  int size() {
    return slots.size();
  }

  private static final class Slot {
    final ReentrantLock lock = new ReentrantLock();
    int users; // guarded by the map's per-key compute
  }
}
