package webmention.outgoing;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SourceLocksTest {
  private final SourceLocks locks = new SourceLocks();

  @Test
  void returnsActionResultAndReleasesSlot() {
    assertEquals("done", locks.withLock("https://alice.example/a", () -> "done"));
    assertEquals(0, locks.size());
  }

  @Test
  void slotReleasedWhenActionThrows() {
    assertThrows(IllegalStateException.class, () -> locks.withLock("k", () -> {
      throw new IllegalStateException("boom");
    }));
    assertEquals(0, locks.size());
  }

  @Test
  void sameKeyIsSerialised() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(4);
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    try {
      Future<?>[] futures = new Future<?>[8];
      for (int i = 0; i < futures.length; i++) {
        futures[i] = pool.submit(() -> {
          start.await();
          return locks.withLock("same", () -> {
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            sleep(5);
            inside.decrementAndGet();
            return null;
          });
        });
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(5, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, maxInside.get());
    assertEquals(0, locks.size());
  }

  @Test
  void differentKeysRunInParallel() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(2);
    CountDownLatch bothInside = new CountDownLatch(2);
    try {
      Future<Boolean> a = pool.submit(() -> locks.withLock("a", () -> awaitBoth(bothInside)));
      Future<Boolean> b = pool.submit(() -> locks.withLock("b", () -> awaitBoth(bothInside)));

      assertTrue(a.get(5, TimeUnit.SECONDS));
      assertTrue(b.get(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }
  }

  private static boolean awaitBoth(CountDownLatch latch) {
    latch.countDown();
    try {
      return latch.await(2, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
