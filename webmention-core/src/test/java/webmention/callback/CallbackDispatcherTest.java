package webmention.callback;

import org.junit.jupiter.api.Test;
import webmention.CountingMetrics;
import webmention.model.Webmention;
import webmention.model.WebmentionDirection;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallbackDispatcherTest {
  private static final Webmention MENTION = Webmention.builder(
      "https://alice.example/notes/1", "https://bob.example/post/1", WebmentionDirection.IN).build();

  private final CountingMetrics metrics = new CountingMetrics();

  @Test
  void routesToMatchingCallback() {
    List<String> seen = new ArrayList<>();
    CallbackDispatcher dispatcher = new CallbackDispatcher(
        m -> seen.add("processed " + m.source()),
        m -> seen.add("deleted " + m.source()),
        metrics);

    dispatcher.processed(MENTION);
    dispatcher.deleted(MENTION);

    assertEquals(List.of("processed https://alice.example/notes/1", "deleted https://alice.example/notes/1"), seen);
    assertEquals(0, metrics.count("callbackFailure"));
  }

  @Test
  void missingCallbacksAreNoOps() {
    CallbackDispatcher dispatcher = new CallbackDispatcher(null, null, null);

    assertDoesNotThrow(() -> dispatcher.processed(MENTION));
    assertDoesNotThrow(() -> dispatcher.deleted(MENTION));
  }

  @Test
  void throwingCallbackIsIsolatedAndCounted() {
    CallbackDispatcher dispatcher = new CallbackDispatcher(
        m -> {
          throw new IllegalStateException("boom");
        },
        m -> {
          throw new java.io.IOException("checked boom");
        },
        metrics);

    assertDoesNotThrow(() -> dispatcher.processed(MENTION));
    assertDoesNotThrow(() -> dispatcher.deleted(MENTION));
    assertEquals(2, metrics.count("callbackFailure"));
  }

  @Test
  void errorsPropagate() {
    CallbackDispatcher dispatcher = new CallbackDispatcher(m -> {
      throw new AssertionError("fatal");
    }, null, metrics);

    assertThrows(AssertionError.class, () -> dispatcher.processed(MENTION));
  }
}
