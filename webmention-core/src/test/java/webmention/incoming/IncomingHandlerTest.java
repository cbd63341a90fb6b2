package webmention.incoming;

import org.junit.jupiter.api.Test;
import webmention.CountingMetrics;
import webmention.InvalidMentionException;
import webmention.InvalidMentionException.Reason;
import webmention.ResolutionFailedException;
import webmention.StubTransport;
import webmention.callback.CallbackDispatcher;
import webmention.model.MentionType;
import webmention.model.RsvpValue;
import webmention.model.Webmention;
import webmention.model.WebmentionDirection;
import webmention.model.WebmentionStatus;
import webmention.spi.HttpTimeoutException;
import webmention.store.InMemoryWebmentionStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IncomingHandlerTest {
  private static final String SOURCE = "https://alice.example/notes/1";
  private static final String TARGET = "https://bob.example/post/1";
  private static final String LINKING = "<div class=\"h-entry\"><p class=\"e-content\">Nice post "
      + "<a href=\"" + TARGET + "\">Bob</a></p></div>";

  private final InMemoryWebmentionStore store = new InMemoryWebmentionStore();
  private final StubTransport transport = new StubTransport();
  private final CountingMetrics metrics = new CountingMetrics();
  private final List<Webmention> processed = new ArrayList<>();
  private final List<Webmention> deleted = new ArrayList<>();

  private IncomingHandler handler() {
    return handler(WebmentionStatus.CONFIRMED);
  }

  private IncomingHandler handler(WebmentionStatus initialStatus) {
    return IncomingHandler.builder()
        .store(store)
        .transport(transport)
        .callbacks(new CallbackDispatcher(processed::add, deleted::add, metrics))
        .metrics(metrics)
        .baseUrl("https://bob.example/")
        .initialStatus(initialStatus)
        .build();
  }

  private InvalidMentionException rejected(String source, String target) {
    return assertThrows(InvalidMentionException.class, () -> handler().process(source, target));
  }

  // ── Accepting ────────────────────────────────────────────────────

  @Test
  void linkingSourceIsAccepted() {
    transport.html(SOURCE, LINKING);

    IncomingResult result = handler().process(SOURCE, TARGET);

    assertEquals(IncomingResult.Outcome.CREATED, result.outcome());
    Webmention m = store.find(SOURCE, TARGET, WebmentionDirection.IN).orElseThrow();
    assertEquals(WebmentionStatus.CONFIRMED, m.status());
    assertEquals(MentionType.MENTION, m.mentionType());
    assertEquals(List.of(m), store.retrieve(TARGET, WebmentionDirection.IN));
    assertEquals(List.of(m), processed);
    assertEquals(1, metrics.count("incomingAccepted"));
  }

  @Test
  void classifiesFromEntry() {
    transport.html(SOURCE, "<div class=\"h-entry\"><a class=\"u-in-reply-to\" href=\"" + TARGET + "\">re</a>"
        + "<data class=\"p-rsvp\" value=\"yes\"></data>"
        + "<p class=\"e-content\">Count me in</p>"
        + "<a class=\"p-author h-card\" href=\"https://alice.example/\">Alice</a></div>");

    Webmention m = handler().process(SOURCE, TARGET).mention();

    assertEquals(MentionType.RSVP, m.mentionType());
    assertEquals(RsvpValue.YES, m.rsvp());
    assertEquals("Alice", m.authorName());
    assertEquals("Count me in", m.content());
  }

  @Test
  void pendingInitialStatusIsHiddenUntilModerated() {
    transport.html(SOURCE, LINKING);

    Webmention m = handler(WebmentionStatus.PENDING).process(SOURCE, TARGET).mention();

    assertEquals(WebmentionStatus.PENDING, m.status());
    assertTrue(store.retrieve(TARGET, WebmentionDirection.IN).isEmpty());
  }

  @Test
  void moderatedStatusIsKeptOnUpdate() {
    transport.html(SOURCE, LINKING);
    IncomingHandler handler = handler(WebmentionStatus.PENDING);
    Webmention pending = handler.process(SOURCE, TARGET).mention();
    store.store(pending.toBuilder().status(WebmentionStatus.CONFIRMED).build());

    transport.html(SOURCE, LINKING.replace("Nice post", "Great post"));
    IncomingResult result = handler.process(SOURCE, TARGET);

    assertEquals(IncomingResult.Outcome.UPDATED, result.outcome());
    assertEquals(WebmentionStatus.CONFIRMED, result.mention().status());
    assertEquals(pending.createdAt(), result.mention().createdAt());
  }

  @Test
  void reprocessingUnchangedSourceWritesNothing() {
    transport.html(SOURCE, LINKING);
    IncomingHandler handler = handler();
    Webmention first = handler.process(SOURCE, TARGET).mention();

    IncomingResult again = handler.process(SOURCE, TARGET);

    assertEquals(IncomingResult.Outcome.UNCHANGED, again.outcome());
    assertEquals(first, store.find(SOURCE, TARGET, WebmentionDirection.IN).orElseThrow());
    assertEquals(1, processed.size());
    assertEquals(1, metrics.count("incomingUnchanged"));
  }

  @Test
  void changedSourceUpdatesInPlace() {
    transport.html(SOURCE, LINKING);
    IncomingHandler handler = handler();
    Webmention first = handler.process(SOURCE, TARGET).mention();
    transport.html(SOURCE, "<div class=\"h-entry\"><a class=\"u-like-of\" href=\"" + TARGET + "\">liked</a></div>");

    IncomingResult result = handler.process(SOURCE, TARGET);

    assertEquals(IncomingResult.Outcome.UPDATED, result.outcome());
    assertEquals(MentionType.LIKE, result.mention().mentionType());
    assertEquals(first.createdAt(), result.mention().createdAt());
    assertEquals(1, store.size());
    assertEquals(2, processed.size());
  }

  @Test
  void throwingCallbackStillPersists() {
    transport.html(SOURCE, LINKING);
    IncomingHandler handler = IncomingHandler.builder()
        .store(store)
        .transport(transport)
        .callbacks(new CallbackDispatcher(m -> {
          throw new IllegalStateException("listener down");
        }, null, metrics))
        .build();

    assertEquals(IncomingResult.Outcome.CREATED, handler.process(SOURCE, TARGET).outcome());
    assertTrue(store.find(SOURCE, TARGET, WebmentionDirection.IN).isPresent());
    assertEquals(1, metrics.count("callbackFailure"));
  }

  // ── Rejecting ────────────────────────────────────────────────────

  @Test
  void selfMentionLeavesNoTrace() {
    InvalidMentionException e = rejected(TARGET, TARGET);

    assertEquals(Reason.SELF_MENTION, e.reason());
    assertEquals(0, store.size());
    assertTrue(processed.isEmpty());
    assertTrue(transport.calls().isEmpty());
    assertEquals(1, metrics.count("incomingRejected"));
  }

  @Test
  void selfMentionAfterNormalisation() {
    assertEquals(Reason.SELF_MENTION, rejected("https://BOB.example/post/1#comments", TARGET).reason());
  }

  @Test
  void missingOrMalformedUrls() {
    assertEquals(Reason.MISSING_URL, rejected(null, TARGET).reason());
    assertEquals(Reason.MISSING_URL, rejected(SOURCE, "").reason());
    assertEquals(Reason.MALFORMED_URL, rejected("ftp://alice.example/x", TARGET).reason());
    assertEquals(Reason.MALFORMED_URL, rejected(SOURCE, "/post/1").reason());
  }

  @Test
  void targetOutsideSite() {
    InvalidMentionException e = rejected(SOURCE, "https://carol.example/post/1");

    assertEquals(Reason.TARGET_NOT_OWNED, e.reason());
    assertTrue(transport.calls().isEmpty());
  }

  @Test
  void anyTargetAcceptedWithoutBaseUrl() {
    transport.html(SOURCE, "<a href=\"https://carol.example/post/1\">c</a>");
    IncomingHandler open = IncomingHandler.builder().store(store).transport(transport).build();

    assertEquals(IncomingResult.Outcome.CREATED, open.process(SOURCE, "https://carol.example/post/1").outcome());
  }

  @Test
  void sourceNotLinkingIsRejected() {
    transport.html(SOURCE, "<p>Mentions " + TARGET + " only as text</p>");

    assertEquals(Reason.TARGET_NOT_LINKED, rejected(SOURCE, TARGET).reason());
    assertEquals(0, store.size());
  }

  @Test
  void missingSourceIsRejected() {
    InvalidMentionException e = rejected(SOURCE, TARGET);

    assertEquals(Reason.SOURCE_GONE, e.reason());
    assertEquals(0, store.size());
  }

  @Test
  void forbiddenSourceIsRejected() {
    transport.page(SOURCE, 403, Map.of(), "no");

    assertEquals(Reason.SOURCE_REJECTED, rejected(SOURCE, TARGET).reason());
  }

  @Test
  void sourceServerError_throwsResolutionFailed() {
    transport.page(SOURCE, 500, Map.of(), "oops");

    ResolutionFailedException e = assertThrows(ResolutionFailedException.class,
        () -> handler().process(SOURCE, TARGET));
    assertEquals(500, e.statusCode());
    assertEquals(0, store.size());
  }

  @Test
  void sourceTimeout_throwsResolutionFailed() {
    transport.failGet(SOURCE, new HttpTimeoutException("slow"));

    ResolutionFailedException e = assertThrows(ResolutionFailedException.class,
        () -> handler().process(SOURCE, TARGET));
    assertInstanceOf(HttpTimeoutException.class, e.getCause());
  }

  // ── Deleting ─────────────────────────────────────────────────────

  @Test
  void sourceThatStopsLinkingDeletesRecord() {
    transport.html(SOURCE, LINKING);
    IncomingHandler handler = handler();
    handler.process(SOURCE, TARGET);
    transport.html(SOURCE, "<p>Link removed</p>");

    IncomingResult result = handler.process(SOURCE, TARGET);

    assertEquals(IncomingResult.Outcome.DELETED, result.outcome());
    assertEquals(WebmentionStatus.DELETED, store.find(SOURCE, TARGET, WebmentionDirection.IN).orElseThrow().status());
    assertTrue(store.retrieve(TARGET, WebmentionDirection.IN).isEmpty());
    assertEquals(1, deleted.size());
    assertEquals(WebmentionStatus.DELETED, deleted.get(0).status());
    assertEquals(1, metrics.count("incomingDeleted"));
  }

  @Test
  void goneSourceDeletesRecord() {
    transport.html(SOURCE, LINKING);
    IncomingHandler handler = handler();
    handler.process(SOURCE, TARGET);
    transport.page(SOURCE, 410, Map.of(), "gone");

    assertEquals(IncomingResult.Outcome.DELETED, handler.process(SOURCE, TARGET).outcome());
  }

  @Test
  void alreadyDeletedStaysUnchanged() {
    transport.html(SOURCE, LINKING);
    IncomingHandler handler = handler();
    handler.process(SOURCE, TARGET);
    transport.page(SOURCE, 410, Map.of(), "gone");
    handler.process(SOURCE, TARGET);

    IncomingResult again = handler.process(SOURCE, TARGET);

    assertEquals(IncomingResult.Outcome.UNCHANGED, again.outcome());
    assertEquals(1, deleted.size());
  }

  @Test
  void relinkedSourceRevivesDeletedRecord() {
    transport.html(SOURCE, LINKING);
    IncomingHandler handler = handler();
    handler.process(SOURCE, TARGET);
    transport.html(SOURCE, "<p>gone</p>");
    handler.process(SOURCE, TARGET);
    transport.html(SOURCE, LINKING);

    IncomingResult result = handler.process(SOURCE, TARGET);

    assertEquals(IncomingResult.Outcome.UPDATED, result.outcome());
    assertEquals(WebmentionStatus.CONFIRMED, result.mention().status());
    assertEquals(1, store.retrieve(TARGET, WebmentionDirection.IN).size());
  }

  @Test
  void deletedInitialStatus_throwsIAE() {
    assertThrows(IllegalArgumentException.class, () -> handler(WebmentionStatus.DELETED));
  }
}
