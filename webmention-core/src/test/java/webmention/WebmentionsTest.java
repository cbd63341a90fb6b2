package webmention;

import org.junit.jupiter.api.Test;
import webmention.incoming.IncomingResult;
import webmention.model.Webmention;
import webmention.model.WebmentionDirection;
import webmention.model.WebmentionStatus;
import webmention.outgoing.OutgoingReport;
import webmention.parse.ContentFormat;
import webmention.spi.MetricsExporter;
import webmention.store.InMemoryWebmentionStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class WebmentionsTest {
  private static final String SITE = "https://bob.example/";
  private static final String LOCAL_POST = "https://bob.example/post/1";
  private static final String REMOTE_NOTE = "https://alice.example/notes/1";

  private final InMemoryWebmentionStore store = new InMemoryWebmentionStore();
  private final StubTransport transport = new StubTransport();

  // ── Builder ──────────────────────────────────────────────────────

  @Test
  void builder_missingStore_throwsNPE() {
    assertThrows(NullPointerException.class, () -> Webmentions.builder().transport(transport).build());
  }

  @Test
  void builder_usedTwice_throwsISE() {
    Webmentions.Builder builder = Webmentions.builder().store(store).transport(transport);
    try (Webmentions ignored = builder.build()) {
      assertThrows(IllegalStateException.class, builder::build);
    }
  }

  @Test
  void builder_defaultTransport() {
    try (Webmentions webmentions = Webmentions.builder().store(store).build()) {
      assertSame(store, webmentions.store());
    }
  }

  // ── Round trip ───────────────────────────────────────────────────

  @Test
  void receiveAndDisplay() {
    List<Webmention> processed = new ArrayList<>();
    transport.html(REMOTE_NOTE, "<div class=\"h-entry\"><a class=\"u-like-of\" href=\"" + LOCAL_POST + "\">liked</a></div>");

    try (Webmentions webmentions = Webmentions.builder()
        .store(store)
        .transport(transport)
        .config(new WebmentionsConfig().setBaseUrl(SITE).setOnMentionProcessed(processed::add))
        .build()) {
      IncomingResult result = webmentions.processIncoming(REMOTE_NOTE, LOCAL_POST);

      assertEquals(IncomingResult.Outcome.CREATED, result.outcome());
      assertEquals(List.of(result.mention()), webmentions.retrieve(LOCAL_POST, WebmentionDirection.IN));
      assertEquals(1, processed.size());
    }
  }

  @Test
  void pendingMentionsAreNotDisplayed() {
    transport.html(REMOTE_NOTE, "<a href=\"" + LOCAL_POST + "\">Bob</a>");

    try (Webmentions webmentions = Webmentions.builder()
        .store(store)
        .transport(transport)
        .config(new WebmentionsConfig().setInitialMentionStatus(WebmentionStatus.PENDING))
        .build()) {
      webmentions.processIncoming(REMOTE_NOTE, LOCAL_POST);

      assertTrue(webmentions.retrieve(LOCAL_POST, WebmentionDirection.IN).isEmpty());
    }
  }

  @Test
  void sendAndRetract() {
    List<Webmention> deleted = new ArrayList<>();
    transport.target(REMOTE_NOTE, "https://alice.example/webmention");

    try (Webmentions webmentions = Webmentions.builder()
        .store(store)
        .transport(transport)
        .config(new WebmentionsConfig().setOnMentionDeleted(deleted::add).setNotifyOnRetraction(false))
        .build()) {
      OutgoingReport sent = webmentions.processOutgoing(LOCAL_POST,
          "Replying to [Alice](" + REMOTE_NOTE + ")", ContentFormat.MARKDOWN);
      assertEquals(List.of(REMOTE_NOTE), sent.sent());
      assertEquals(1, webmentions.retrieve(LOCAL_POST, WebmentionDirection.OUT).size());

      OutgoingReport retracted = webmentions.processOutgoing(LOCAL_POST, "", null);
      assertEquals(List.of(REMOTE_NOTE), retracted.retracted());
      assertTrue(webmentions.retrieve(LOCAL_POST, WebmentionDirection.OUT).isEmpty());
      assertEquals(1, deleted.size());
    }
  }

  @Test
  void processOutgoingFetchesSource() {
    transport.html(LOCAL_POST, "<a href=\"" + REMOTE_NOTE + "\">Alice</a>");
    transport.target(REMOTE_NOTE, "https://alice.example/webmention");

    try (Webmentions webmentions = Webmentions.builder().store(store).transport(transport).build()) {
      assertEquals(List.of(REMOTE_NOTE), webmentions.processOutgoing(LOCAL_POST).sent());
    }
  }

  @Test
  void sentTargetIsAcceptedByTheReceiver() {
    String spelledTarget = "https://Bob.example";
    transport.html(REMOTE_NOTE, "<p>Hi <a href=\"" + spelledTarget + "\">Bob</a></p>");
    transport.target(spelledTarget, "https://bob.example/webmention");

    String notified;
    try (Webmentions sender = Webmentions.builder().store(store).transport(transport).build()) {
      OutgoingReport report = sender.processOutgoing(REMOTE_NOTE);
      assertEquals(List.of(spelledTarget), report.sent());
      notified = transport.calls("POST").get(0);
    }
    String target = notified.substring(notified.indexOf(" target=") + " target=".length());

    try (Webmentions receiver = Webmentions.builder()
        .store(new InMemoryWebmentionStore())
        .transport(transport)
        .config(new WebmentionsConfig().setBaseUrl(SITE))
        .build()) {
      IncomingResult result = receiver.processIncoming(REMOTE_NOTE, target);

      assertEquals(IncomingResult.Outcome.CREATED, result.outcome());
      assertEquals(spelledTarget, result.mention().target());
    }
  }

  // ── Misc ─────────────────────────────────────────────────────────

  @Test
  void linkHeader() {
    assertEquals("<https://bob.example/webmention>; rel=\"webmention\"",
        Webmentions.linkHeader("https://bob.example/webmention"));
  }

  @Test
  void closeClosesCloseableMetrics() {
    AtomicBoolean closed = new AtomicBoolean();
    CloseableMetrics metrics = new CloseableMetrics(closed);

    Webmentions.builder().store(store).transport(transport).metrics(metrics).build().close();

    assertTrue(closed.get());
  }

  @Test
  void configRejectsInvalidValues() {
    WebmentionsConfig config = new WebmentionsConfig();

    assertThrows(IllegalArgumentException.class, () -> config.setInitialMentionStatus(WebmentionStatus.DELETED));
    assertThrows(IllegalArgumentException.class, () -> config.setHttpTimeout(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> config.setOutgoingConcurrency(0));
    assertThrows(IllegalArgumentException.class, () -> config.setExcerptLength(0));
    assertEquals(Duration.ofSeconds(10), config.getHttpTimeout());
    assertEquals(4, config.getOutgoingConcurrency());
    assertTrue(config.isNotifyOnRetraction());
  }

  private static final class CloseableMetrics implements MetricsExporter, AutoCloseable {
    private final AtomicBoolean closed;

    CloseableMetrics(AtomicBoolean closed) {
      this.closed = closed;
    }

    @Override public void incrementIncomingAccepted() {}
    @Override public void incrementIncomingRejected() {}
    @Override public void incrementIncomingDeleted() {}
    @Override public void incrementOutgoingSent() {}
    @Override public void incrementOutgoingUnsupported() {}
    @Override public void incrementOutgoingFailed() {}
    @Override public void incrementOutgoingRetracted() {}
    @Override public void incrementCallbackFailure() {}

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
