package webmention.parse.mf2;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;
import webmention.model.MentionType;
import webmention.model.RsvpValue;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntryReaderTest {
  private static final String BASE = "https://alice.example/notes/1";
  private static final String TARGET = "https://bob.example/post/1";

  private final Mf2Parser parser = new Mf2Parser();
  private final EntryReader reader = new EntryReader();

  private HEntry read(String html) {
    return reader.read(parser.parse(Jsoup.parse(html, BASE), BASE));
  }

  // ── Fields ───────────────────────────────────────────────────────

  @Test
  void noEntry_returnsNull() {
    assertNull(read("<div class=\"h-card\">Alice</div>"));
  }

  @Test
  void readsEntryFields() {
    HEntry entry = read("<article class=\"h-entry\">"
        + "<h1 class=\"p-name\">A reply</h1>"
        + "<time class=\"dt-published\" datetime=\"2024-05-01 10:00:00+0200\"></time>"
        + "<a class=\"u-uid u-url\" href=\"/notes/1\"></a>"
        + "<a class=\"u-syndication\" href=\"https://social.example/@alice/1\"></a>"
        + "<div class=\"e-content\">Great <i>post</i></div>"
        + "<a class=\"u-comment\" href=\"https://carol.example/c/1\"></a>"
        + "<a class=\"u-comment\" href=\"https://dave.example/c/2\"></a>"
        + "</article>");

    assertEquals("A reply", entry.name());
    assertEquals(Instant.parse("2024-05-01T08:00:00Z"), entry.published());
    assertEquals("https://alice.example/notes/1", entry.url());
    assertEquals("https://alice.example/notes/1", entry.uid());
    assertEquals(List.of("https://social.example/@alice/1"), entry.syndication());
    assertEquals("Great post", entry.contentText());
    assertTrue(entry.contentHtml().contains("<i>post</i>"));
    assertEquals(2, entry.comments().size());
    assertEquals("https://carol.example/c/1", entry.comments().get(0).url());
  }

  @Test
  void nestedAuthorCard() {
    HEntry entry = read("<div class=\"h-entry\"><div class=\"p-author h-card\">"
        + "<a class=\"p-name u-url\" href=\"https://alice.example/\">Alice</a>"
        + "<img class=\"u-photo\" src=\"/alice.jpg\" alt=\"\"></div>"
        + "<p class=\"e-content\">Hi</p></div>");

    assertEquals(new HCard("Alice", "https://alice.example/", "https://alice.example/alice.jpg"), entry.author());
  }

  @Test
  void authorAsUrlOrName() {
    HEntry byUrl = read("<div class=\"h-entry\"><a class=\"u-author\" href=\"https://alice.example/\">me</a></div>");
    HEntry byName = read("<div class=\"h-entry\"><span class=\"p-author\">Alice</span></div>");

    assertEquals(new HCard(null, "https://alice.example/", null), byUrl.author());
    assertEquals(new HCard("Alice", null, null), byName.author());
  }

  @Test
  void authorFallsBackToPageCard() {
    HEntry entry = read("<div class=\"h-card\"><a class=\"p-name u-url\" href=\"https://alice.example/\">Alice</a></div>"
        + "<div class=\"h-entry\"><p class=\"e-content\">Hi</p></div>");

    assertEquals("Alice", entry.author().name());
    assertEquals("https://alice.example/", entry.author().url());
  }

  @Test
  void nestedCitation() {
    HEntry entry = read("<div class=\"h-entry\"><div class=\"u-in-reply-to h-cite\">"
        + "<a class=\"u-url p-name\" href=\"" + TARGET + "\">Bob's post</a>"
        + "<time class=\"dt-published\" datetime=\"2024-04-30\"></time></div></div>");

    Citation cite = entry.inReplyTo().get(0);
    assertEquals("h-cite", cite.type());
    assertEquals(TARGET, cite.url());
    assertEquals("Bob's post", cite.name());
    assertEquals(Instant.parse("2024-04-30T00:00:00Z"), cite.published());
  }

  @Test
  void locationAsNestedCard() {
    HEntry entry = read("<div class=\"h-entry\"><div class=\"p-location h-card\">"
        + "<a class=\"p-name u-url\" href=\"https://venue.example/\">The Venue</a>"
        + "<data class=\"p-latitude\" value=\"52.1\"></data><data class=\"p-longitude\" value=\"4.3\"></data>"
        + "</div></div>");

    Location location = entry.location();
    assertEquals("h-card", location.type());
    assertEquals("The Venue", location.name());
    assertEquals("https://venue.example/", location.url());
    assertEquals("52.1", location.latitude());
    assertEquals("4.3", location.longitude());
  }

  // ── Classification ───────────────────────────────────────────────

  @Test
  void classifyByCitingProperty() {
    assertEquals(MentionType.REPLY, classify("u-in-reply-to"));
    assertEquals(MentionType.LIKE, classify("u-like-of"));
    assertEquals(MentionType.REPOST, classify("u-repost-of"));
    assertEquals(MentionType.BOOKMARK, classify("u-bookmark-of"));
    assertEquals(MentionType.FOLLOW, classify("u-follow-of"));
    assertEquals(MentionType.LOCATION, classify("u-location"));
    assertEquals(MentionType.MENTION, classify("u-mention-of"));
  }

  @Test
  void replyWinsOverLike() {
    HEntry entry = read("<div class=\"h-entry\"><a class=\"u-like-of u-in-reply-to\" href=\"" + TARGET + "\"></a></div>");

    assertEquals(MentionType.REPLY, entry.classify(TARGET));
  }

  @Test
  void replyWithRsvpIsRsvp() {
    HEntry entry = read("<div class=\"h-entry\"><a class=\"u-in-reply-to\" href=\"" + TARGET + "\"></a>"
        + "<data class=\"p-rsvp\" value=\"Maybe\">maybe</data></div>");

    assertEquals(MentionType.RSVP, entry.classify(TARGET));
    assertEquals(RsvpValue.MAYBE, entry.rsvp());
  }

  @Test
  void classificationIsPerTarget() {
    HEntry entry = read("<div class=\"h-entry\"><a class=\"u-like-of\" href=\"" + TARGET + "\"></a>"
        + "<a href=\"https://carol.example/x\">Carol</a></div>");

    assertEquals(MentionType.LIKE, entry.classify(TARGET));
    assertEquals(MentionType.MENTION, entry.classify("https://carol.example/x"));
    assertEquals(MentionType.LIKE, entry.classify("https://BOB.example/post/1#top"));
  }

  private MentionType classify(String propertyClass) {
    return read("<div class=\"h-entry\"><a class=\"" + propertyClass + "\" href=\"" + TARGET + "\"></a></div>")
        .classify(TARGET);
  }
}
