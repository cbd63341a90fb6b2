package webmention.parse.mf2;

import webmention.model.MentionType;
import webmention.model.RsvpValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the mention-relevant fields of an {@code h-entry} {@link Mf2Item} into an {@link HEntry}.
 */
public final class EntryReader {

  /**
   * Reads the main entry of a page.
   *
   * @param document the parsed items
   * @return the entry, or {@code null} if the page has no {@code h-entry}
   */
  public HEntry read(Mf2Document document) {
    Mf2Item entry = document.firstEntry();
    if (entry == null) {
      return null;
    }
    HCard author = author(entry);
    if (author == null) {
      Mf2Item card = document.firstCard();
      author = card != null ? card(card) : null;
    }
    return read(entry, author);
  }

  HEntry read(Mf2Item entry, HCard author) {
    Object content = entry.values("content").isEmpty() ? null : entry.values("content").get(0);
    String contentText = null;
    String contentHtml = null;
    if (content instanceof Mf2Html html) {
      contentText = html.text();
      contentHtml = html.html();
    } else if (content != null) {
      contentText = Mf2Item.asString(content);
    }

    return new HEntry(
        entry.types(),
        entry.first("name"),
        entry.first("summary"),
        blankToNull(contentText),
        blankToNull(contentHtml),
        Mf2Dates.parse(entry.first("published")),
        entry.first("url"),
        entry.first("uid"),
        entry.strings("category"),
        entry.strings("syndication"),
        entry.strings("photo"),
        citations(entry, MentionType.REPLY.property()),
        citations(entry, MentionType.LIKE.property()),
        citations(entry, MentionType.REPOST.property()),
        citations(entry, MentionType.BOOKMARK.property()),
        citations(entry, MentionType.FOLLOW.property()),
        RsvpValue.fromRaw(entry.first("rsvp")),
        location(entry),
        citations(entry, "comment"),
        author);
  }

  /**
   * Reads an entry's {@code author}: a nested {@code h-card}, or a plain value that is
   * treated as a URL when it looks like one and as a name otherwise.
   */
  static HCard author(Mf2Item entry) {
    for (Object value : entry.values("author")) {
      if (value instanceof Mf2Item item) {
        HCard card = card(item);
        if (!card.isEmpty()) {
          return card;
        }
      } else {
        String text = Mf2Item.asString(value);
        if (text != null && !text.isEmpty()) {
          return text.startsWith("http://") || text.startsWith("https://")
              ? new HCard(null, text, null)
              : new HCard(text, null, null);
        }
      }
    }
    return null;
  }

  static HCard card(Mf2Item card) {
    return new HCard(card.first("name"), card.first("url"), card.first("photo"));
  }

  private List<Citation> citations(Mf2Item entry, String property) {
    List<Citation> result = new ArrayList<>();
    for (Object value : entry.values(property)) {
      if (value instanceof Mf2Item item) {
        Object content = item.values("content").isEmpty() ? null : item.values("content").get(0);
        result.add(new Citation(
            item.types().isEmpty() ? null : item.types().get(0),
            item.first("url") != null ? item.first("url") : item.value(),
            item.first("name"),
            blankToNull(Mf2Item.asString(content)),
            Mf2Dates.parse(item.first("published")),
            author(item)));
      } else {
        String url = Mf2Item.asString(value);
        if (url != null && !url.isEmpty()) {
          result.add(Citation.ofUrl(url));
        }
      }
    }
    return List.copyOf(result);
  }

  private Location location(Mf2Item entry) {
    List<Object> values = entry.values(MentionType.LOCATION.property());
    if (values.isEmpty()) {
      return null;
    }
    Object value = values.get(0);
    if (value instanceof Mf2Item item) {
      return new Location(
          item.types().isEmpty() ? null : item.types().get(0),
          item.first("name"),
          item.first("url"),
          item.first("latitude"),
          item.first("longitude"));
    }
    String text = Mf2Item.asString(value);
    if (text == null || text.isEmpty()) {
      return null;
    }
    return text.startsWith("http://") || text.startsWith("https://")
        ? new Location(null, null, text, null, null)
        : new Location(null, text, null, null, null);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
