package webmention.parse.mf2;

import java.util.List;

/**
 * The top-level microformats2 items of a page.
 */
public record Mf2Document(List<Mf2Item> items) {

  public static final Mf2Document EMPTY = new Mf2Document(List.of());

  public Mf2Document {
    items = List.copyOf(items);
  }

  /**
   * Finds the page's main entry: the first top-level {@code h-entry}, else the first
   * {@code h-entry} directly nested in a top-level item (e.g. inside an {@code h-feed}).
   *
   * @return the entry, or {@code null}
   */
  public Mf2Item firstEntry() {
    for (Mf2Item item : items) {
      if (item.hasType("h-entry")) {
        return item;
      }
    }
    for (Mf2Item item : items) {
      for (Mf2Item child : item.children()) {
        if (child.hasType("h-entry")) {
          return child;
        }
      }
    }
    return null;
  }

  /**
   * Returns the first top-level {@code h-card}, used as the page author when the
   * entry names none.
   *
   * @return the card, or {@code null}
   */
  public Mf2Item firstCard() {
    for (Mf2Item item : items) {
      if (item.hasType("h-card")) {
        return item;
      }
    }
    return null;
  }
}
