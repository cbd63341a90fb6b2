package webmention.model;

/**
 * Semantic classification of a mention, derived from the microformats2 property
 * that carries the target URL in the source's {@code h-entry}.
 *
 * <p>The list is not exhaustive; anything unrecognised is a plain {@link #MENTION}.
 */
public enum MentionType {
  MENTION("mention"),
  REPLY("in-reply-to"),
  LIKE("like-of"),
  REPOST("repost-of"),
  BOOKMARK("bookmark-of"),
  FOLLOW("follow-of"),
  RSVP("rsvp"),
  LOCATION("location");

  private final String property;

  MentionType(String property) {
    this.property = property;
  }

  /**
   * Returns the microformats2 property name this type is derived from.
   *
   * @return the mf2 property name, e.g. {@code "like-of"}
   */
  public String property() {
    return property;
  }
}
