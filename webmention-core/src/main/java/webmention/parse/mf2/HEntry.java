package webmention.parse.mf2;

import webmention.model.MentionType;
import webmention.model.RsvpValue;
import webmention.util.Urls;

import java.time.Instant;
import java.util.List;

/**
 * The fields of an {@code h-entry} that matter to mentions.
 *
 * <p>Built by {@link EntryReader}. Every field may be {@code null} or empty; list fields
 * are never {@code null}.
 */
public record HEntry(
    List<String> types,
    String name,
    String summary,
    String contentText,
    String contentHtml,
    Instant published,
    String url,
    String uid,
    List<String> categories,
    List<String> syndication,
    List<String> photos,
    List<Citation> inReplyTo,
    List<Citation> likeOf,
    List<Citation> repostOf,
    List<Citation> bookmarkOf,
    List<Citation> followOf,
    RsvpValue rsvp,
    Location location,
    List<Citation> comments,
    HCard author
) {

  /**
   * Classifies how this entry refers to {@code target}. When several properties cite the
   * target the precedence is reply (or RSVP when an rsvp value is set), repost, like,
   * bookmark, follow, location, and finally a plain mention.
   *
   * @param target the mentioned URL
   * @return the mention type, never {@code null}
   */
  public MentionType classify(String target) {
    if (cites(inReplyTo, target)) {
      return rsvp != null ? MentionType.RSVP : MentionType.REPLY;
    }
    if (cites(repostOf, target)) {
      return MentionType.REPOST;
    }
    if (cites(likeOf, target)) {
      return MentionType.LIKE;
    }
    if (cites(bookmarkOf, target)) {
      return MentionType.BOOKMARK;
    }
    if (cites(followOf, target)) {
      return MentionType.FOLLOW;
    }
    if (location != null && location.url() != null && Urls.sameResource(location.url(), target)) {
      return MentionType.LOCATION;
    }
    if (rsvp != null) {
      return MentionType.RSVP;
    }
    return MentionType.MENTION;
  }

  private static boolean cites(List<Citation> citations, String target) {
    for (Citation citation : citations) {
      if (citation.url() != null
          && (citation.url().equals(target) || Urls.sameResource(citation.url(), target))) {
        return true;
      }
    }
    return false;
  }
}
