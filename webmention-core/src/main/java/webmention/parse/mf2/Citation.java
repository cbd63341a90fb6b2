package webmention.parse.mf2;

import java.time.Instant;

/**
 * A referenced post: either a bare URL or an embedded {@code h-cite} / {@code h-entry},
 * as found in {@code in-reply-to}, {@code like-of}, {@code comment} and friends.
 */
public record Citation(String type, String url, String name, String content,
    Instant published, HCard author) {

  static Citation ofUrl(String url) {
    return new Citation(null, url, null, null, null, null);
  }
}
