package webmention.incoming;

import webmention.model.Webmention;

import java.util.Objects;

/**
 * Outcome of processing one received notification.
 *
 * @param outcome what happened to the stored record
 * @param mention the record as it now stands
 */
public record IncomingResult(Outcome outcome, Webmention mention) {

  public enum Outcome {
    /** First time this source/target pair was accepted. */
    CREATED,
    /** An existing record was refreshed or revived. */
    UPDATED,
    /** Nothing changed; no write, no callback. */
    UNCHANGED,
    /** The source stopped linking or disappeared; the record is now deleted. */
    DELETED
  }

  public IncomingResult {
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(mention, "mention");
  }
}
