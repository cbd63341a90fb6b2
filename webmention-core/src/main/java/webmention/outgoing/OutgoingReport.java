package webmention.outgoing;

import java.util.List;
import java.util.Map;

/**
 * What one outgoing run did for a source.
 *
 * @param source      the processed source URL
 * @param sent        targets notified and recorded
 * @param unsupported targets that advertise no endpoint
 * @param failed      targets that could not be notified, with the cause; nothing was recorded
 *                    for them and a later run will try again
 * @param retracted   previously notified targets no longer linked, now marked deleted
 * @param unchanged   targets already recorded and still linked; no network call was made
 */
public record OutgoingReport(
    String source,
    List<String> sent,
    List<String> unsupported,
    Map<String, Exception> failed,
    List<String> retracted,
    List<String> unchanged
) {

  public OutgoingReport {
    sent = List.copyOf(sent);
    unsupported = List.copyOf(unsupported);
    failed = Map.copyOf(failed);
    retracted = List.copyOf(retracted);
    unchanged = List.copyOf(unchanged);
  }

  public boolean hasFailures() {
    return !failed.isEmpty();
  }
}
