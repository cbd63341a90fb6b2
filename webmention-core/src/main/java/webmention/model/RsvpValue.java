package webmention.model;

import java.util.Locale;

/**
 * Value of an mf2 {@code p-rsvp} property.
 */
public enum RsvpValue {
  YES,
  NO,
  MAYBE,
  INTERESTED;

  /**
   * Parses an rsvp value case-insensitively.
   *
   * @param raw the raw text, may be {@code null}
   * @return the value, or {@code null} when blank or unrecognised
   */
  public static RsvpValue fromRaw(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
