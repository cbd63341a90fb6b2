package webmention.parse.mf2;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Lenient parsing of the datetime strings found in {@code dt-*} properties and
 * {@code article:published_time} meta tags. Values without an offset are read as UTC.
 */
public final class Mf2Dates {
  private static final DateTimeFormatter COMPACT_OFFSET = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
      .appendOffset("+HHmm", "Z")
      .toFormatter();

  private static final List<Function<String, Instant>> READERS = List.of(
      v -> OffsetDateTime.parse(v, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
      v -> OffsetDateTime.parse(v, COMPACT_OFFSET).toInstant(),
      v -> LocalDateTime.parse(v, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
      v -> LocalDate.parse(v, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC));

  private Mf2Dates() {
  }

  /**
   * Parses a datetime.
   *
   * @param raw e.g. {@code 2024-01-02T03:04:05+01:00}, {@code 2024-01-02 03:04},
   *            {@code 2024-01-02}
   * @return the instant, or {@code null} if the value cannot be read
   */
  public static Instant parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String value = raw.trim().replace(' ', 'T');
    for (Function<String, Instant> reader : READERS) {
      Instant instant = attempt(reader, value);
      if (instant != null) {
        return instant;
      }
    }
    return null;
  }

  private static Instant attempt(Function<String, Instant> reader, String value) {
    try {
      return reader.apply(value);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
