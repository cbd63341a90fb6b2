package webmention.parse.mf2;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class Mf2DatesTest {

  @Test
  void acceptedShapes() {
    assertEquals(Instant.parse("2024-01-02T02:04:05Z"), Mf2Dates.parse("2024-01-02T03:04:05+01:00"));
    assertEquals(Instant.parse("2024-01-02T02:04:05Z"), Mf2Dates.parse("2024-01-02T03:04:05+0100"));
    assertEquals(Instant.parse("2024-01-02T03:04:05Z"), Mf2Dates.parse("2024-01-02T03:04:05Z"));
    assertEquals(Instant.parse("2024-01-02T03:04:00Z"), Mf2Dates.parse("2024-01-02 03:04"));
    assertEquals(Instant.parse("2024-01-02T00:00:00Z"), Mf2Dates.parse(" 2024-01-02 "));
  }

  @Test
  void unreadableIsNull() {
    assertNull(Mf2Dates.parse("yesterday"));
    assertNull(Mf2Dates.parse("2024-13-40"));
    assertNull(Mf2Dates.parse(""));
    assertNull(Mf2Dates.parse(null));
  }
}
