package webmention.model;

/**
 * Whether a mention was received by this site or sent from it.
 */
public enum WebmentionDirection {
  /** Received: the target is a local resource. */
  IN("incoming"),
  /** Sent: the source is a local resource. */
  OUT("outgoing");

  private final String code;

  WebmentionDirection(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Parses either the storage code ({@code "incoming"}) or the constant name ({@code "IN"}).
   *
   * @param raw the raw value
   * @return the matching direction
   * @throws IllegalArgumentException if nothing matches
   */
  public static WebmentionDirection fromCode(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("direction cannot be null");
    }
    String value = raw.trim();
    for (WebmentionDirection direction : values()) {
      if (direction.code.equalsIgnoreCase(value) || direction.name().equalsIgnoreCase(value)) {
        return direction;
      }
    }
    throw new IllegalArgumentException("Unknown direction: " + raw);
  }
}
