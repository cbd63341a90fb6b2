package webmention.model;

/**
 * Moderation state of a mention. Only {@link #CONFIRMED} mentions are visible to readers.
 */
public enum WebmentionStatus {
  PENDING(0),
  CONFIRMED(1),
  DELETED(2);

  private final int code;

  WebmentionStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static WebmentionStatus fromCode(int code) {
    for (WebmentionStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown status code: " + code);
  }
}
