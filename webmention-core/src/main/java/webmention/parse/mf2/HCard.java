package webmention.parse.mf2;

/**
 * Author identity taken from an {@code h-card}, or from a bare author URL or name.
 */
public record HCard(String name, String url, String photo) {

  public boolean isEmpty() {
    return name == null && url == null && photo == null;
  }
}
