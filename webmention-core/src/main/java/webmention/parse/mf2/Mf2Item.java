package webmention.parse.mf2;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One parsed microformats2 object such as an {@code h-entry} or {@code h-card}.
 *
 * <p>Property values are {@link String}, {@link Mf2Html} or a nested {@link Mf2Item}.
 * A nested item used as a property carries a {@code value}: its name for {@code p-*}
 * properties, its url for {@code u-*} properties.
 */
public final class Mf2Item {
  private final List<String> types;
  private final Map<String, List<Object>> properties;
  private final List<Mf2Item> children;
  private final String value;

  Mf2Item(List<String> types, Map<String, List<Object>> properties, List<Mf2Item> children,
      String value) {
    this.types = List.copyOf(types);
    Map<String, List<Object>> copy = new LinkedHashMap<>();
    properties.forEach((name, values) -> copy.put(name, List.copyOf(values)));
    this.properties = Collections.unmodifiableMap(copy);
    this.children = List.copyOf(children);
    this.value = value;
  }

  public List<String> types() {
    return types;
  }

  public Map<String, List<Object>> properties() {
    return properties;
  }

  public List<Mf2Item> children() {
    return children;
  }

  public String value() {
    return value;
  }

  public boolean hasType(String type) {
    return types.contains(type);
  }

  public List<Object> values(String property) {
    return properties.getOrDefault(property, List.of());
  }

  /**
   * Returns the first value of a property flattened to a string: plain strings as is,
   * HTML values as their text, nested items as their {@code value} or first url.
   *
   * @param property the property name without prefix, e.g. {@code "name"}
   * @return the string, or {@code null} if absent
   */
  public String first(String property) {
    for (Object candidate : values(property)) {
      String text = asString(candidate);
      if (text != null && !text.isEmpty()) {
        return text;
      }
    }
    return null;
  }

  /**
   * Returns every value of a property flattened to strings, skipping empty ones.
   *
   * @param property the property name
   * @return the strings, possibly empty
   */
  public List<String> strings(String property) {
    return values(property).stream()
        .map(Mf2Item::asString)
        .filter(s -> s != null && !s.isEmpty())
        .toList();
  }

  /**
   * Returns the first nested item of a property that has the given type.
   *
   * @param property the property name
   * @param type     the required type, e.g. {@code "h-card"}
   * @return the item, or {@code null}
   */
  public Mf2Item firstItem(String property, String type) {
    for (Object candidate : values(property)) {
      if (candidate instanceof Mf2Item item && (type == null || item.hasType(type))) {
        return item;
      }
    }
    return null;
  }

  static String asString(Object value) {
    if (value instanceof String s) {
      return s;
    }
    if (value instanceof Mf2Html html) {
      return html.text();
    }
    if (value instanceof Mf2Item item) {
      if (item.value != null && !item.value.isEmpty()) {
        return item.value;
      }
      return item.first("url");
    }
    return null;
  }

  @Override
  public String toString() {
    return "Mf2Item{types=" + types + ", properties=" + properties.keySet() + '}';
  }
}
