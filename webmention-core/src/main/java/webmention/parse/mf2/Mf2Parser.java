package webmention.parse.mf2;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import webmention.util.Urls;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Microformats2 parser over a jsoup {@link Document}.
 *
 * <p>Covers root discovery, the {@code p-}, {@code u-}, {@code dt-} and {@code e-} property
 * prefixes, nested items as properties or children, and the implied {@code name},
 * {@code photo} and {@code url} rules. Backcompat (microformats1) class names and the
 * value-class pattern are not supported.
 *
 * <p>Stateless and thread-safe.
 */
public final class Mf2Parser {
  private static final Pattern ROOT_CLASS = Pattern.compile("h(-[a-z0-9]+)?(-[a-z]+)+");
  private static final Pattern PROPERTY_CLASS = Pattern.compile("(p|u|dt|e)((-[a-z0-9]+)?(-[a-z]+)+)");

  /**
   * Parses every top-level item of a document.
   *
   * @param document the parsed page
   * @param baseUrl  the page URL, used to resolve {@code u-*} values
   * @return the items, never {@code null}
   */
  public Mf2Document parse(Document document, String baseUrl) {
    if (document == null) {
      return Mf2Document.EMPTY;
    }
    List<Mf2Item> items = new ArrayList<>();
    collectRoots(document, baseUrl, items);
    return new Mf2Document(items);
  }

  private void collectRoots(Element element, String baseUrl, List<Mf2Item> out) {
    for (Element child : element.children()) {
      if (!rootTypes(child).isEmpty()) {
        out.add(parseItem(child, baseUrl));
      } else {
        collectRoots(child, baseUrl, out);
      }
    }
  }

  private Mf2Item parseItem(Element root, String baseUrl) {
    Map<String, List<Object>> properties = new LinkedHashMap<>();
    List<Mf2Item> children = new ArrayList<>();
    boolean[] explicit = new boolean[3]; // p/e, u, any nested item
    walk(root, baseUrl, properties, children, explicit);

    if (!properties.containsKey("name") && !explicit[0] && !explicit[2]) {
      String implied = impliedName(root);
      if (implied != null && !implied.isEmpty()) {
        properties.put("name", new ArrayList<>(List.of(implied)));
      }
    }
    if (!properties.containsKey("photo") && !explicit[1]) {
      String photo = impliedPhoto(root, baseUrl);
      if (photo != null) {
        properties.put("photo", new ArrayList<>(List.of(photo)));
      }
    }
    if (!properties.containsKey("url") && !explicit[1]) {
      String url = impliedUrl(root, baseUrl);
      if (url != null) {
        properties.put("url", new ArrayList<>(List.of(url)));
      }
    }
    return new Mf2Item(rootTypes(root), properties, children, null);
  }

  private void walk(Element parent, String baseUrl, Map<String, List<Object>> properties,
      List<Mf2Item> children, boolean[] explicit) {
    for (Element child : parent.children()) {
      List<String> types = rootTypes(child);
      List<String[]> props = propertyClasses(child);
      if (!types.isEmpty()) {
        explicit[2] = true;
        Mf2Item nested = parseItem(child, baseUrl);
        if (props.isEmpty()) {
          children.add(nested);
          continue;
        }
        for (String[] prop : props) {
          markExplicit(prop[0], explicit);
          String value = switch (prop[0]) {
            case "u" -> firstNonEmpty(nested.first("url"), urlValue(child, baseUrl));
            case "p" -> firstNonEmpty(nested.first("name"), text(child));
            default -> text(child);
          };
          Mf2Item withValue = new Mf2Item(nested.types(), nested.properties(), nested.children(), value);
          add(properties, prop[1], withValue);
        }
        continue;
      }
      for (String[] prop : props) {
        markExplicit(prop[0], explicit);
        switch (prop[0]) {
          case "p" -> add(properties, prop[1], textValue(child));
          case "u" -> add(properties, prop[1], urlValue(child, baseUrl));
          case "dt" -> add(properties, prop[1], dateValue(child));
          case "e" -> add(properties, prop[1], new Mf2Html(text(child), child.html().trim()));
          default -> {
          }
        }
      }
      walk(child, baseUrl, properties, children, explicit);
    }
  }

  private static void markExplicit(String prefix, boolean[] explicit) {
    if (prefix.equals("p") || prefix.equals("e")) {
      explicit[0] = true;
    } else if (prefix.equals("u")) {
      explicit[1] = true;
    }
  }

  private static void add(Map<String, List<Object>> properties, String name, Object value) {
    if (value != null) {
      properties.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
    }
  }

  static List<String> rootTypes(Element element) {
    List<String> types = new ArrayList<>();
    for (String cls : element.classNames()) {
      if (ROOT_CLASS.matcher(cls).matches()) {
        types.add(cls);
      }
    }
    types.sort(null);
    return types;
  }

  private static List<String[]> propertyClasses(Element element) {
    List<String[]> props = new ArrayList<>();
    for (String cls : element.classNames()) {
      Matcher m = PROPERTY_CLASS.matcher(cls);
      if (m.matches()) {
        props.add(new String[] {m.group(1), m.group(2).substring(1)});
      }
    }
    return props;
  }

  private static String textValue(Element el) {
    String tag = el.normalName();
    if ((tag.equals("abbr") || tag.equals("link")) && el.hasAttr("title")) {
      return el.attr("title");
    }
    if ((tag.equals("data") || tag.equals("input")) && el.hasAttr("value")) {
      return el.attr("value");
    }
    if ((tag.equals("img") || tag.equals("area")) && el.hasAttr("alt")) {
      return el.attr("alt");
    }
    return text(el);
  }

  private static String urlValue(Element el, String baseUrl) {
    String tag = el.normalName();
    String raw = null;
    if ((tag.equals("a") || tag.equals("area") || tag.equals("link")) && el.hasAttr("href")) {
      raw = el.attr("href");
    } else if ((tag.equals("img") || tag.equals("audio") || tag.equals("video") || tag.equals("source")
        || tag.equals("iframe")) && el.hasAttr("src")) {
      raw = el.attr("src");
    } else if (tag.equals("video") && el.hasAttr("poster")) {
      raw = el.attr("poster");
    } else if (tag.equals("object") && el.hasAttr("data")) {
      raw = el.attr("data");
    } else if (tag.equals("abbr") && el.hasAttr("title")) {
      raw = el.attr("title");
    } else if ((tag.equals("data") || tag.equals("input")) && el.hasAttr("value")) {
      raw = el.attr("value");
    }
    if (raw == null) {
      String text = text(el);
      if (text.isEmpty()) {
        return null;
      }
      raw = text;
    }
    String resolved = Urls.resolve(baseUrl, raw);
    return resolved != null ? resolved : raw.trim();
  }

  private static String dateValue(Element el) {
    String tag = el.normalName();
    if ((tag.equals("time") || tag.equals("ins") || tag.equals("del")) && el.hasAttr("datetime")) {
      return el.attr("datetime").trim();
    }
    if (tag.equals("abbr") && el.hasAttr("title")) {
      return el.attr("title").trim();
    }
    if ((tag.equals("data") || tag.equals("input")) && el.hasAttr("value")) {
      return el.attr("value").trim();
    }
    return text(el);
  }

  private static String impliedName(Element root) {
    String tag = root.normalName();
    if ((tag.equals("img") || tag.equals("area")) && root.hasAttr("alt")) {
      return root.attr("alt");
    }
    if (tag.equals("abbr") && root.hasAttr("title")) {
      return root.attr("title");
    }
    Element only = onlyChild(root);
    if (only != null && rootTypes(only).isEmpty()) {
      if (only.normalName().equals("img") && only.hasAttr("alt")) {
        return only.attr("alt");
      }
      if (only.normalName().equals("abbr") && only.hasAttr("title")) {
        return only.attr("title");
      }
    }
    return text(root);
  }

  private static String impliedPhoto(Element root, String baseUrl) {
    String tag = root.normalName();
    if (tag.equals("img") && root.hasAttr("src")) {
      return Urls.resolve(baseUrl, root.attr("src"));
    }
    if (tag.equals("object") && root.hasAttr("data")) {
      return Urls.resolve(baseUrl, root.attr("data"));
    }
    Element img = onlyOfType(root, "img");
    if (img != null && img.hasAttr("src") && rootTypes(img).isEmpty()) {
      return Urls.resolve(baseUrl, img.attr("src"));
    }
    Element only = onlyChild(root);
    if (only != null && rootTypes(only).isEmpty()) {
      Element nestedImg = onlyOfType(only, "img");
      if (nestedImg != null && nestedImg.hasAttr("src") && rootTypes(nestedImg).isEmpty()) {
        return Urls.resolve(baseUrl, nestedImg.attr("src"));
      }
    }
    return null;
  }

  private static String impliedUrl(Element root, String baseUrl) {
    String tag = root.normalName();
    if ((tag.equals("a") || tag.equals("area")) && root.hasAttr("href")) {
      return Urls.resolve(baseUrl, root.attr("href"));
    }
    for (String linkTag : new String[] {"a", "area"}) {
      Element link = onlyOfType(root, linkTag);
      if (link != null && link.hasAttr("href") && rootTypes(link).isEmpty()) {
        return Urls.resolve(baseUrl, link.attr("href"));
      }
    }
    return null;
  }

  private static Element onlyChild(Element element) {
    return element.childrenSize() == 1 ? element.child(0) : null;
  }

  private static Element onlyOfType(Element element, String tag) {
    Element found = null;
    for (Element child : element.children()) {
      if (child.normalName().equals(tag)) {
        if (found != null) {
          return null;
        }
        found = child;
      }
    }
    return found;
  }

  private static String text(Element el) {
    return el.text().trim();
  }

  private static String firstNonEmpty(String a, String b) {
    return a != null && !a.isEmpty() ? a : b;
  }
}
