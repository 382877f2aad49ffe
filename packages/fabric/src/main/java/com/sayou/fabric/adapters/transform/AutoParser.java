package com.sayou.fabric.adapters.transform;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.AbstractTransformer;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.exception.SerializationException;
import com.sayou.fabric.registry.Role;
import com.sayou.fabric.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Turns {@code raw} atoms into {@code document} atoms, choosing the format from the media type
 * and, when it is missing, from the content itself:
 *
 * <ul>
 *   <li>HTML: boilerplate elements are removed and the text of the main content element (or of
 *       the body) is kept, one line per child element;
 *   <li>JSON: re-indented;
 *   <li>anything else: taken as is.
 * </ul>
 *
 * Options: {@code remove_selectors} (CSS selectors dropped from HTML before extraction), {@code
 * content_selectors} (candidates for the main content element, first match wins). Atoms of other
 * types pass through unchanged.
 */
public class AutoParser extends AbstractTransformer {
  public static final String NAME = "auto";
  public static final String DOCUMENT_TYPE = "document";

  private static final String DEFAULT_REMOVE = "script,noscript,style,header,footer,nav,aside";
  private static final String DEFAULT_CONTENT =
      "article, main, #content, .post, .entry-content, .article, .post-body, .content";

  private String removeSelectors = DEFAULT_REMOVE;
  private String contentSelectors = DEFAULT_CONTENT;

  public AutoParser() {
    super(NAME, Role.PARSER);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    removeSelectors = options.getString("remove_selectors", DEFAULT_REMOVE);
    contentSelectors = options.getString("content_selectors", DEFAULT_CONTENT);
  }

  @Override
  protected List<Atom> doTransform(List<Atom> atoms) {
    List<Atom> out = new ArrayList<>(atoms.size());
    for (Atom atom : atoms) {
      out.add(atom.isType("raw") ? parse(atom) : atom);
    }
    return out;
  }

  private Atom parse(Atom raw) {
    String identifier = String.valueOf(raw.payload().getOrDefault("identifier", raw.source()));
    String mediaType = raw.payloadText("media_type");
    Object content = raw.payload().get("content");

    String title = fileName(identifier);
    String text;
    String format;
    if (content instanceof Map<?, ?> || content instanceof Collection<?>) {
      format = "application/json";
      text = JacksonUtility.toPrettyJson(content);
    } else {
      String body = asText(content);
      if (isHtml(mediaType, body)) {
        format = "text/html";
        Document doc = Jsoup.parse(body, identifier);
        if (!doc.title().isBlank()) title = doc.title().trim();
        text = extractText(doc);
      } else if (isJson(mediaType, body)) {
        format = "application/json";
        text = prettyJson(body);
      } else {
        format = mediaType == null ? "text/plain" : mediaType;
        text = body;
      }
    }

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("identifier", identifier);
    payload.put("media_type", format);
    payload.put("title", title);
    payload.put("text", text);
    return raw.derive(DOCUMENT_TYPE, payload);
  }

  private String extractText(Document doc) {
    if (!removeSelectors.isBlank()) doc.select(removeSelectors).remove();
    Element root = contentSelectors.isBlank() ? null : doc.selectFirst(contentSelectors);
    if (root == null) root = doc.body();
    if (root.children().isEmpty()) return clean(root.text());
    return root.children().stream()
        .map(Element::text)
        .map(AutoParser::clean)
        .filter(t -> !t.isEmpty())
        .collect(Collectors.joining("\n"));
  }

  private static String prettyJson(String body) {
    try {
      return JacksonUtility.toPrettyJson(JacksonUtility.readTree(body));
    } catch (SerializationException e) {
      return body;
    }
  }

  private static String clean(String text) {
    return text.replace('\u00A0', ' ').trim();
  }

  private static String asText(Object content) {
    if (content == null) return "";
    if (content instanceof byte[] bytes) return new String(bytes, StandardCharsets.UTF_8);
    return content.toString();
  }

  private static boolean isHtml(String mediaType, String body) {
    if (mediaType != null) return mediaType.contains("html");
    String head = head(body);
    return head.startsWith("<!doctype html") || head.startsWith("<html");
  }

  private static boolean isJson(String mediaType, String body) {
    if (mediaType != null) return mediaType.contains("json");
    String head = head(body);
    return head.startsWith("{") || head.startsWith("[");
  }

  private static String head(String body) {
    String s = body.stripLeading();
    return s.substring(0, Math.min(64, s.length())).toLowerCase(Locale.ROOT);
  }

  private static String fileName(String identifier) {
    String id = identifier;
    int query = id.indexOf('?');
    if (query >= 0) id = id.substring(0, query);
    while (id.endsWith("/")) id = id.substring(0, id.length() - 1);
    int slash = Math.max(id.lastIndexOf('/'), id.lastIndexOf('\\'));
    return slash < 0 || slash == id.length() - 1 ? id : id.substring(slash + 1);
  }
}
