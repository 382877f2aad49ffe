package com.sayou.fabric.adapters.generator;

import com.sayou.fabric.component.AbstractGenerator;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.component.RawPayload;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Follows the {@code a[href]} links of HTML payloads.
 *
 * <p>Links are resolved against {@code base_url} (default: the fetched identifier), fragments are
 * dropped and only {@code http}/{@code https} targets are kept. With {@code same_host_only}
 * (default true) links leaving the host of the fetched page are ignored. {@code max_links} (default
 * 0, unbounded) caps the links taken from one page.
 */
public class HtmlLinkGenerator extends AbstractGenerator {
  public static final String NAME = "html_link";

  private String baseUrl;
  private boolean sameHostOnly;
  private int maxLinks;

  public HtmlLinkGenerator() {
    super(NAME);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    baseUrl = options.getString("base_url");
    sameHostOnly = options.getBoolean("same_host_only", true);
    maxLinks = options.getInt("max_links", 0);
  }

  @Override
  protected List<String> doGenerate(RawPayload payload) {
    if (!isHtml(payload)) return List.of();
    String base = baseUrl == null || baseUrl.isBlank() ? payload.identifier() : baseUrl;
    String host = host(payload.identifier());

    Document doc = Jsoup.parse(payload.text(), base);
    Set<String> links = new LinkedHashSet<>();
    for (Element a : doc.select("a[href]")) {
      String link = normalize(a.absUrl("href"));
      if (link == null) continue;
      if (sameHostOnly && host != null && !host.equalsIgnoreCase(host(link))) continue;
      links.add(link);
      if (maxLinks > 0 && links.size() >= maxLinks) break;
    }
    return List.copyOf(links);
  }

  static boolean isHtml(RawPayload payload) {
    String type = payload.mediaType();
    if (type != null) return type.contains("html");
    String head = payload.text().stripLeading();
    head = head.substring(0, Math.min(64, head.length())).toLowerCase(Locale.ROOT);
    return head.startsWith("<!doctype html") || head.startsWith("<html");
  }

  private static String normalize(String url) {
    if (url == null || url.isBlank()) return null;
    int hash = url.indexOf('#');
    String link = hash < 0 ? url : url.substring(0, hash);
    try {
      String scheme = new URI(link).getScheme();
      if (scheme == null) return null;
      scheme = scheme.toLowerCase(Locale.ROOT);
      return scheme.equals("http") || scheme.equals("https") ? link : null;
    } catch (URISyntaxException e) {
      return null;
    }
  }

  private static String host(String url) {
    try {
      return new URI(url.trim()).getHost();
    } catch (URISyntaxException e) {
      return null;
    }
  }
}
