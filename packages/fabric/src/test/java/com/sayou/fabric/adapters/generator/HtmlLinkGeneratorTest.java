package com.sayou.fabric.adapters.generator;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.component.RawPayload;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HtmlLinkGeneratorTest {

  private static final String PAGE =
      "<html><body>"
          + "<a href=\"/docs/intro#setup\">intro</a>"
          + "<a href=\"guide.html\">guide</a>"
          + "<a href=\"/docs/intro\">again</a>"
          + "<a href=\"https://other.org/x\">elsewhere</a>"
          + "<a href=\"mailto:team@example.com\">mail</a>"
          + "<a>no href</a>"
          + "</body></html>";

  @Test
  void resolvesFiltersAndDeduplicates() {
    HtmlLinkGenerator generator = new HtmlLinkGenerator();
    generator.initialize(ComponentOptions.empty());

    List<String> links =
        generator.generate(RawPayload.of("https://example.com/docs/index.html", "text/html", PAGE));

    assertEquals(
        List.of("https://example.com/docs/intro", "https://example.com/docs/guide.html"), links);
  }

  @Test
  void otherHostsWhenAllowedAndCapped() {
    HtmlLinkGenerator generator = new HtmlLinkGenerator();
    generator.initialize(ComponentOptions.of(Map.of("same_host_only", false, "max_links", 3)));

    List<String> links =
        generator.generate(RawPayload.of("https://example.com/docs/index.html", "text/html", PAGE));

    assertEquals(
        List.of(
            "https://example.com/docs/intro",
            "https://example.com/docs/guide.html",
            "https://other.org/x"),
        links);
  }

  @Test
  void nonHtmlAndEmptyPayloadsYieldNothing() {
    HtmlLinkGenerator generator = new HtmlLinkGenerator();
    generator.initialize(ComponentOptions.empty());

    assertEquals(List.of(), generator.generate(RawPayload.of("a.json", "application/json", "{}")));
    assertEquals(List.of(), generator.generate(RawPayload.empty("https://example.com")));
  }

  @Test
  void sniffsHtmlWithoutMediaType() {
    assertTrue(HtmlLinkGenerator.isHtml(RawPayload.of("x", null, "  <!DOCTYPE html><html>")));
    assertFalse(HtmlLinkGenerator.isHtml(RawPayload.of("x", null, "plain text")));
  }

  @Test
  void noneGeneratorNeverDiscovers() {
    NoneGenerator generator = new NoneGenerator();
    generator.initialize(ComponentOptions.empty());
    assertEquals(List.of(), generator.generate(RawPayload.of("x", "text/html", PAGE)));
  }
}
