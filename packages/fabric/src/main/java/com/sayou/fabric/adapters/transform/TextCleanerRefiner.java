package com.sayou.fabric.adapters.transform;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.AbstractTransformer;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.model.ContentBlock;
import com.sayou.fabric.registry.Role;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans the text of {@code document} atoms and emits one {@code content_block} atom per
 * document. Horizontal whitespace runs become a single space, lines are trimmed and runs of blank
 * lines collapse into one.
 *
 * <p>Options: {@code strip_urls} (default false) removes http(s) URLs, {@code min_length} (default
 * 1) drops documents whose cleaned text is shorter.
 */
public class TextCleanerRefiner extends AbstractTransformer {
  public static final String NAME = "text_cleaner";

  private static final Pattern URL = Pattern.compile("https?://\\S+");
  private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f]+");
  private static final Pattern BLANK_LINES = Pattern.compile("\n{3,}");

  private boolean stripUrls;
  private int minLength;

  public TextCleanerRefiner() {
    super(NAME, Role.REFINER);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    stripUrls = options.getBoolean("strip_urls", false);
    minLength = Math.max(1, options.getInt("min_length", 1));
  }

  @Override
  protected List<Atom> doTransform(List<Atom> atoms) {
    List<Atom> out = new ArrayList<>(atoms.size());
    for (Atom atom : atoms) {
      if (!atom.isType(AutoParser.DOCUMENT_TYPE)) {
        out.add(atom);
        continue;
      }
      String text = clean(atom.payloadText("text"));
      if (text.length() < minLength) continue;

      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("source", atom.payloadText("identifier"));
      metadata.put("title", atom.payloadText("title"));
      metadata.put("media_type", atom.payloadText("media_type"));
      out.add(ContentBlock.text(text, metadata).toAtom(atom.source()));
    }
    return out;
  }

  String clean(String text) {
    if (text == null) return "";
    String s = text.replace('\u00A0', ' ').replace("\r\n", "\n").replace('\r', '\n');
    if (stripUrls) s = URL.matcher(s).replaceAll("");
    StringBuilder sb = new StringBuilder(s.length());
    for (String line : s.split("\n", -1)) {
      sb.append(HORIZONTAL_SPACE.matcher(line).replaceAll(" ").strip()).append('\n');
    }
    return BLANK_LINES.matcher(sb).replaceAll("\n\n").strip();
  }
}
