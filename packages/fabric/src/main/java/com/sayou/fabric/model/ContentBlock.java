package com.sayou.fabric.model;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.exception.SchemaException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unit of refined content carried between the refine and chunk stages inside {@code
 * content_block} atoms.
 *
 * @param type block kind, e.g. {@code text}, {@code table}, {@code code}
 * @param content text or structured content
 * @param metadata free form metadata inherited by the chunks cut from this block
 */
public record ContentBlock(String type, Object content, Map<String, Object> metadata) {
  public static final String ATOM_TYPE = "content_block";

  public ContentBlock {
    Objects.requireNonNull(type, "type");
    metadata =
        metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static ContentBlock text(String content, Map<String, Object> metadata) {
    return new ContentBlock("text", content, metadata);
  }

  public String contentAsText() {
    return content == null ? "" : content.toString();
  }

  public Atom toAtom(String source) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", type);
    payload.put("content", content);
    payload.put("metadata", metadata);
    return Atom.create(source, ATOM_TYPE, payload);
  }

  /**
   * @throws SchemaException when the atom is not a content block
   */
  public static ContentBlock fromAtom(Atom atom) {
    if (!atom.isType(ATOM_TYPE)) {
      throw new SchemaException(
          "Expected a '%s' atom but got '%s'".formatted(ATOM_TYPE, atom.type()));
    }
    Object type = atom.payload().get("type");
    return new ContentBlock(
        type == null ? "text" : type.toString(),
        atom.payload().get("content"),
        GraphNode.asMap(atom.payload().get("metadata")));
  }
}
