package com.sayou.fabric.adapters.transform;

import static com.sayou.fabric.model.Vocabulary.*;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.AbstractTransformer;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.model.GraphNode;
import com.sayou.fabric.registry.Role;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wraps {@code chunk} atoms into {@code node} atoms.
 *
 * <p>Every distinct parent gets one {@code sayou:Document} node; every chunk becomes a fragment
 * node linked to it through {@code sayou:hasParent}. The fragment class follows the chunk's
 * {@code semantic_type}: {@code table}, {@code code_block} and {@code list_item} map to their own
 * classes, headers to {@code sayou:Topic}, everything else to {@code sayou:TextFragment}. With
 * {@code link_next} (default true) consecutive fragments of a document are chained through {@code
 * sayou:next}.
 */
public class DocumentChunkMapper extends AbstractTransformer {
  public static final String NAME = "document_chunk";

  private boolean linkNext;

  public DocumentChunkMapper() {
    super(NAME, Role.MAPPER);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    linkNext = options.getBoolean("link_next", true);
  }

  @Override
  protected List<Atom> doTransform(List<Atom> atoms) {
    List<Atom> out = new ArrayList<>();
    Set<String> documents = new HashSet<>();
    Map<String, String> previousFragment = new HashMap<>();

    for (Atom atom : atoms) {
      if (!atom.isType(FixedLengthSplitter.CHUNK_TYPE)) {
        out.add(atom);
        continue;
      }
      Map<String, Object> meta = metadata(atom);
      String chunkId = text(atom.payload().get("chunk_id"), text(meta.get("chunk_id"), "unknown"));
      String parentId = text(meta.get("parent_id"), null);

      if (parentId != null && documents.add(parentId)) {
        out.add(atom.derive(GraphNode.ATOM_TYPE, documentNode(parentId, meta).toPayload()));
      }

      String semanticType = text(meta.get("semantic_type"), "text");
      Map<String, Object> attributes = new LinkedHashMap<>();
      attributes.put(ATTR_TEXT, text(atom.payload().get("content"), ""));
      attributes.put(ATTR_SEMANTIC_TYPE, semanticType);
      attributes.put(
          ATTR_PART_INDEX, atom.payload().getOrDefault("part_index", meta.get("part_index")));
      attributes.put(ATTR_SOURCE, meta.getOrDefault("source", atom.source()));

      Map<String, List<String>> relationships = new LinkedHashMap<>();
      if (parentId != null) {
        relationships.put(HAS_PARENT, List.of(nodeId(parentId)));
        String previous = previousFragment.put(parentId, nodeId(chunkId));
        if (linkNext && previous != null) {
          // the edge lives on the earlier fragment and merges into it during assembly
          out.add(
              atom.derive(
                  GraphNode.ATOM_TYPE,
                  new GraphNode(previous, null, null, null, Map.of(NEXT, List.of(nodeId(chunkId))))
                      .toPayload()));
        }
      }

      GraphNode fragment =
          new GraphNode(
              nodeId(chunkId),
              fragmentClass(semanticType, meta),
              "DOC_NODE [%s] %s".formatted(semanticType, chunkId),
              attributes,
              relationships);
      out.add(atom.derive(GraphNode.ATOM_TYPE, fragment.toPayload()));
    }
    return out;
  }

  private static GraphNode documentNode(String parentId, Map<String, Object> meta) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put(ATTR_SOURCE, meta.getOrDefault("source", parentId));
    if (meta.get("title") != null) attributes.put(ATTR_TITLE, meta.get("title"));
    if (meta.get("media_type") != null) attributes.put(ATTR_MEDIA_TYPE, meta.get("media_type"));
    String title = text(meta.get("title"), parentId);
    return new GraphNode(nodeId(parentId), CLASS_DOCUMENT, title, attributes, null);
  }

  private static String fragmentClass(String semanticType, Map<String, Object> meta) {
    if (Boolean.TRUE.equals(meta.get("is_header"))) return CLASS_TOPIC;
    return switch (semanticType) {
      case "table" -> CLASS_TABLE;
      case "code_block" -> CLASS_CODE;
      case "list_item" -> CLASS_LIST_ITEM;
      default -> CLASS_TEXT;
    };
  }

  private static Map<String, Object> metadata(Atom atom) {
    Map<String, Object> m = new LinkedHashMap<>();
    if (atom.payload().get("metadata") instanceof Map<?, ?> meta) {
      meta.forEach((k, v) -> m.put(String.valueOf(k), v));
    }
    return m;
  }

  private static String text(Object value, String fallback) {
    return value == null || value.toString().isBlank() ? fallback : value.toString();
  }
}
