package com.sayou.fabric.adapters.transform;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.AbstractTransformer;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.exception.InitializationException;
import com.sayou.fabric.model.ContentBlock;
import com.sayou.fabric.registry.Role;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cuts {@code content_block} atoms into {@code chunk} atoms of at most {@code chunk_size}
 * characters, consecutive chunks sharing {@code chunk_overlap} characters. Sentence boundaries
 * are ignored.
 *
 * <p>Chunk ids are {@code <source>:part_<n>}; each chunk's metadata carries the block metadata
 * plus {@code chunk_id}, {@code part_index}, {@code parent_id} (the block source) and {@code
 * semantic_type} (the block type).
 */
public class FixedLengthSplitter extends AbstractTransformer {
  public static final String NAME = "fixed_length";
  public static final String CHUNK_TYPE = "chunk";

  private int chunkSize;
  private int chunkOverlap;

  public FixedLengthSplitter() {
    super(NAME, Role.SPLITTER);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    chunkSize = options.getInt("chunk_size", 1000);
    chunkOverlap = options.getInt("chunk_overlap", 0);
    if (chunkSize < 1) {
      throw new InitializationException("chunk_size must be positive but was " + chunkSize);
    }
    if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new InitializationException(
          "chunk_overlap must be in [0, chunk_size) but was " + chunkOverlap);
    }
  }

  @Override
  protected List<Atom> doTransform(List<Atom> atoms) {
    List<Atom> out = new ArrayList<>();
    for (Atom atom : atoms) {
      if (atom.isType(ContentBlock.ATOM_TYPE)) {
        split(atom, ContentBlock.fromAtom(atom), out);
      } else {
        out.add(atom);
      }
    }
    return out;
  }

  private void split(Atom atom, ContentBlock block, List<Atom> out) {
    String content = block.contentAsText();
    int step = chunkSize - chunkOverlap;
    int part = 0;
    for (int start = 0; start < content.length(); start += step) {
      String piece = content.substring(start, Math.min(content.length(), start + chunkSize));
      String chunkId = atom.source() + ":part_" + part;

      Map<String, Object> metadata = new LinkedHashMap<>(block.metadata());
      metadata.put("chunk_id", chunkId);
      metadata.put("part_index", part);
      metadata.put("parent_id", atom.source());
      metadata.put("semantic_type", block.type());

      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("chunk_id", chunkId);
      payload.put("content", piece);
      payload.put("part_index", part);
      payload.put("metadata", metadata);
      out.add(atom.derive(CHUNK_TYPE, payload));
      part++;
      if (start + chunkSize >= content.length()) break;
    }
  }
}
