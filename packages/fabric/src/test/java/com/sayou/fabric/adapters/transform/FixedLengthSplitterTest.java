package com.sayou.fabric.adapters.transform;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.exception.InitializationException;
import com.sayou.fabric.model.ContentBlock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FixedLengthSplitterTest {

  @Test
  void cutsWithOverlapAndCarriesMetadata() {
    FixedLengthSplitter splitter = splitter(Map.of("chunk_size", 4, "chunk_overlap", 1));
    Atom block = ContentBlock.text("abcdefghij", Map.of("title", "T")).toAtom("doc");

    List<Atom> chunks = splitter.transform(List.of(block));

    assertEquals(
        List.of("abcd", "defg", "ghij"),
        chunks.stream().map(a -> a.payloadText("content")).toList());
    Map<?, ?> meta = (Map<?, ?>) chunks.get(1).payload().get("metadata");
    assertEquals("doc:part_1", meta.get("chunk_id"));
    assertEquals(1, meta.get("part_index"));
    assertEquals("doc", meta.get("parent_id"));
    assertEquals("text", meta.get("semantic_type"));
    assertEquals("T", meta.get("title"));
    assertEquals(FixedLengthSplitter.CHUNK_TYPE, chunks.get(0).type());
  }

  @Test
  void shortTextIsOneChunkAndEmptyTextNone() {
    FixedLengthSplitter splitter = splitter(Map.of("chunk_size", 100));
    Atom small = ContentBlock.text("short", null).toAtom("a");
    Atom empty = ContentBlock.text("", null).toAtom("b");

    List<Atom> chunks = splitter.transform(List.of(small, empty));

    assertEquals(1, chunks.size());
    assertEquals("a:part_0", chunks.get(0).payloadText("chunk_id"));
  }

  @Test
  void invalidSizesAreRejectedAtInitialization() {
    assertThrows(InitializationException.class, () -> splitter(Map.of("chunk_size", 0)));
    assertThrows(
        InitializationException.class,
        () -> splitter(Map.of("chunk_size", 10, "chunk_overlap", 10)));
  }

  private static FixedLengthSplitter splitter(Map<String, Object> options) {
    FixedLengthSplitter splitter = new FixedLengthSplitter();
    splitter.initialize(ComponentOptions.of(options));
    return splitter;
  }
}
