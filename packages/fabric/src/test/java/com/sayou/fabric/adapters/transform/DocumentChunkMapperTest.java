package com.sayou.fabric.adapters.transform;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.model.GraphNode;
import com.sayou.fabric.model.Vocabulary;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentChunkMapperTest {

  @Test
  void oneDocumentNodePerParentAndOneFragmentPerChunk() {
    DocumentChunkMapper mapper = mapper(Map.of());
    List<Atom> chunks =
        List.of(
            chunk("r.pdf", 0, "text", "Intro"),
            chunk("r.pdf", 1, "table", "| a | b |"),
            chunk("s.pdf", 0, "code_block", "x = 1"));

    List<GraphNode> nodes = nodes(mapper.transform(chunks));

    List<GraphNode> documents =
        nodes.stream().filter(n -> Vocabulary.CLASS_DOCUMENT.equals(n.nodeClass())).toList();
    assertEquals(
        List.of("sayou:doc:r.pdf", "sayou:doc:s.pdf"),
        documents.stream().map(GraphNode::nodeId).toList());
    assertEquals("Report", documents.get(0).friendlyName());

    GraphNode table = byId(nodes, "sayou:doc:r.pdf:part_1");
    assertEquals(Vocabulary.CLASS_TABLE, table.nodeClass());
    assertEquals(List.of("sayou:doc:r.pdf"), table.targets(Vocabulary.HAS_PARENT));
    assertEquals("| a | b |", table.attributes().get(Vocabulary.ATTR_TEXT));
    assertEquals(Vocabulary.CLASS_CODE, byId(nodes, "sayou:doc:s.pdf:part_0").nodeClass());
  }

  @Test
  void consecutiveFragmentsAreChained() {
    List<GraphNode> nodes =
        nodes(
            mapper(Map.of())
                .transform(List.of(chunk("r", 0, "text", "a"), chunk("r", 1, "text", "b"))));

    // the next edge arrives as a partial node for the earlier fragment
    assertTrue(
        nodes.stream()
            .anyMatch(
                n ->
                    n.nodeId().equals("sayou:doc:r:part_0")
                        && n.targets(Vocabulary.NEXT).equals(List.of("sayou:doc:r:part_1"))));
  }

  @Test
  void chainingCanBeDisabled() {
    List<GraphNode> nodes =
        nodes(
            mapper(Map.of("link_next", false))
                .transform(List.of(chunk("r", 0, "text", "a"), chunk("r", 1, "text", "b"))));
    assertTrue(nodes.stream().allMatch(n -> n.targets(Vocabulary.NEXT).isEmpty()));
    assertEquals(3, nodes.size());
  }

  @Test
  void headersBecomeTopics() {
    Atom header =
        Atom.create(
            "r",
            FixedLengthSplitter.CHUNK_TYPE,
            Map.of(
                "chunk_id", "r:h",
                "content", "Chapter 1",
                "metadata", Map.of("parent_id", "r", "is_header", true, "semantic_type", "text")));
    GraphNode node = byId(nodes(mapper(Map.of()).transform(List.of(header))), "sayou:doc:r:h");
    assertEquals(Vocabulary.CLASS_TOPIC, node.nodeClass());
  }

  private static DocumentChunkMapper mapper(Map<String, Object> options) {
    DocumentChunkMapper mapper = new DocumentChunkMapper();
    mapper.initialize(ComponentOptions.of(options));
    return mapper;
  }

  private static Atom chunk(String parent, int part, String semanticType, String content) {
    String chunkId = parent + ":part_" + part;
    return Atom.create(
        parent,
        FixedLengthSplitter.CHUNK_TYPE,
        Map.of(
            "chunk_id", chunkId,
            "content", content,
            "part_index", part,
            "metadata",
                Map.of(
                    "chunk_id", chunkId,
                    "parent_id", parent,
                    "semantic_type", semanticType,
                    "title", "Report",
                    "source", parent)));
  }

  private static List<GraphNode> nodes(List<Atom> atoms) {
    atoms.forEach(a -> assertEquals(GraphNode.ATOM_TYPE, a.type()));
    return atoms.stream().map(a -> GraphNode.fromPayload(a.payload())).toList();
  }

  private static GraphNode byId(List<GraphNode> nodes, String id) {
    return nodes.stream()
        .filter(n -> n.nodeId().equals(id) && n.nodeClass() != null)
        .findFirst()
        .orElseThrow();
  }
}
