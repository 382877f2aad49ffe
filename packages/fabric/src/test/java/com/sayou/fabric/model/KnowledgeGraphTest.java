package com.sayou.fabric.model;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.exception.SchemaException;
import com.sayou.fabric.exception.StateException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KnowledgeGraphTest {

  @Test
  @DisplayName("adding an existing id merges attributes and concatenates relationships")
  void mergeOnDuplicateId() {
    KnowledgeGraph graph = new KnowledgeGraph();
    graph.addNode(
        new GraphNode(
            "n1",
            "sayou:TextFragment",
            "first",
            Map.of("a", 1, "b", "old"),
            Map.of("p", List.of("x"))));
    graph.addNode(
        new GraphNode(
            "n1", null, null, Map.of("b", "new", "c", true), Map.of("p", List.of("x", "y"))));

    GraphNode merged = graph.getNode("n1").orElseThrow();
    assertEquals(1, graph.size());
    assertEquals("sayou:TextFragment", merged.nodeClass());
    assertEquals("first", merged.friendlyName());
    assertEquals(Map.of("a", 1, "b", "new", "c", true), merged.attributes());
    // duplicates are kept
    assertEquals(List.of("x", "x", "y"), merged.targets("p"));
    assertEquals(3, graph.edgeCount());
  }

  @Test
  void newerClassAndNameWin() {
    KnowledgeGraph graph = new KnowledgeGraph();
    graph.addNode(new GraphNode("n", "old", "old name", null, null));
    graph.addNode(new GraphNode("n", "new", "new name", null, null));
    GraphNode node = graph.getNode("n").orElseThrow();
    assertEquals("new", node.nodeClass());
    assertEquals("new name", node.friendlyName());
  }

  @Test
  void nodesKeepInsertionOrder() {
    KnowledgeGraph graph = new KnowledgeGraph();
    graph.addNode(GraphNode.of("b", "c"));
    graph.addNode(GraphNode.of("a", "c"));
    graph.addNode(GraphNode.of("b", "c"));
    assertEquals(List.of("b", "a"), graph.nodes().stream().map(GraphNode::nodeId).toList());
  }

  @Test
  @DisplayName("a frozen graph rejects additions")
  void frozenGraphRejectsAdditions() {
    KnowledgeGraph graph = new KnowledgeGraph();
    graph.addNode(GraphNode.of("a", "c"));
    graph.freeze();

    assertTrue(graph.isFrozen());
    assertThrows(StateException.class, () -> graph.addNode(GraphNode.of("b", "c")));
    assertEquals(1, graph.size());
  }

  @Test
  void toMapCarriesSummary() {
    KnowledgeGraph graph = new KnowledgeGraph();
    graph.addNode(new GraphNode("a", "c", null, null, Map.of("p", List.of("b"))));
    graph.addNode(GraphNode.of("b", "c"));

    Map<String, Object> map = graph.toMap();
    assertEquals(Map.of("node_count", 2, "edge_count", 1), map.get("summary"));
    assertTrue(((Map<?, ?>) map.get("entities")).containsKey("a"));
  }

  @Test
  void payloadAcceptsSingleTarget() {
    GraphNode node =
        GraphNode.fromPayload(
            Map.of("node_id", "a", "node_class", "c", "relationships", Map.of("p", "b")));
    assertEquals(List.of("b"), node.targets("p"));
    assertEquals(node, GraphNode.fromPayload(node.toPayload()));
  }

  @Test
  void payloadWithoutIdIsRejected() {
    assertThrows(SchemaException.class, () -> GraphNode.fromPayload(Map.of("node_class", "c")));
  }

  @Test
  void mergingDifferentIdsIsAnError() {
    assertThrows(
        IllegalArgumentException.class, () -> GraphNode.of("a", "c").merge(GraphNode.of("b", "c")));
  }
}
