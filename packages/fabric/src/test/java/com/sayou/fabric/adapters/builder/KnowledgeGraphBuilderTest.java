package com.sayou.fabric.adapters.builder;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.model.GraphNode;
import com.sayou.fabric.model.KnowledgeGraph;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class KnowledgeGraphBuilderTest {

  @Test
  void foldsNodeAtomsAndLinksBack() {
    KnowledgeGraphBuilder builder = new KnowledgeGraphBuilder();
    builder.initialize(ComponentOptions.empty());
    List<Atom> atoms =
        List.of(
            node(new GraphNode("doc", "sayou:Document", "Doc", null, null)),
            node(fragment("p0", List.of("doc"))),
            node(fragment("p1", List.of("doc", "ghost"))),
            Atom.create("s", "chunk", Map.of("content", "ignored")));

    KnowledgeGraph graph = (KnowledgeGraph) builder.build(atoms);

    assertEquals(3, graph.size());
    GraphNode doc = graph.getNode("doc").orElseThrow();
    assertEquals(List.of("p0", "p1"), doc.targets("rel_by"));
    // targets missing from the graph get no reverse edge and no placeholder node
    assertFalse(graph.contains("ghost"));
    assertFalse(graph.isFrozen());
  }

  @Test
  void reverseLinksAreAddedOnce() {
    KnowledgeGraph graph = new KnowledgeGraph();
    graph.addNode(new GraphNode("a", "c", null, null, Map.of("p", List.of("b", "b"))));
    graph.addNode(GraphNode.of("b", "c"));

    assertEquals(1, KnowledgeGraphBuilder.linkReverse(graph));
    assertEquals(0, KnowledgeGraphBuilder.linkReverse(graph));
    assertEquals(List.of("a"), graph.getNode("b").orElseThrow().targets("p_by"));
  }

  @Test
  void reverseLinkingCanBeDisabled() {
    KnowledgeGraphBuilder builder = new KnowledgeGraphBuilder();
    builder.initialize(ComponentOptions.of(Map.of("link_reverse", "off")));
    KnowledgeGraph graph =
        (KnowledgeGraph)
            builder.build(
                List.of(
                    node(new GraphNode("a", "c", null, null, Map.of("p", List.of("b")))),
                    node(GraphNode.of("b", "c"))));
    assertEquals(1, graph.edgeCount());
  }

  @Test
  void atomListBuilderReturnsTheAtoms() {
    AtomListBuilder builder = new AtomListBuilder();
    builder.initialize(ComponentOptions.empty());
    Atom atom = Atom.create("s", "chunk", Map.of());
    assertEquals(List.of(atom), builder.build(List.of(atom)));
  }

  private static GraphNode fragment(String id, List<String> targets) {
    return new GraphNode(id, "sayou:TextFragment", null, null, Map.of("rel", targets));
  }

  private static Atom node(GraphNode node) {
    return Atom.create("test", GraphNode.ATOM_TYPE, node.toPayload());
  }
}
