package com.sayou.fabric.adapters.builder;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.AbstractBuilder;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.model.GraphNode;
import com.sayou.fabric.model.KnowledgeGraph;
import com.sayou.fabric.model.Vocabulary;
import java.util.List;
import java.util.Map;

/**
 * Folds {@code node} atoms into a {@link KnowledgeGraph}; atoms of other types are ignored.
 *
 * <p>With {@code link_reverse} (default true) every edge {@code a -p-> b} whose target is in the
 * graph gets a reverse edge {@code b -p_by-> a}, added once.
 */
public class KnowledgeGraphBuilder extends AbstractBuilder {
  private static final org.slf4j.Logger log =
      com.sayou.fabric.logging.LoggingService.getLogger(KnowledgeGraphBuilder.class);

  public static final String NAME = "knowledge_graph";

  private boolean linkReverse;

  public KnowledgeGraphBuilder() {
    super(NAME);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    linkReverse = options.getBoolean("link_reverse", true);
  }

  @Override
  protected Object doBuild(List<Atom> atoms) {
    KnowledgeGraph graph = new KnowledgeGraph();
    int ignored = 0;
    for (Atom atom : atoms) {
      if (atom.isType(GraphNode.ATOM_TYPE)) {
        graph.addNode(GraphNode.fromPayload(atom.payload()));
      } else {
        ignored++;
      }
    }
    if (ignored > 0) log.debug("Ignored {} atoms that are not nodes", ignored);
    if (linkReverse) {
      log.debug("Generated {} reverse links", linkReverse(graph));
    }
    return graph;
  }

  static int linkReverse(KnowledgeGraph graph) {
    int added = 0;
    for (GraphNode node : graph.nodes()) {
      for (Map.Entry<String, List<String>> edge : node.relationships().entrySet()) {
        String reverse = Vocabulary.reverse(edge.getKey());
        for (String targetId : edge.getValue()) {
          GraphNode target = graph.getNode(targetId).orElse(null);
          if (target == null || target.targets(reverse).contains(node.nodeId())) continue;
          graph.addNode(
              new GraphNode(targetId, null, null, null, Map.of(reverse, List.of(node.nodeId()))));
          added++;
        }
      }
    }
    return added;
  }
}
