package com.sayou.fabric.model;

import com.sayou.fabric.exception.StateException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory entity map built during assembly.
 *
 * <p>Nodes are kept in insertion order and never removed. Adding a node whose id is already
 * present merges it into the existing one (see {@link GraphNode#merge}). The pipeline freezes the
 * graph before handing it to the writer; once frozen it rejects further additions.
 *
 * <p>Not thread-safe; a graph is built by a single builder call.
 */
public final class KnowledgeGraph {
  private final Map<String, GraphNode> entities = new LinkedHashMap<>();
  private boolean frozen;

  public void addNode(GraphNode node) {
    Objects.requireNonNull(node, "node");
    if (frozen) {
      throw new StateException(
          "Knowledge graph is frozen; cannot add node '%s'".formatted(node.nodeId()));
    }
    entities.merge(node.nodeId(), node, GraphNode::merge);
  }

  public Optional<GraphNode> getNode(String nodeId) {
    return Optional.ofNullable(entities.get(nodeId));
  }

  public boolean contains(String nodeId) {
    return entities.containsKey(nodeId);
  }

  public int size() {
    return entities.size();
  }

  public boolean isEmpty() {
    return entities.isEmpty();
  }

  /** Snapshot of the nodes in insertion order. */
  public List<GraphNode> nodes() {
    return Collections.unmodifiableList(new ArrayList<>(entities.values()));
  }

  public int edgeCount() {
    return entities.values().stream().mapToInt(GraphNode::edgeCount).sum();
  }

  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  /** {@code {entities: {id: node payload}, summary: {node_count, edge_count}}}. */
  public Map<String, Object> toMap() {
    Map<String, Object> nodes = new LinkedHashMap<>();
    entities.forEach((id, node) -> nodes.put(id, node.toPayload()));
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("node_count", size());
    summary.put("edge_count", edgeCount());
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("entities", nodes);
    out.put("summary", summary);
    return out;
  }

  @Override
  public String toString() {
    return "KnowledgeGraph{nodes=" + size() + ", edges=" + edgeCount() + ", frozen=" + frozen + '}';
  }
}
