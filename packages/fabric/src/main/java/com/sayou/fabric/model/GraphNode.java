package com.sayou.fabric.model;

import com.sayou.fabric.exception.SchemaException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entity of the knowledge graph.
 *
 * <p>Relationship lists are ordered and may hold the same target more than once; merging two
 * nodes concatenates them.
 *
 * @param nodeId unique id within a graph, e.g. {@code sayou:doc:report.pdf}
 * @param nodeClass entity class, e.g. {@code sayou:Document}
 * @param friendlyName display name, may be {@code null}
 * @param attributes scalar or structured attributes
 * @param relationships predicate to ordered target node ids
 */
public record GraphNode(
    String nodeId,
    String nodeClass,
    String friendlyName,
    Map<String, Object> attributes,
    Map<String, List<String>> relationships) {

  public static final String ATOM_TYPE = "node";

  public GraphNode {
    Objects.requireNonNull(nodeId, "nodeId");
    attributes =
        attributes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    relationships = copyRelationships(relationships);
  }

  public static GraphNode of(String nodeId, String nodeClass) {
    return new GraphNode(nodeId, nodeClass, null, null, null);
  }

  /**
   * Merge {@code newer} into this node: attributes key-wise with the newer value winning,
   * relationship lists concatenated per predicate, class and name taken from {@code newer} when
   * it has them.
   */
  public GraphNode merge(GraphNode newer) {
    if (!nodeId.equals(newer.nodeId)) {
      throw new IllegalArgumentException(
          "Cannot merge node '%s' into '%s'".formatted(newer.nodeId, nodeId));
    }
    Map<String, Object> mergedAttributes = new LinkedHashMap<>(attributes);
    mergedAttributes.putAll(newer.attributes);

    Map<String, List<String>> mergedRelationships = new LinkedHashMap<>();
    relationships.forEach((p, targets) -> mergedRelationships.put(p, new ArrayList<>(targets)));
    newer.relationships.forEach(
        (p, targets) ->
            mergedRelationships.computeIfAbsent(p, k -> new ArrayList<>()).addAll(targets));

    return new GraphNode(
        nodeId,
        newer.nodeClass != null ? newer.nodeClass : nodeClass,
        newer.friendlyName != null ? newer.friendlyName : friendlyName,
        mergedAttributes,
        mergedRelationships);
  }

  public List<String> targets(String predicate) {
    return relationships.getOrDefault(predicate, List.of());
  }

  public int edgeCount() {
    return relationships.values().stream().mapToInt(List::size).sum();
  }

  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("node_id", nodeId);
    payload.put("node_class", nodeClass);
    if (friendlyName != null) payload.put("friendly_name", friendlyName);
    payload.put("attributes", attributes);
    payload.put("relationships", relationships);
    return payload;
  }

  /**
   * Read a {@code node} atom payload. A single string relationship target is accepted as a
   * one-element list.
   *
   * @throws SchemaException when {@code node_id} is missing
   */
  public static GraphNode fromPayload(Map<String, ?> payload) {
    Object id = payload.get("node_id");
    if (id == null || id.toString().isBlank()) {
      throw new SchemaException("Node payload has no 'node_id'", Map.of("keys", payload.keySet()));
    }
    Object nodeClass = payload.get("node_class");
    Object name = payload.get("friendly_name");

    Map<String, List<String>> relationships = new LinkedHashMap<>();
    asMap(payload.get("relationships"))
        .forEach(
            (predicate, targets) -> {
              List<String> list = new ArrayList<>();
              if (targets instanceof Collection<?> c) {
                c.stream().filter(Objects::nonNull).map(Object::toString).forEach(list::add);
              } else if (targets != null) {
                list.add(targets.toString());
              }
              relationships.put(predicate, list);
            });

    return new GraphNode(
        id.toString(),
        nodeClass == null ? null : nodeClass.toString(),
        name == null ? null : name.toString(),
        asMap(payload.get("attributes")),
        relationships);
  }

  static Map<String, Object> asMap(Object value) {
    Map<String, Object> m = new LinkedHashMap<>();
    if (value instanceof Map<?, ?> map) map.forEach((k, v) -> m.put(String.valueOf(k), v));
    return m;
  }

  private static Map<String, List<String>> copyRelationships(Map<String, List<String>> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, List<String>> m = new LinkedHashMap<>();
    input.forEach(
        (p, targets) ->
            m.put(
                p,
                targets == null
                    ? List.of()
                    : Collections.unmodifiableList(new ArrayList<>(targets))));
    return Collections.unmodifiableMap(m);
  }
}
