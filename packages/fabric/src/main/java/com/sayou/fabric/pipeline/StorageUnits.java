package com.sayou.fabric.pipeline;

import com.sayou.fabric.model.KnowledgeGraph;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/** Splits a built object into the units handed to the writer one by one. */
public final class StorageUnits {
  private StorageUnits() {}

  /**
   * A knowledge graph yields its nodes, a collection or array its elements, a map or any other
   * object itself; {@code null} yields nothing. Null elements are dropped.
   */
  public static List<Object> split(Object built) {
    if (built == null) return List.of();
    List<Object> units = new ArrayList<>();
    if (built instanceof KnowledgeGraph graph) {
      units.addAll(graph.nodes());
    } else if (built instanceof Collection<?> c) {
      units.addAll(c);
    } else if (built instanceof Object[] array) {
      units.addAll(Arrays.asList(array));
    } else {
      units.add(built);
    }
    units.removeIf(Objects::isNull);
    return units;
  }
}
