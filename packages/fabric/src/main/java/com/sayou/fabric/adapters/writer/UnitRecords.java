package com.sayou.fabric.adapters.writer;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.model.GraphNode;
import com.sayou.fabric.model.KnowledgeGraph;

/** Serializable view of a storage unit. */
final class UnitRecords {
  private UnitRecords() {}

  static Object toRecord(Object unit) {
    if (unit instanceof GraphNode node) return node.toPayload();
    if (unit instanceof Atom atom) return atom.toRecord();
    if (unit instanceof KnowledgeGraph graph) return graph.toMap();
    return unit;
  }
}
