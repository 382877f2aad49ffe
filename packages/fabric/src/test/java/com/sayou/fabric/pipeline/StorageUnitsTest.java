package com.sayou.fabric.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.model.GraphNode;
import com.sayou.fabric.model.KnowledgeGraph;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StorageUnitsTest {

  @Test
  void graphYieldsItsNodes() {
    KnowledgeGraph graph = new KnowledgeGraph();
    graph.addNode(GraphNode.of("a", "c"));
    graph.addNode(GraphNode.of("b", "c"));
    assertEquals(graph.nodes(), StorageUnits.split(graph));
  }

  @Test
  void collectionsAndArraysYieldElements() {
    assertEquals(List.of("x", "y"), StorageUnits.split(Arrays.asList("x", null, "y")));
    assertEquals(List.of(1, 2), StorageUnits.split(new Integer[] {1, 2}));
  }

  @Test
  void anythingElseIsOneUnit() {
    Map<String, Object> report = Map.of("k", "v");
    assertEquals(List.of(report), StorageUnits.split(report));
    assertEquals(List.of(), StorageUnits.split(null));
  }
}
