package com.sayou.fabric.adapters.writer;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.component.ComponentOptions;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MemoryWriterTest {

  @Test
  void buffersAreKeyedByDestination() {
    MemoryWriter first = writer("memory-test-a");
    MemoryWriter second = writer("memory-test-b");

    first.store("one");
    first.store("two");
    second.store("three");

    assertEquals(List.of("one", "two"), MemoryWriter.contents("memory-test-a"));
    assertEquals(List.of("three"), MemoryWriter.drain("memory-test-b"));
    assertEquals(List.of(), MemoryWriter.contents("memory-test-b"));
    MemoryWriter.drain("memory-test-a");
  }

  @Test
  @DisplayName("a buffer outlives its writer until it is drained")
  void buffersAreHeldUntilDrained() {
    String destination = "memory-test-held";
    writer(destination).store("first run");
    writer(destination).store("rebuilt writer");

    assertTrue(MemoryWriter.destinations().contains(destination));
    assertEquals(List.of("first run", "rebuilt writer"), MemoryWriter.drain(destination));
    assertFalse(MemoryWriter.destinations().contains(destination));
  }

  @Test
  void consoleWriterCountsEachUnit() {
    ConsoleWriter writer = new ConsoleWriter();
    writer.initialize(ComponentOptions.empty());
    assertEquals(1, writer.store(Map.of("k", "v")));
  }

  private static MemoryWriter writer(String destination) {
    MemoryWriter writer = new MemoryWriter();
    writer.initialize(ComponentOptions.of(Map.of("destination", destination)));
    return writer;
  }
}
