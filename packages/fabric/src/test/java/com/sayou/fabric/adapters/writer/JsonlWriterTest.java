package com.sayou.fabric.adapters.writer;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.atom.Atom;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.exception.InitializationException;
import com.sayou.fabric.model.GraphNode;
import com.sayou.fabric.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonlWriterTest {

  @TempDir Path dir;

  @Test
  void writesOneLinePerUnitAndCreatesParents() throws Exception {
    Path out = dir.resolve("nested/out.jsonl");
    JsonlWriter writer = writer(out);
    Atom atom = Atom.create("s", "chunk", Map.of("content", "x"));

    assertEquals(1, writer.store(GraphNode.of("sayou:doc:a", "sayou:Document")));
    assertEquals(1, writer.store(atom));
    writer.close();

    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertEquals("sayou:doc:a", JacksonUtility.toMap(lines.get(0)).get("node_id"));
    assertEquals(atom, Atom.fromJson(lines.get(1)));
  }

  @Test
  void appendsToExistingFile() throws Exception {
    Path out = dir.resolve("out.jsonl");
    Files.writeString(out, "{\"existing\":true}\n");

    JsonlWriter writer = writer(out);
    writer.store(Map.of("k", "v"));
    writer.close();

    assertEquals(
        List.of("{\"existing\":true}", "{\"k\":\"v\"}"), Files.readAllLines(out));
  }

  @Test
  void destinationIsRequired() {
    JsonlWriter writer = new JsonlWriter();
    assertThrows(InitializationException.class, () -> writer.initialize(ComponentOptions.empty()));
  }

  private static JsonlWriter writer(Path out) {
    JsonlWriter writer = new JsonlWriter();
    writer.initialize(ComponentOptions.of(Map.of("destination", out.toString())));
    assertEquals(out, writer.path());
    return writer;
  }
}
