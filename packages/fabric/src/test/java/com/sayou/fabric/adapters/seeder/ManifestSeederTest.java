package com.sayou.fabric.adapters.seeder;

import static org.junit.jupiter.api.Assertions.*;

import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.exception.IoException;
import com.sayou.fabric.exception.SeederException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestSeederTest {

  @TempDir Path dir;

  @Test
  void readsOneIdentifierPerLine() throws Exception {
    Path manifest = dir.resolve("seeds.txt");
    Files.writeString(
        manifest, "# crawl list\nhttps://example.com/a\n\n  https://example.com/b  \n#done\n");

    ManifestSeeder seeder = new ManifestSeeder();
    seeder.initialize(ComponentOptions.empty());

    assertEquals(
        List.of("https://example.com/a", "https://example.com/b"),
        seeder.seed(manifest.toString()));
  }

  @Test
  void seedFileOptionWinsOverTheSource() throws Exception {
    Path manifest = dir.resolve("list.txt");
    Files.writeString(manifest, "one\ntwo\n");

    ManifestSeeder seeder = new ManifestSeeder();
    seeder.initialize(ComponentOptions.of(Map.of("seed_file", manifest.toString())));

    assertEquals(List.of("one", "two"), seeder.seed("ignored"));
  }

  @Test
  void missingManifestIsNotRetryable() {
    ManifestSeeder seeder = new ManifestSeeder();
    seeder.initialize(ComponentOptions.empty());

    SeederException e =
        assertThrows(
            SeederException.class, () -> seeder.seed(dir.resolve("absent.txt").toString()));
    assertInstanceOf(IoException.class, e.getCause());
    assertFalse(e.isRetryable());
  }

  @Test
  void singleSeederEmitsTheSource() {
    SingleSeeder seeder = new SingleSeeder();
    seeder.initialize(ComponentOptions.empty());
    assertEquals(List.of("https://example.com"), seeder.seed(" https://example.com "));
  }
}
