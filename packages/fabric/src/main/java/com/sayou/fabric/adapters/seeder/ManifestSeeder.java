package com.sayou.fabric.adapters.seeder;

import com.sayou.fabric.component.AbstractSeeder;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.exception.IoException;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads identifiers from a manifest file, one per line. Blank lines and lines starting with
 * {@code #} are ignored.
 *
 * <p>Options: {@code seed_file} (path of the manifest, defaults to the run source), {@code
 * encoding} (default UTF-8).
 */
public class ManifestSeeder extends AbstractSeeder {
  public static final String NAME = "manifest";

  private String seedFile;
  private Charset encoding = StandardCharsets.UTF_8;

  public ManifestSeeder() {
    super(NAME);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    seedFile = options.getString("seed_file");
    encoding = Charset.forName(options.getString("encoding", StandardCharsets.UTF_8.name()));
  }

  @Override
  protected List<String> doSeed(String source) {
    Path manifest = Path.of(seedFile == null || seedFile.isBlank() ? source.trim() : seedFile);
    try (var lines = Files.lines(manifest, encoding)) {
      return lines.map(String::trim).filter(l -> !l.isEmpty() && !l.startsWith("#")).toList();
    } catch (IOException e) {
      throw new IoException("Failed to read seed manifest " + manifest, e);
    }
  }
}
