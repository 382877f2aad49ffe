package com.sayou.fabric.adapters.seeder;

import com.sayou.fabric.component.AbstractSeeder;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.exception.IoException;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Emits the regular files below the directory named by the run source, sorted by path.
 *
 * <p>Options: {@code glob} (matched against the file name, default {@code *}), {@code recursive}
 * (default true).
 */
public class DirectorySeeder extends AbstractSeeder {
  public static final String NAME = "directory";

  private PathMatcher matcher;
  private boolean recursive;

  public DirectorySeeder() {
    super(NAME);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    matcher = FileSystems.getDefault().getPathMatcher("glob:" + options.getString("glob", "*"));
    recursive = options.getBoolean("recursive", true);
  }

  @Override
  protected void validate(String source) {
    super.validate(source);
    if (!Files.isDirectory(Path.of(source.trim()))) {
      throw new IllegalArgumentException("not a directory: " + source);
    }
  }

  @Override
  protected List<String> doSeed(String source) {
    Path root = Path.of(source.trim());
    try (Stream<Path> paths = Files.walk(root, recursive ? Integer.MAX_VALUE : 1)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(p -> matcher.matches(p.getFileName()))
          .sorted()
          .map(p -> p.toAbsolutePath().normalize().toString())
          .toList();
    } catch (IOException e) {
      throw new IoException("Failed to list directory " + root, e);
    }
  }
}
