package com.sayou.fabric.adapters.fetcher;

import com.sayou.fabric.component.AbstractFetcher;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.component.RawPayload;
import com.sayou.fabric.exception.IoException;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a local file as text. Identifiers are paths or {@code file:} URIs.
 *
 * <p>Options: {@code encoding} (default UTF-8).
 */
public class FileFetcher extends AbstractFetcher {
  public static final String NAME = "file";

  private Charset encoding = StandardCharsets.UTF_8;

  public FileFetcher() {
    super(NAME);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    encoding = Charset.forName(options.getString("encoding", StandardCharsets.UTF_8.name()));
  }

  @Override
  protected RawPayload doFetch(String identifier) {
    Path path = toPath(identifier);
    if (!Files.isRegularFile(path)) {
      throw new IoException("No such file: " + path);
    }
    try {
      String content = Files.readString(path, encoding);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("path", path.toAbsolutePath().toString());
      metadata.put("size", Files.size(path));
      metadata.put("last_modified", Files.getLastModifiedTime(path).toInstant().toString());
      return new RawPayload(
          identifier, MediaTypes.fromFileName(path.getFileName().toString()), content, metadata);
    } catch (IOException e) {
      throw new IoException("Failed to read " + path, e);
    }
  }

  static Path toPath(String identifier) {
    String id = identifier.trim();
    if (id.regionMatches(true, 0, "file:", 0, 5)) {
      return Path.of(URI.create(id));
    }
    return Path.of(id);
  }
}
