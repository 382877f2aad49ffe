package com.sayou.fabric.adapters.writer;

import com.sayou.fabric.component.AbstractWriter;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.utility.JacksonUtility;
import java.io.BufferedWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON line per unit to the file named by the {@code destination} option. Parent
 * directories are created. Graph nodes are written as node payloads, atoms in record form.
 *
 * <p>The file is opened in append mode, so a replacement instance built after a failure keeps
 * what was already written.
 */
public class JsonlWriter extends AbstractWriter {
  public static final String NAME = "jsonl";

  private Path path;
  private BufferedWriter out;

  public JsonlWriter() {
    super(NAME);
  }

  @Override
  protected void onInitialize(ComponentOptions options) throws Exception {
    path = Path.of(options.requireString(NAME, "destination"));
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
    out =
        Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.APPEND);
  }

  @Override
  protected synchronized int doStore(Object unit) throws Exception {
    out.write(JacksonUtility.toJson(UnitRecords.toRecord(unit)));
    out.newLine();
    out.flush();
    return 1;
  }

  public Path path() {
    return path;
  }

  @Override
  protected synchronized void onClose() throws Exception {
    if (out != null) out.close();
  }
}
