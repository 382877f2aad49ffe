package com.sayou.fabric.adapters.writer;

import com.sayou.fabric.component.AbstractWriter;
import com.sayou.fabric.component.ComponentOptions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps stored units in memory, in process-wide buffers keyed by the {@code destination} option
 * ({@code default} when absent). Callers embedding the pipeline read them back with {@link
 * #contents(String)} and release them with {@link #drain(String)}.
 *
 * <p>A buffer lives until it is drained, across runs: a writer rebuilt after a failure, or a later
 * run onto the same destination, appends to it. Nothing is ever evicted, so a long-lived process
 * must drain what it no longer needs; {@link #destinations()} lists the buffers still held.
 */
public class MemoryWriter extends AbstractWriter {
  public static final String NAME = "memory";
  public static final String DEFAULT_BUFFER = "default";

  private static final Map<String, List<Object>> BUFFERS = new ConcurrentHashMap<>();

  private List<Object> buffer;

  public MemoryWriter() {
    super(NAME);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    buffer = buffer(options.getString("destination", DEFAULT_BUFFER));
  }

  @Override
  protected int doStore(Object unit) {
    buffer.add(unit);
    return 1;
  }

  /** Snapshot of the units stored under {@code destination}. */
  public static List<Object> contents(String destination) {
    List<Object> b = BUFFERS.get(destination);
    if (b == null) return List.of();
    synchronized (b) {
      return List.copyOf(b);
    }
  }

  /** Remove and return the units stored under {@code destination}. */
  public static List<Object> drain(String destination) {
    List<Object> b = BUFFERS.remove(destination);
    if (b == null) return List.of();
    synchronized (b) {
      return List.copyOf(b);
    }
  }

  /** Destinations that currently hold a buffer. */
  public static Set<String> destinations() {
    return Set.copyOf(BUFFERS.keySet());
  }

  private static List<Object> buffer(String destination) {
    return BUFFERS.computeIfAbsent(
        destination, k -> Collections.synchronizedList(new ArrayList<>()));
  }
}
