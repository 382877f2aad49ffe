package com.sayou.fabric.pipeline;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Pending identifiers of a run plus the set of identifiers already admitted.
 *
 * <p>Queue and visited set sit behind one monitor. An identifier is marked visited when it is
 * admitted, so it can be dequeued at most once per run however many times it is offered and from
 * however many threads.
 */
public final class Frontier {
  private final Deque<String> pending = new ArrayDeque<>();
  private final Set<String> visited = new HashSet<>();

  /**
   * @return {@code true} when the identifier was new and is now pending
   */
  public synchronized boolean offer(String identifier) {
    if (identifier == null) return false;
    String id = identifier.trim();
    if (id.isEmpty() || !visited.add(id)) return false;
    pending.addLast(id);
    return true;
  }

  /**
   * @return number of identifiers admitted
   */
  public synchronized int offerAll(Collection<String> identifiers) {
    int admitted = 0;
    if (identifiers == null) return admitted;
    for (String id : identifiers) {
      if (offer(id)) admitted++;
    }
    return admitted;
  }

  /** Next pending identifier, or {@code null} when none is pending. */
  public synchronized String poll() {
    return pending.pollFirst();
  }

  public synchronized int remaining() {
    return pending.size();
  }

  public synchronized int visitedCount() {
    return visited.size();
  }

  public synchronized boolean hasVisited(String identifier) {
    return identifier != null && visited.contains(identifier.trim());
  }
}
