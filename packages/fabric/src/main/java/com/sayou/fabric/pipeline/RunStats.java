package com.sayou.fabric.pipeline;

import com.sayou.fabric.utility.JacksonUtility;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of one pipeline run. Updated concurrently by fetch workers, read once the run is
 * over.
 *
 * <ul>
 *   <li>{@code seeded}: distinct seed identifiers admitted to the frontier
 *   <li>{@code fetched}: successful fetches with content
 *   <li>{@code generated}: new identifiers admitted by the generator
 *   <li>{@code written}: records the writer reported as persisted
 *   <li>{@code failed}: failed fetches, failed generations and failed storage units
 *   <li>{@code skipped}: fetches without content plus identifiers never dispatched
 * </ul>
 */
public final class RunStats {
  private final AtomicLong seeded = new AtomicLong();
  private final AtomicLong fetched = new AtomicLong();
  private final AtomicLong generated = new AtomicLong();
  private final AtomicLong written = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong skipped = new AtomicLong();
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Map<String, Long> timings = Collections.synchronizedMap(new LinkedHashMap<>());

  void addSeeded(long n) {
    seeded.addAndGet(n);
  }

  void addFetched(long n) {
    fetched.addAndGet(n);
  }

  void addGenerated(long n) {
    generated.addAndGet(n);
  }

  void addWritten(long n) {
    written.addAndGet(n);
  }

  void addFailed(long n) {
    failed.addAndGet(n);
  }

  void addSkipped(long n) {
    skipped.addAndGet(n);
  }

  void markCancelled() {
    cancelled.set(true);
  }

  /** Accumulates the elapsed time under {@code label}. */
  void recordTiming(String label, Duration elapsed) {
    timings.merge(label, elapsed.toMillis(), Long::sum);
  }

  public long seeded() {
    return seeded.get();
  }

  public long fetched() {
    return fetched.get();
  }

  public long generated() {
    return generated.get();
  }

  public long written() {
    return written.get();
  }

  public long failed() {
    return failed.get();
  }

  public long skipped() {
    return skipped.get();
  }

  public boolean cancelled() {
    return cancelled.get();
  }

  /** Stage durations in milliseconds, in the order the stages ran. */
  public Map<String, Long> timings() {
    synchronized (timings) {
      return Collections.unmodifiableMap(new LinkedHashMap<>(timings));
    }
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("seeded", seeded());
    m.put("fetched", fetched());
    m.put("generated", generated());
    m.put("written", written());
    m.put("failed", failed());
    m.put("skipped", skipped());
    m.put("cancelled", cancelled());
    m.put("timings", timings());
    return m;
  }

  public String toJson() {
    return JacksonUtility.toJson(toMap());
  }

  @Override
  public String toString() {
    return "RunStats" + toMap();
  }
}
