package com.sayou.fabric.pipeline.progress;

import com.sayou.fabric.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes stage progress as one JSON object per log line:
 *
 * <pre>
 * [pipeline.progress] {"stage":"fetch","label":"Fetching","completed":12,"total":0,
 *   "percent":0,"message":"https://example.com/a","attrs":{},"status":"running"}
 * </pre>
 *
 * <p>Step events are throttled per stage by a {@link ProgressRateLimiter}; begin and end events
 * are always written.
 */
public class LoggingProgressSink implements ProgressSink {
  private final org.slf4j.Logger log;
  private final long minIntervalMs;
  private final long minDelta;

  private final Map<String, ProgressRateLimiter> limiters = new ConcurrentHashMap<>();
  private final Map<String, Long> totals = new ConcurrentHashMap<>();
  private final Map<String, Long> completions = new ConcurrentHashMap<>();
  private final Map<String, String> labels = new ConcurrentHashMap<>();

  public LoggingProgressSink(org.slf4j.Logger logger, long minIntervalMs, long minDelta) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.minIntervalMs = minIntervalMs;
    this.minDelta = minDelta;
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    totals.put(id, Math.max(0, totalWork));
    completions.put(id, 0L);
    labels.put(id, label);
    limiters.put(id, new ProgressRateLimiter(minIntervalMs, minDelta));
    emit(id, 0L, "begin", Map.of(), "running");
  }

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {
    completions.put(id, completed);
    ProgressRateLimiter limiter =
        limiters.computeIfAbsent(id, k -> new ProgressRateLimiter(minIntervalMs, minDelta));
    if (limiter.tryAcquire(System.currentTimeMillis(), completed)) {
      emit(id, completed, message, attrs, "running");
    }
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    long done = completions.getOrDefault(id, 0L);
    totals.merge(id, done, Math::max);
    emit(id, done, "end", attrs, "ok");
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    Map<String, Object> merged = new LinkedHashMap<>();
    if (attrs != null) merged.putAll(attrs);
    if (errorSummary != null) merged.put("error", errorSummary);
    emit(id, completions.getOrDefault(id, 0L), "error", merged, "error");
  }

  @Override
  public void endStageCancelled(String id, Map<String, Object> attrs) {
    emit(id, completions.getOrDefault(id, 0L), "cancelled", attrs, "cancelled");
  }

  /** Payload of one progress line. */
  protected Map<String, Object> createPayload(
      String id, long completed, String message, Map<String, Object> attrs, String status) {
    long total = totals.getOrDefault(id, 0L);
    long done = Math.max(0, completed);
    int percent = total > 0 ? (int) Math.min(100, Math.round(done * 100.0 / total)) : 0;
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("stage", id);
    payload.put("label", labels.getOrDefault(id, id));
    payload.put("completed", done);
    payload.put("total", total);
    payload.put("percent", percent);
    payload.put("message", message);
    payload.put("attrs", attrs == null ? Map.of() : attrs);
    payload.put("status", status);
    return payload;
  }

  void emit(String id, long completed, String message, Map<String, Object> attrs, String status) {
    if (!log.isInfoEnabled()) return;
    Map<String, Object> payload = createPayload(id, completed, message, attrs, status);
    log.info("[pipeline.progress] {}", JacksonUtility.toJson(payload));
  }
}
