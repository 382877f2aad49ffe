package com.sayou.fabric.pipeline.progress;

/**
 * Time and delta based throttle for progress lines.
 *
 * <p>An event passes when at least {@code minIntervalMs} elapsed since the last accepted one, or
 * when the completed counter moved by at least {@code minDelta} units.
 */
public class ProgressRateLimiter {
  private final long minIntervalMs;
  private final long minDelta;

  private long lastAcceptedAt = 0L;
  private long lastCompleted = Long.MIN_VALUE;

  public ProgressRateLimiter(long minIntervalMs, long minDelta) {
    this.minIntervalMs = Math.max(0, minIntervalMs);
    this.minDelta = Math.max(0, minDelta);
  }

  public synchronized boolean tryAcquire(long nowMs, long completed) {
    boolean first = lastCompleted == Long.MIN_VALUE;
    if (first
        || nowMs - lastAcceptedAt >= minIntervalMs
        || Math.abs(completed - lastCompleted) >= minDelta) {
      lastAcceptedAt = nowMs;
      lastCompleted = completed;
      return true;
    }
    return false;
  }
}
