package com.sayou.fabric.resilience;

import com.sayou.fabric.exception.FabricException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * How {@link Resilience#retry} repeats a failing operation.
 *
 * @param maxAttempts total number of calls, at least 1
 * @param delay wait before the second attempt
 * @param backoff multiplier applied to the delay after every failed attempt; 1.0 keeps it fixed
 * @param callTimeout advisory per-call timeout published through {@link CallContext}; {@code
 *     null} when unbounded
 * @param retryOn errors worth another attempt; others are rethrown at once
 */
public record RetryPolicy(
    int maxAttempts,
    Duration delay,
    double backoff,
    Duration callTimeout,
    Predicate<Throwable> retryOn) {

  public static final Predicate<Throwable> ANY_ERROR = t -> true;

  /** Skips errors flagged non-retryable by a {@link FabricException}. */
  public static final Predicate<Throwable> TRANSIENT_ONLY =
      t -> !(t instanceof FabricException fe) || fe.isRetryable();

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
    }
    delay = delay == null ? Duration.ZERO : delay;
    if (delay.isNegative()) throw new IllegalArgumentException("delay must not be negative");
    if (backoff < 1.0) throw new IllegalArgumentException("backoff must be >= 1.0");
    retryOn = Objects.requireNonNullElse(retryOn, ANY_ERROR);
  }

  public static RetryPolicy of(int maxAttempts, Duration delay) {
    return new RetryPolicy(maxAttempts, delay, 1.0, null, ANY_ERROR);
  }

  public static RetryPolicy noRetry() {
    return of(1, Duration.ZERO);
  }

  public static RetryPolicy transientOnly(
      int maxAttempts, Duration delay, double backoff, Duration callTimeout) {
    return new RetryPolicy(maxAttempts, delay, backoff, callTimeout, TRANSIENT_ONLY);
  }

  public RetryPolicy withRetryOn(Predicate<Throwable> predicate) {
    return new RetryPolicy(maxAttempts, delay, backoff, callTimeout, predicate);
  }

  /** Delay to wait after the given failed attempt (1-based). */
  Duration delayAfter(int attempt) {
    if (delay.isZero() || backoff == 1.0 || attempt <= 1) return delay;
    return Duration.ofMillis((long) (delay.toMillis() * Math.pow(backoff, attempt - 1)));
  }
}
