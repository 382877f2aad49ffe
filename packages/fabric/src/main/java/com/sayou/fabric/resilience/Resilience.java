package com.sayou.fabric.resilience;

import com.sayou.fabric.exception.ExceptionUtil;
import java.time.Duration;
import java.util.Objects;

/**
 * Wrappers adding retry, error containment and timing to an {@link Operation}. Each returns an
 * operation of the same type, so they compose by nesting:
 *
 * <pre>{@code
 * Operation<RawPayload> fetch = Resilience.retry(() -> fetcher.fetch(id), policy, "fetch");
 * RawPayload payload =
 *     Resilience.safeDefault(fetch, RawPayload.empty(id), "fetch").callUnchecked();
 * }</pre>
 */
public final class Resilience {
  private static final org.slf4j.Logger log =
      com.sayou.fabric.logging.LoggingService.getLogger(Resilience.class);

  private Resilience() {}

  /**
   * Call {@code operation} up to {@code policy.maxAttempts()} times, stopping at the first
   * success. The wrapper sleeps between attempts, never after the last one, and rethrows the
   * last error. Errors rejected by {@code policy.retryOn()} are rethrown immediately. If the
   * thread is interrupted while waiting, the interrupt flag is restored and the last error is
   * rethrown.
   */
  public static <T> Operation<T> retry(Operation<T> operation, RetryPolicy policy, String label) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(policy, "policy");
    return () -> {
      int max = policy.maxAttempts();
      for (int attempt = 1; ; attempt++) {
        try (CallContext.Scope ignored =
            CallContext.install(new CallContext(attempt, max, policy.callTimeout()))) {
          return operation.call();
        } catch (Exception e) {
          if (!policy.retryOn().test(e)) {
            log.debug("[Retry] {} failed with a non-retryable error: {}", label, e.toString());
            throw e;
          }
          if (attempt >= max) {
            if (max > 1) log.warn("[Retry] {} failed after {} attempts", label, max);
            throw e;
          }
          Duration wait = policy.delayAfter(attempt);
          log.warn(
              "[Retry] {} failed ({}/{}): {}. Retrying in {} ms",
              label,
              attempt,
              max,
              ExceptionUtil.describe(e),
              wait.toMillis());
          if (!wait.isZero()) {
            try {
              Thread.sleep(wait.toMillis());
            } catch (InterruptedException ie) {
              Thread.currentThread().interrupt();
              log.debug("[Retry] {} interrupted while waiting; giving up", label);
              throw e;
            }
          }
        }
      }
    };
  }

  public static <T> Operation<T> retry(Operation<T> operation, RetryPolicy policy) {
    return retry(operation, policy, "operation");
  }

  /** Contain any error of {@code operation}: log it and return {@code defaultValue}. */
  public static <T> Operation<T> safeDefault(Operation<T> operation, T defaultValue, String label) {
    Objects.requireNonNull(operation, "operation");
    return () -> {
      try {
        return operation.call();
      } catch (Exception e) {
        log.error(
            "[SafeRun] {} failed, using default: {} ({})",
            label,
            ExceptionUtil.describe(e),
            ExceptionUtil.formatCompactStackTrace(e, 3));
        return defaultValue;
      }
    };
  }

  /** Report the wall-clock duration of every call to {@code listener}, success or not. */
  public static <T> Operation<T> timed(
      Operation<T> operation, String label, TimingListener listener) {
    Objects.requireNonNull(operation, "operation");
    TimingListener target = listener == null ? TimingListener.logging() : listener;
    return () -> {
      long start = System.nanoTime();
      boolean success = false;
      try {
        T result = operation.call();
        success = true;
        return result;
      } finally {
        target.onTiming(label, Duration.ofNanos(System.nanoTime() - start), success);
      }
    };
  }
}
