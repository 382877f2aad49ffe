package com.sayou.fabric.resilience;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-attempt details published by {@link Resilience#retry} on the calling thread. I/O adapters
 * read it to apply the advisory call timeout.
 *
 * @param attempt current attempt, 1-based
 * @param maxAttempts attempts allowed by the policy
 * @param callTimeout advisory timeout, {@code null} when unbounded
 */
public record CallContext(int attempt, int maxAttempts, Duration callTimeout) {
  private static final ThreadLocal<CallContext> CURRENT = new ThreadLocal<>();

  /** Scope restoring the enclosing context on close. */
  public interface Scope extends AutoCloseable {
    @Override
    void close();
  }

  public static Optional<CallContext> current() {
    return Optional.ofNullable(CURRENT.get());
  }

  public static Scope install(CallContext context) {
    final CallContext previous = CURRENT.get();
    CURRENT.set(context);
    return () -> {
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    };
  }

  public boolean isLastAttempt() {
    return attempt >= maxAttempts;
  }
}
