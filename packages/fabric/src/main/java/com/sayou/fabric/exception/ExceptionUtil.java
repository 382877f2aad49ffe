package com.sayou.fabric.exception;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logs and progress events. A
   * {@link FabricException} keeps its code, context and retryable flag; anything else is reported
   * as {@link FabricErrorCode#UNKNOWN} and retryable, the way the component template treats it.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof FabricException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          describe(ex),
          ex.getCode(),
          ex.isRetryable(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        describe(t),
        FabricErrorCode.UNKNOWN,
        true,
        Map.of(),
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, joining the top
   * frames in call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Message of the throwable or, when absent, its simple class name. */
  public static String describe(Throwable t) {
    if (t == null) return "";
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }

  public static FabricException rethrowIfUnchecked(
      Throwable t, Function<Throwable, FabricException> supplier) {
    if (t instanceof FabricException) {
      return (FabricException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
