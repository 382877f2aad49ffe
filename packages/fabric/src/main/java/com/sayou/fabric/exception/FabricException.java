package com.sayou.fabric.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for Sayou Fabric with a stable {@link FabricErrorCode} and optional
 * context.
 *
 * <p>The context map is defensively copied and unmodifiable. The {@code retryable} flag tells the
 * resilience layer whether repeating the failed call can possibly succeed; it is {@code false}
 * unless a subclass states otherwise.
 */
public class FabricException extends RuntimeException {
  private final FabricErrorCode code;
  private final Map<String, Object> context;
  private final boolean retryable;

  public FabricException(FabricErrorCode code, String message) {
    this(code, message, null, null, false);
  }

  public FabricException(FabricErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause, false);
  }

  public FabricException(FabricErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null, false);
  }

  public FabricException(
      FabricErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    this(code, message, context, cause, false);
  }

  protected FabricException(
      FabricErrorCode code,
      String message,
      Map<String, ?> context,
      Throwable cause,
      boolean retryable) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
    this.retryable = retryable;
  }

  public FabricErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  public boolean isRetryable() {
    return retryable;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach((k, v) -> m.put(k, v));
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + String.valueOf(getMessage())
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
