package com.sayou.fabric.exception;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured view of a failure, as attached to progress events and run reports.
 *
 * @param type simple class name of the exception
 * @param message message, or the class name when the exception has none
 * @param code stable error code
 * @param retryable whether a retry may succeed
 * @param context context recorded by the thrower, never {@code null}
 * @param timestamp when the details were taken
 */
public record ErrorDetails(
    String type,
    String message,
    FabricErrorCode code,
    boolean retryable,
    Map<String, Object> context,
    Instant timestamp) {

  public ErrorDetails {
    context =
        context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  /** Flat attributes for a progress event: {@code error_type}, {@code error_code}, ... */
  public Map<String, Object> toAttributes() {
    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put("error_type", type);
    attrs.put("error_code", code.name());
    attrs.put("retryable", retryable);
    if (!context.isEmpty()) attrs.put("error_context", context);
    return attrs;
  }
}
