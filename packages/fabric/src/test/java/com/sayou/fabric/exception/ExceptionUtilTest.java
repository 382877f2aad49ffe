package com.sayou.fabric.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  @DisplayName("fabric exceptions keep code, context and retryable flag")
  void detailsOfFabricException() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(
            new SchemaException("Missing required fields", Map.of("keys", "[source]")));

    assertEquals("SchemaException", details.type());
    assertEquals(FabricErrorCode.SCHEMA_ERROR, details.code());
    assertEquals("Missing required fields", details.message());
    assertFalse(details.retryable());
    assertEquals(Map.of("keys", "[source]"), details.context());
    assertNotNull(details.timestamp());
  }

  @Test
  void foreignExceptionsAreUnknownAndRetryable() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals("IllegalStateException", details.type());
    assertEquals("IllegalStateException", details.message());
    assertEquals(FabricErrorCode.UNKNOWN, details.code());
    assertTrue(details.retryable());
    assertTrue(details.context().isEmpty());
  }

  @Test
  void attributesForProgressEvents() {
    Map<String, Object> attrs =
        ExceptionUtil.toErrorDetails(new NetworkException("HTTP 503")).toAttributes();

    assertEquals("NetworkException", attrs.get("error_type"));
    assertEquals("NETWORK_ERROR", attrs.get("error_code"));
    assertEquals(true, attrs.get("retryable"));
    assertFalse(attrs.containsKey("error_context"));
  }

  @Test
  void compactStackTraceKeepsTheTopFrames() {
    Exception e = new Exception("boom");
    String trace = ExceptionUtil.formatCompactStackTrace(e, 2);

    assertTrue(trace.startsWith(ExceptionUtilTest.class.getName() + "."));
    assertEquals(1, trace.split(" > ").length - 1);
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null, 3));
  }
}
