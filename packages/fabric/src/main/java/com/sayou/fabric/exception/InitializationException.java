package com.sayou.fabric.exception;

import java.util.Map;

/** An adapter rejected its configuration or could not acquire its external resources. */
public class InitializationException extends FabricException {
  public InitializationException(String message) {
    super(FabricErrorCode.INITIALIZATION_ERROR, message);
  }

  public InitializationException(String message, Throwable cause) {
    super(FabricErrorCode.INITIALIZATION_ERROR, message, cause);
  }

  public InitializationException(String message, Map<String, ?> context, Throwable cause) {
    super(FabricErrorCode.INITIALIZATION_ERROR, message, context, cause);
  }

  /** Failure raised for a required option that is absent or blank. */
  public static InitializationException missingOption(String component, String key) {
    return new InitializationException(
        "Component '%s' requires option '%s'".formatted(component, key),
        Map.of("component", component, "option", key),
        null);
  }
}
