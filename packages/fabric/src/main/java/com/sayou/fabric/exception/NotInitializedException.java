package com.sayou.fabric.exception;

import java.util.Map;

/** A component operation was invoked before {@code initialize} succeeded. */
public class NotInitializedException extends FabricException {
  public NotInitializedException(String component, String state) {
    super(
        FabricErrorCode.NOT_INITIALIZED,
        "Component '%s' is not ready (state %s)".formatted(component, state),
        Map.of("component", component, "state", state));
  }
}
