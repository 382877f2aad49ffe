package com.sayou.fabric.exception;

import java.util.Collection;
import java.util.Map;

/** No factory is registered for the requested (role, name) pair. Always fatal to a run. */
public class UnresolvedComponentException extends FabricException {
  public UnresolvedComponentException(String role, String name, Collection<String> available) {
    super(
        FabricErrorCode.UNRESOLVED_COMPONENT,
        "No component '%s' registered for role '%s'. Available: %s"
            .formatted(name, role, available),
        Map.of("role", role, "name", String.valueOf(name)));
  }
}
