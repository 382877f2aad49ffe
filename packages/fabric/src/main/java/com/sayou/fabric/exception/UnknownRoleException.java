package com.sayou.fabric.exception;

import java.util.Collection;
import java.util.Map;

/** A role name outside the declared closed set was used. Always a configuration bug. */
public class UnknownRoleException extends FabricException {
  public UnknownRoleException(String role, Collection<String> declared) {
    super(
        FabricErrorCode.UNKNOWN_ROLE,
        "Unknown component role '%s'. Declared roles: %s".formatted(role, declared),
        Map.of("role", String.valueOf(role)));
  }
}
