package com.sayou.fabric.exception;

import com.sayou.fabric.registry.Role;

/** Failure raised by a component playing the {@code mapper} role. */
public class MapperException extends ComponentException {
  public MapperException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public MapperException(String message, Throwable cause, boolean retryable) {
    super(Role.MAPPER, FabricErrorCode.MAPPER_ERROR, message, cause, retryable);
  }
}
