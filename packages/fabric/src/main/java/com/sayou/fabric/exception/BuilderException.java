package com.sayou.fabric.exception;

import com.sayou.fabric.registry.Role;

/** Failure raised by a component playing the {@code builder} role. */
public class BuilderException extends ComponentException {
  public BuilderException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public BuilderException(String message, Throwable cause, boolean retryable) {
    super(Role.BUILDER, FabricErrorCode.BUILDER_ERROR, message, cause, retryable);
  }
}
