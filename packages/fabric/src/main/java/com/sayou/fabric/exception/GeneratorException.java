package com.sayou.fabric.exception;

import com.sayou.fabric.registry.Role;

/** Failure raised by a component playing the {@code generator} role. */
public class GeneratorException extends ComponentException {
  public GeneratorException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public GeneratorException(String message, Throwable cause, boolean retryable) {
    super(Role.GENERATOR, FabricErrorCode.GENERATOR_ERROR, message, cause, retryable);
  }
}
