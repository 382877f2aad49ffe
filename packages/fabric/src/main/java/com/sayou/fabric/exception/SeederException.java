package com.sayou.fabric.exception;

import com.sayou.fabric.registry.Role;

/** Failure raised by a component playing the {@code seeder} role. */
public class SeederException extends ComponentException {
  public SeederException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public SeederException(String message, Throwable cause, boolean retryable) {
    super(Role.SEEDER, FabricErrorCode.SEEDER_ERROR, message, cause, retryable);
  }
}
