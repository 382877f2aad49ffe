package com.sayou.fabric.exception;

import com.sayou.fabric.registry.Role;

/** Failure raised by a component playing the {@code refiner} role. */
public class RefinerException extends ComponentException {
  public RefinerException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public RefinerException(String message, Throwable cause, boolean retryable) {
    super(Role.REFINER, FabricErrorCode.REFINER_ERROR, message, cause, retryable);
  }
}
