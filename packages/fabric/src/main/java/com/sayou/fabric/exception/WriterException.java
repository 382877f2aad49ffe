package com.sayou.fabric.exception;

import com.sayou.fabric.registry.Role;

/** Failure raised by a component playing the {@code writer} role. */
public class WriterException extends ComponentException {
  public WriterException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public WriterException(String message, Throwable cause, boolean retryable) {
    super(Role.WRITER, FabricErrorCode.WRITER_ERROR, message, cause, retryable);
  }
}
