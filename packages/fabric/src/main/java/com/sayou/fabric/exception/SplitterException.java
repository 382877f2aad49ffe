package com.sayou.fabric.exception;

import com.sayou.fabric.registry.Role;

/** Failure raised by a component playing the {@code splitter} role. */
public class SplitterException extends ComponentException {
  public SplitterException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public SplitterException(String message, Throwable cause, boolean retryable) {
    super(Role.SPLITTER, FabricErrorCode.SPLITTER_ERROR, message, cause, retryable);
  }
}
