package com.sayou.fabric.exception;

import com.sayou.fabric.registry.Role;

/** Failure raised by a component playing the {@code parser} role. */
public class ParserException extends ComponentException {
  public ParserException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public ParserException(String message, Throwable cause, boolean retryable) {
    super(Role.PARSER, FabricErrorCode.PARSER_ERROR, message, cause, retryable);
  }
}
