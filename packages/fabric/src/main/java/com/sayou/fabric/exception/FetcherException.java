package com.sayou.fabric.exception;

import com.sayou.fabric.registry.Role;

/** Failure raised by a component playing the {@code fetcher} role. */
public class FetcherException extends ComponentException {
  public FetcherException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public FetcherException(String message, Throwable cause, boolean retryable) {
    super(Role.FETCHER, FabricErrorCode.FETCHER_ERROR, message, cause, retryable);
  }
}
