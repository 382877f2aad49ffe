package com.sayou.fabric.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends FabricException {
  public StateException(String message) {
    super(FabricErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(FabricErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
