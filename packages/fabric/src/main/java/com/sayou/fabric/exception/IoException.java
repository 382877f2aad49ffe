package com.sayou.fabric.exception;

/** File system or stream level I/O failure. */
public class IoException extends FabricException {
  public IoException(String message) {
    super(FabricErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(FabricErrorCode.IO_ERROR, message, cause);
  }
}
