package com.sayou.fabric.exception;

/** Network-level communication error (HTTP, sockets, timeouts). Always worth another attempt. */
public class NetworkException extends FabricException {
  public NetworkException(String message) {
    super(FabricErrorCode.NETWORK_ERROR, message, null, null, true);
  }

  public NetworkException(String message, Throwable cause) {
    super(FabricErrorCode.NETWORK_ERROR, message, null, cause, true);
  }
}
