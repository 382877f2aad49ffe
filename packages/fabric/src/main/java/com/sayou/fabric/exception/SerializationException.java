package com.sayou.fabric.exception;

/** Failure while converting objects to or from JSON/YAML. */
public class SerializationException extends FabricException {
  public SerializationException(String message) {
    super(FabricErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(FabricErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
