package com.sayou.fabric.exception;

import java.util.Map;

/** A record does not have the shape required to become a standard record. */
public class SchemaException extends FabricException {
  public SchemaException(String message) {
    super(FabricErrorCode.SCHEMA_ERROR, message);
  }

  public SchemaException(String message, Throwable cause) {
    super(FabricErrorCode.SCHEMA_ERROR, message, cause);
  }

  public SchemaException(String message, Map<String, ?> context) {
    super(FabricErrorCode.SCHEMA_ERROR, message, context);
  }
}
