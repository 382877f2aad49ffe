package com.sayou.fabric.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends FabricException {
  public ConfigException(String message) {
    super(FabricErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(FabricErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
