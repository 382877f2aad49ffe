package com.sayou.fabric.exception;

/**
 * Canonical error codes for Sayou Fabric. Codes are stable and suitable for run reports and logs.
 * Prefer the most specific code that reflects the failure origin.
 */
public enum FabricErrorCode {
  // Generic
  UNKNOWN,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  // Records
  SCHEMA_ERROR,

  // Registry
  UNKNOWN_ROLE,
  UNRESOLVED_COMPONENT,

  // Component lifecycle
  INITIALIZATION_ERROR,
  NOT_INITIALIZED,

  // Per-role component failures
  SEEDER_ERROR,
  FETCHER_ERROR,
  GENERATOR_ERROR,
  PARSER_ERROR,
  REFINER_ERROR,
  SPLITTER_ERROR,
  MAPPER_ERROR,
  BUILDER_ERROR,
  WRITER_ERROR,
}
