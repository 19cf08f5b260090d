package com.gentoro.hierarchy.exception;

/**
 * Stable error codes for the hierarchy resolver. Codes are safe to surface in logs and command
 * line output; prefer the most specific code for the failure origin.
 */
public enum HierarchyErrorCode {
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,

  // Loading
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Schema document
  INVALID_SCHEMA,
}
