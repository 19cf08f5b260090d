package com.gentoro.hierarchy.exception;

import java.util.Map;

/**
 * The schema document is malformed or violates a structural rule. Raised only while an engine is
 * being built; the message names the offending element and shows a corrected example.
 */
public class SchemaException extends HierarchyException {
  public SchemaException(String message) {
    super(HierarchyErrorCode.INVALID_SCHEMA, message);
  }

  public SchemaException(String message, Map<String, ?> context) {
    super(HierarchyErrorCode.INVALID_SCHEMA, message, context);
  }

  public SchemaException(String message, Throwable cause) {
    super(HierarchyErrorCode.INVALID_SCHEMA, message, cause);
  }

  public SchemaException(String message, Map<String, ?> context, Throwable cause) {
    super(HierarchyErrorCode.INVALID_SCHEMA, message, context, cause);
  }
}
