package com.gentoro.hierarchy.exception;

import java.util.Map;

/** A command line {@code argument} is missing or malformed. */
public class ValidationException extends HierarchyException {
  public ValidationException(String argument, String message) {
    super(HierarchyErrorCode.INVALID_ARGUMENT, message, Map.of("argument", argument));
  }
}
