package com.gentoro.hierarchy.exception;

import java.util.Map;

/** A {@code component} was used before it was initialized or loaded. */
public class StateException extends HierarchyException {
  public StateException(String component, String message) {
    super(HierarchyErrorCode.FAILED_PRECONDITION, message, Map.of("component", component));
  }
}
