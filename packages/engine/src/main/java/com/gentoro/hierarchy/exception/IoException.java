package com.gentoro.hierarchy.exception;

import java.util.Map;

/** A schema or configuration source could not be read. The context names its {@code location}. */
public class IoException extends HierarchyException {
  public IoException(String message, String location) {
    this(message, location, null);
  }

  public IoException(String message, String location, Throwable cause) {
    super(HierarchyErrorCode.IO_ERROR, message, Map.of("location", String.valueOf(location)), cause);
  }

  public String getLocation() {
    return (String) getContext().get("location");
  }
}
