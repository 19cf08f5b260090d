package com.gentoro.hierarchy.exception;

import java.util.Map;

/** Application configuration is missing, unreadable or incomplete. */
public class ConfigException extends HierarchyException {
  public ConfigException(String message) {
    super(HierarchyErrorCode.CONFIGURATION_ERROR, message);
  }

  /** Failure tied to one configuration file, recorded as {@code location} in the context. */
  public ConfigException(String message, String location, Throwable cause) {
    super(
        HierarchyErrorCode.CONFIGURATION_ERROR,
        message,
        Map.of("location", String.valueOf(location)),
        cause);
  }
}
