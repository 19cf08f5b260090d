package com.gentoro.hierarchy.exception;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON or YAML could not be parsed or produced. When Jackson reports where parsing stopped, the
 * context carries {@code line} and {@code column} next to the {@code source}.
 */
public class SerializationException extends HierarchyException {
  public SerializationException(String message, String source, Throwable cause) {
    super(HierarchyErrorCode.SERIALIZATION_ERROR, message, details(source, cause), cause);
  }

  private static Map<String, Object> details(String source, Throwable cause) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("source", String.valueOf(source));
    if (cause instanceof JsonProcessingException jpe) {
      JsonLocation at = jpe.getLocation();
      if (at != null && at.getLineNr() > 0) {
        details.put("line", at.getLineNr());
        details.put("column", at.getColumnNr());
      }
    }
    return details;
  }
}
