package com.gentoro.hierarchy.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception of the resolver. Carries a {@link HierarchyErrorCode} and an immutable
 * map of diagnostic details (offending level, placeholder, tree node and so on).
 */
public class HierarchyException extends RuntimeException {
  private final HierarchyErrorCode code;
  private final Map<String, Object> context;

  public HierarchyException(HierarchyErrorCode code, String message) {
    this(code, message, Collections.emptyMap(), null);
  }

  public HierarchyException(HierarchyErrorCode code, String message, Throwable cause) {
    this(code, message, Collections.emptyMap(), cause);
  }

  public HierarchyException(HierarchyErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public HierarchyException(
      HierarchyErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public HierarchyErrorCode getCode() {
    return code;
  }

  /** Key/value details describing where the failure was detected. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach(m::put);
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{code="
        + code
        + ", message="
        + getMessage()
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
