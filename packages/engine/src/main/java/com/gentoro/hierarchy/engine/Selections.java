package com.gentoro.hierarchy.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Coercion of caller supplied selection values. A selection is either a single value or a
 * collection of values; anything else is converted with {@code toString()}.
 */
final class Selections {
  private Selections() {}

  /** First selected value, or {@code null} when nothing usable was selected. */
  static String first(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Collection<?> c) {
      for (Object o : c) {
        if (o != null) return blankToNull(o.toString());
      }
      return null;
    }
    return blankToNull(raw.toString());
  }

  /** All selected values; an absent selection yields an empty list. */
  static List<String> all(Object raw) {
    List<String> values = new ArrayList<>();
    if (raw == null) return values;
    if (raw instanceof Collection<?> c) {
      for (Object o : c) {
        if (o != null) values.add(o.toString());
      }
    } else {
      values.add(raw.toString());
    }
    return values;
  }

  private static String blankToNull(String s) {
    return s.isEmpty() ? null : s;
  }
}
