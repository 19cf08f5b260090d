package com.gentoro.hierarchy.engine;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persistent list of level values collected while walking the tree. Extending a path shares the
 * existing segments, so branching costs one allocation per level.
 */
public final class SelectionPath {
  private static final SelectionPath EMPTY = new SelectionPath(null, null, null, null, 0);

  private final SelectionPath parent;
  private final String level;
  private final String value;
  private final String separator;
  private final int depth;

  private SelectionPath(
      SelectionPath parent, String level, String value, String separator, int depth) {
    this.parent = parent;
    this.level = level;
    this.value = value;
    this.separator = separator;
    this.depth = depth;
  }

  public static SelectionPath empty() {
    return EMPTY;
  }

  /**
   * Append a level value.
   *
   * @param separator join string after this value, {@code null} to use the naming pattern
   */
  public SelectionPath with(String level, String value, String separator) {
    return new SelectionPath(this, level, value, separator, depth + 1);
  }

  /** Append a level that this branch skips. */
  public SelectionPath skip(String level) {
    return with(level, "", null);
  }

  public int depth() {
    return depth;
  }

  /** Level to value, in walk order. */
  public Map<String, String> values() {
    Map<String, String> result = new LinkedHashMap<>();
    for (SelectionPath p : segments()) {
      result.put(p.level, p.value);
    }
    return Collections.unmodifiableMap(result);
  }

  /** Level to separator override, only for segments that carry one. */
  public Map<String, String> separators() {
    Map<String, String> result = new HashMap<>();
    for (SelectionPath p = this; p.parent != null; p = p.parent) {
      if (p.separator != null) result.putIfAbsent(p.level, p.separator);
    }
    return result;
  }

  private Deque<SelectionPath> segments() {
    Deque<SelectionPath> stack = new ArrayDeque<>(depth);
    for (SelectionPath p = this; p.parent != null; p = p.parent) {
      stack.push(p);
    }
    return stack;
  }

  @Override
  public String toString() {
    return values().toString();
  }
}
