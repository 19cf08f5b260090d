package com.gentoro.hierarchy.schema;

import java.util.List;
import java.util.Objects;

/** Description of a set of generated sibling names attached to a container node. */
public sealed interface ExpansionSpec permits ExpansionSpec.Range, ExpansionSpec.Names {

  /** Number of names this spec produces. */
  int size();

  /** Integers {@code start..end} inclusive, each formatted through {@code pattern}. */
  record Range(IndexPattern pattern, long start, long end) implements ExpansionSpec {
    public Range {
      Objects.requireNonNull(pattern, "pattern");
      if (start > end) {
        throw new IllegalArgumentException("start " + start + " is greater than end " + end);
      }
    }

    @Override
    public int size() {
      return (int) Math.min(Integer.MAX_VALUE, end - start + 1);
    }
  }

  /** Explicit names, kept in declared order. */
  record Names(List<String> names) implements ExpansionSpec {
    public Names {
      names = List.copyOf(names);
    }

    @Override
    public int size() {
      return names.size();
    }
  }
}
