package com.gentoro.hierarchy.engine;

import com.gentoro.hierarchy.schema.ExpansionSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Produces the ordered sibling names described by an {@link ExpansionSpec}. Results are memoized
 * per spec; specs are immutable so the cache never needs invalidation.
 */
public final class ExpansionEngine {
  private final Map<ExpansionSpec, List<String>> cache = new ConcurrentHashMap<>();

  public List<String> expand(ExpansionSpec spec) {
    return cache.computeIfAbsent(spec, ExpansionEngine::generate);
  }

  public boolean contains(ExpansionSpec spec, String name) {
    return name != null && expand(spec).contains(name);
  }

  private static List<String> generate(ExpansionSpec spec) {
    if (spec instanceof ExpansionSpec.Range range) {
      List<String> names = new ArrayList<>(range.size());
      for (long i = range.start(); i <= range.end(); i++) {
        names.add(range.pattern().format(i));
      }
      return List.copyOf(names);
    }
    return ((ExpansionSpec.Names) spec).names();
  }
}
