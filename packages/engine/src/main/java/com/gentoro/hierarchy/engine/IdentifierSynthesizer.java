package com.gentoro.hierarchy.engine;

import com.gentoro.hierarchy.schema.HierarchySchema;
import com.gentoro.hierarchy.schema.LevelSpec;
import com.gentoro.hierarchy.schema.NamingPattern;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders identifiers from level values. Multi-valued selections expand to the Cartesian product
 * of the naming pattern levels; the first pattern level varies slowest.
 */
public final class IdentifierSynthesizer {
  private final HierarchySchema schema;
  private final NamingPattern pattern;
  private final SegmentResolver resolver;
  private final SeparatorCleaner cleaner;

  public IdentifierSynthesizer(
      HierarchySchema schema, SegmentResolver resolver, SeparatorCleaner cleaner) {
    this.schema = schema;
    this.pattern = schema.namingPattern();
    this.resolver = resolver;
    this.cleaner = cleaner;
  }

  /** Substitute, apply separator overrides, then clean separator artifacts. */
  public String render(Map<String, String> values, Map<String, String> separators) {
    return cleaner.clean(pattern.render(values, separators));
  }

  /**
   * Build every identifier for the given selections. Values may be single objects or collections;
   * a level without a selection contributes an empty value, while an empty collection yields no
   * identifiers at all. Duplicates are kept.
   */
  public List<String> synthesize(Map<String, ?> selections) {
    Map<String, ?> chosen = selections == null ? Map.of() : selections;
    List<LevelSpec> axesLevels = schema.patternLevels();
    List<List<String>> axes = new ArrayList<>();
    for (LevelSpec level : axesLevels) {
      Object raw = chosen.get(level.name());
      List<String> values = Selections.all(raw);
      if (values.isEmpty()) {
        // an explicitly empty collection selects nothing, so the product is empty
        if (raw instanceof Collection<?>) return new ArrayList<>();
        values = List.of("");
      }
      axes.add(values);
    }

    Map<String, String> fixed = new HashMap<>();
    for (LevelSpec level : schema.levels()) {
      if (!pattern.references(level.name())) {
        String first = Selections.first(chosen.get(level.name()));
        if (first != null) fixed.put(level.name(), first);
      }
    }

    List<String> identifiers = new ArrayList<>();
    int[] odometer = new int[axes.size()];
    while (true) {
      Map<String, String> combination = new HashMap<>(fixed);
      for (int k = 0; k < axes.size(); k++) {
        combination.put(axesLevels.get(k).name(), axes.get(k).get(odometer[k]));
      }
      SegmentResolver.Resolution resolution = resolver.resolve(combination);
      identifiers.add(render(resolution.values(), resolution.separators()));

      int k = axes.size() - 1;
      while (k >= 0) {
        if (++odometer[k] < axes.get(k).size()) break;
        odometer[k] = 0;
        k--;
      }
      if (k < 0) break;
    }
    return identifiers;
  }
}
