package com.gentoro.hierarchy.schema;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Ordered hierarchy levels together with the compiled naming pattern. */
public final class HierarchySchema {
  private final List<LevelSpec> levels;
  private final NamingPattern namingPattern;
  private final SchemaFormat format;
  private final List<LevelSpec> patternLevels;

  public HierarchySchema(List<LevelSpec> levels, NamingPattern namingPattern, SchemaFormat format) {
    this.levels = List.copyOf(levels);
    this.namingPattern = Objects.requireNonNull(namingPattern, "namingPattern");
    this.format = Objects.requireNonNull(format, "format");
    this.patternLevels =
        this.levels.stream()
            .filter(l -> namingPattern.references(l.name()))
            .collect(Collectors.toUnmodifiableList());
  }

  public List<LevelSpec> levels() {
    return levels;
  }

  public LevelSpec level(int index) {
    return levels.get(index);
  }

  public int size() {
    return levels.size();
  }

  /** Position of the named level, or -1. */
  public int indexOf(String levelName) {
    for (int i = 0; i < levels.size(); i++) {
      if (levels.get(i).name().equals(levelName)) return i;
    }
    return -1;
  }

  public List<String> levelNames() {
    return levels.stream().map(LevelSpec::name).collect(Collectors.toUnmodifiableList());
  }

  public NamingPattern namingPattern() {
    return namingPattern;
  }

  /** Levels referenced by the naming pattern, in hierarchy order. */
  public List<LevelSpec> patternLevels() {
    return patternLevels;
  }

  public SchemaFormat format() {
    return format;
  }

  /** Index of the first {@link LevelKind#TREE} level at or after {@code from}, or -1. */
  public int nextTreeLevel(int from) {
    for (int j = Math.max(0, from); j < levels.size(); j++) {
      if (levels.get(j).kind() == LevelKind.TREE) return j;
    }
    return -1;
  }
}
