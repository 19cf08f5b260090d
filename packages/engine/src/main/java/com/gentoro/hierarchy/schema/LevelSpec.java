package com.gentoro.hierarchy.schema;

import java.util.Objects;

/**
 * One rank of the naming hierarchy.
 *
 * @param name level name, also the naming pattern placeholder
 * @param kind how values are located in the tree
 * @param optional whether a branch may omit this level
 * @param declaredContainer explicit container key, {@code null} to use the default for the kind
 */
public record LevelSpec(String name, LevelKind kind, boolean optional, String declaredContainer) {

  public LevelSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
  }

  public static LevelSpec tree(String name) {
    return new LevelSpec(name, LevelKind.TREE, false, null);
  }

  public static LevelSpec optionalTree(String name) {
    return new LevelSpec(name, LevelKind.TREE, true, null);
  }

  public static LevelSpec instances(String name) {
    return new LevelSpec(name, LevelKind.INSTANCES, false, null);
  }

  /**
   * Key of the container child for {@link LevelKind#INSTANCES} and {@link
   * LevelKind#LEGACY_CONTAINER} levels. Instances default to the level name (matched without regard
   * to case), legacy containers to the plural of the level name.
   */
  public String containerKey() {
    if (declaredContainer != null) return declaredContainer;
    return kind == LevelKind.LEGACY_CONTAINER ? name + "s" : name;
  }

  /** Whether a child key names this level's container. */
  public boolean isContainerKey(String key) {
    if (declaredContainer != null || kind == LevelKind.LEGACY_CONTAINER) {
      return containerKey().equals(key);
    }
    return name.equalsIgnoreCase(key);
  }
}
