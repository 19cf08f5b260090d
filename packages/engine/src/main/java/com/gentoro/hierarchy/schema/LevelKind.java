package com.gentoro.hierarchy.schema;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** How the values of a hierarchy level are found in the tree. */
public enum LevelKind {
  /** Values are the named children of the current node. */
  TREE("tree"),
  /**
   * Values are generated by the {@code _expansion} of a container child; the container's children
   * are shared by every generated value.
   */
  INSTANCES("instances"),
  /**
   * Older schemas: values live under a fixed container key such as {@code devices} or {@code
   * fields}, either as named children or as an inline expansion.
   */
  LEGACY_CONTAINER("container");

  private final String typeName;

  LevelKind(String typeName) {
    this.typeName = typeName;
  }

  /** Name used for this kind in schema documents. */
  public String typeName() {
    return typeName;
  }

  public static Optional<LevelKind> fromTypeName(String name) {
    if (name == null) return Optional.empty();
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(k -> k.typeName.equals(normalized)).findFirst();
  }
}
