package com.gentoro.hierarchy.schema;

import java.util.List;

/**
 * Schema document after parsing but before validation. Level types are still raw strings and the
 * naming pattern is not compiled yet.
 */
public record SchemaDocument(
    SchemaFormat format, List<LevelDeclaration> levels, String namingPattern, TreeNode root) {
  public SchemaDocument {
    levels = List.copyOf(levels);
  }
}
