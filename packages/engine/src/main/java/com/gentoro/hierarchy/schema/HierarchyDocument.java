package com.gentoro.hierarchy.schema;

import java.util.Objects;

/** Parsed schema document: hierarchy declaration plus the root of the tree. */
public record HierarchyDocument(HierarchySchema schema, TreeNode root) {
  public HierarchyDocument {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(root, "root");
  }
}
