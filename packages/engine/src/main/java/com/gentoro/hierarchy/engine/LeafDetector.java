package com.gentoro.hierarchy.engine;

import com.gentoro.hierarchy.schema.HierarchySchema;
import com.gentoro.hierarchy.schema.LevelKind;
import com.gentoro.hierarchy.schema.LevelSpec;
import com.gentoro.hierarchy.schema.TreeNode;

/**
 * Decides whether a node terminates a channel when reached at a given level index.
 *
 * <p>Rules, first match wins: an explicit {@code _is_leaf} marker; no child nodes; no levels left;
 * every remaining level is optional and the node has nothing for the next one. The root is never
 * a leaf.
 */
public final class LeafDetector {
  private final HierarchySchema schema;

  public LeafDetector(HierarchySchema schema) {
    this.schema = schema;
  }

  public boolean isLeaf(TreeNode node, int levelIndex) {
    if (node.isRoot()) return false;
    if (node.metadata().leaf()) return true;
    if (!node.hasChildren()) return true;
    if (levelIndex >= schema.size()) return true;

    for (int i = levelIndex; i < schema.size(); i++) {
      if (!schema.level(i).optional()) return false;
    }
    return !hasChildFor(node, schema.level(levelIndex));
  }

  /**
   * Whether {@code child}, offered at the optional tree level {@code index}, is really a signal of
   * the next tree level. In that case level {@code index} stays empty for the child's channels.
   */
  public boolean skipsOptionalLevel(TreeNode child, int index) {
    LevelSpec level = schema.level(index);
    return level.kind() == LevelKind.TREE
        && level.optional()
        && !child.metadata().hasExpansion()
        && index + 1 < schema.size()
        && schema.level(index + 1).kind() == LevelKind.TREE
        && isLeaf(child, index + 1);
  }

  private static boolean hasChildFor(TreeNode node, LevelSpec level) {
    return switch (level.kind()) {
      case TREE -> node.hasChildren();
      case INSTANCES, LEGACY_CONTAINER -> node.containerFor(level).isPresent();
    };
  }
}
