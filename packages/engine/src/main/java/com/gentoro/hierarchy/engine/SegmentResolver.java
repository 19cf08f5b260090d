package com.gentoro.hierarchy.engine;

import com.gentoro.hierarchy.schema.HierarchySchema;
import com.gentoro.hierarchy.schema.LevelSpec;
import com.gentoro.hierarchy.schema.TreeNode;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Follows one combination of selected values through the tree so that node keys become channel
 * parts and per-node separator overrides are picked up. Values that cannot be placed in the tree
 * are kept verbatim.
 */
public final class SegmentResolver {

  /** Level values ready for rendering plus the separator overrides that apply to them. */
  public record Resolution(Map<String, String> values, Map<String, String> separators) {}

  private final HierarchySchema schema;
  private final TreeNode root;
  private final TreeNavigator navigator;

  public SegmentResolver(HierarchySchema schema, TreeNode root, TreeNavigator navigator) {
    this.schema = schema;
    this.root = root;
    this.navigator = navigator;
  }

  public Resolution resolve(Map<String, String> combination) {
    Map<String, String> values = new LinkedHashMap<>();
    Map<String, String> separators = new HashMap<>();
    TreeNode node = root;
    for (LevelSpec level : schema.levels()) {
      String name = level.name();
      String value = combination.getOrDefault(name, "");
      if (value == null) value = "";

      switch (level.kind()) {
        case TREE -> {
          if (value.isEmpty() || node == null) {
            values.put(name, value);
            break;
          }
          Optional<TreeNode> child = navigator.findChild(node, value);
          if (child.isEmpty()) {
            values.put(name, value);
            node = null;
            break;
          }
          TreeNode c = child.get();
          boolean expandedName = !c.key().equals(value) && c.metadata().hasExpansion();
          values.put(name, expandedName ? value : c.channelPart());
          if (c.metadata().hasSeparator()) separators.put(name, c.metadata().separator());
          node = c;
        }
        case INSTANCES -> {
          values.put(name, value);
          Optional<TreeNode> container =
              node == null ? Optional.empty() : node.containerFor(level);
          if (container.isPresent()) {
            if (container.get().metadata().hasSeparator()) {
              separators.put(name, container.get().metadata().separator());
            }
            node = container.get();
          } else if (!value.isEmpty()) {
            node = null;
          }
        }
        case LEGACY_CONTAINER -> {
          Optional<TreeNode> container =
              node == null ? Optional.empty() : node.containerFor(level);
          if (container.isEmpty()) {
            values.put(name, value);
            if (!value.isEmpty()) node = null;
          } else if (container.get().metadata().hasExpansion()) {
            values.put(name, value);
            if (container.get().metadata().hasSeparator()) {
              separators.put(name, container.get().metadata().separator());
            }
          } else {
            Optional<TreeNode> child = container.get().child(value);
            values.put(name, child.map(TreeNode::channelPart).orElse(value));
            if (child.isPresent() && child.get().metadata().hasSeparator()) {
              separators.put(name, child.get().metadata().separator());
            }
            node = child.orElse(null);
          }
        }
      }
    }
    return new Resolution(values, separators);
  }
}
