package com.gentoro.hierarchy.engine;

import com.gentoro.hierarchy.logging.LoggingService;
import com.gentoro.hierarchy.schema.ExpansionSpec;
import com.gentoro.hierarchy.schema.HierarchySchema;
import com.gentoro.hierarchy.schema.LevelSpec;
import com.gentoro.hierarchy.schema.TreeNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers "what can be chosen at this level" for a partial set of selections. Never throws for
 * unknown levels or unmatched selections; those yield no options.
 */
public final class TreeNavigator {
  private static final org.slf4j.Logger log = LoggingService.getLogger(TreeNavigator.class);

  private final HierarchySchema schema;
  private final TreeNode root;
  private final LeafDetector leafDetector;
  private final ExpansionEngine expansions;

  public TreeNavigator(
      HierarchySchema schema, TreeNode root, LeafDetector leafDetector, ExpansionEngine expansions) {
    this.schema = schema;
    this.root = root;
    this.leafDetector = leafDetector;
    this.expansions = expansions;
  }

  /**
   * Options available at {@code levelName} given the selections made at earlier levels. A list
   * selection navigates through its first element.
   */
  public List<NavigationOption> getOptions(String levelName, Map<String, ?> selections) {
    Optional<TreeNode> position = navigateTo(levelName, selections);
    if (position.isEmpty()) return List.of();

    int index = schema.indexOf(levelName);
    LevelSpec level = schema.level(index);
    TreeNode node = position.get();
    List<NavigationOption> options = new ArrayList<>();
    switch (level.kind()) {
      case TREE -> {
        for (TreeNode child : node.children().values()) {
          OptionKind kind = kindOf(child, index + 1);
          if (child.metadata().hasExpansion()) {
            for (String name : expansions.expand(child.metadata().expansion())) {
              options.add(new NavigationOption(name, child.description(), kind));
            }
          } else {
            options.add(new NavigationOption(child.key(), child.description(), kind));
          }
        }
      }
      case INSTANCES -> {
        Optional<TreeNode> container = node.containerFor(level);
        if (container.isPresent() && container.get().metadata().hasExpansion()) {
          OptionKind kind = kindOf(container.get(), index + 1);
          for (String name : expansions.expand(container.get().metadata().expansion())) {
            options.add(new NavigationOption(name, container.get().description(), kind));
          }
        }
      }
      case LEGACY_CONTAINER -> {
        Optional<TreeNode> container = node.containerFor(level);
        if (container.isPresent()) {
          if (container.get().metadata().hasExpansion()) {
            OptionKind kind = kindOf(node, index + 1);
            for (String name : expansions.expand(container.get().metadata().expansion())) {
              options.add(new NavigationOption(name, container.get().description(), kind));
            }
          } else {
            for (TreeNode child : container.get().children().values()) {
              options.add(
                  new NavigationOption(child.key(), child.description(), kindOf(child, index + 1)));
            }
          }
        }
      }
    }
    return Collections.unmodifiableList(options);
  }

  /**
   * Tree position at which the options of {@code levelName} are looked up, or empty when the level
   * is unknown or a selection does not match.
   */
  public Optional<TreeNode> navigateTo(String levelName, Map<String, ?> selections) {
    int target = schema.indexOf(levelName);
    if (target < 0) {
      log.debug("Unknown hierarchy level '{}'", levelName);
      return Optional.empty();
    }
    Map<String, ?> chosen = selections == null ? Map.of() : selections;
    TreeNode node = root;
    for (int i = 0; i < target; i++) {
      LevelSpec level = schema.level(i);
      String value = Selections.first(chosen.get(level.name()));
      Optional<TreeNode> next = step(node, level, value);
      if (next.isEmpty()) {
        log.debug(
            "Selection '{}' for level '{}' does not continue from '{}'", value, level.name(), node);
        return Optional.empty();
      }
      node = next.get();
    }
    return Optional.of(node);
  }

  /**
   * Child of {@code node} selected by {@code value}: by key, then by membership in a child's
   * expansion, then by channel part.
   */
  public Optional<TreeNode> findChild(TreeNode node, String value) {
    if (value == null) return Optional.empty();
    Optional<TreeNode> byKey = node.child(value);
    if (byKey.isPresent()) return byKey;
    for (TreeNode child : node.children().values()) {
      ExpansionSpec spec = child.metadata().expansion();
      if (spec != null && expansions.contains(spec, value)) return Optional.of(child);
    }
    for (TreeNode child : node.children().values()) {
      if (value.equals(child.metadata().channelPart())) return Optional.of(child);
    }
    return Optional.empty();
  }

  private Optional<TreeNode> step(TreeNode node, LevelSpec level, String value) {
    return switch (level.kind()) {
      case TREE -> {
        if (value == null) yield level.optional() ? Optional.of(node) : Optional.empty();
        yield findChild(node, value);
      }
      case INSTANCES -> stepInstances(node, level, value);
      case LEGACY_CONTAINER -> stepLegacy(node, level, value);
    };
  }

  private Optional<TreeNode> stepInstances(TreeNode node, LevelSpec level, String value) {
    Optional<TreeNode> container = node.containerFor(level);
    if (container.isEmpty()) {
      return level.optional() ? Optional.of(node) : Optional.empty();
    }
    if (value == null) {
      return level.optional() ? container : Optional.empty();
    }
    ExpansionSpec spec = container.get().metadata().expansion();
    if (spec == null || !expansions.contains(spec, value)) return Optional.empty();
    return container;
  }

  private Optional<TreeNode> stepLegacy(TreeNode node, LevelSpec level, String value) {
    Optional<TreeNode> container = node.containerFor(level);
    if (container.isEmpty()) return Optional.empty();
    ExpansionSpec spec = container.get().metadata().expansion();
    if (spec != null) {
      // expanded names are siblings; the position does not move
      if (value != null && !expansions.contains(spec, value)) return Optional.empty();
      return Optional.of(node);
    }
    if (value == null) return Optional.empty();
    return container.get().child(value);
  }

  private OptionKind kindOf(TreeNode node, int nextIndex) {
    return leafDetector.isLeaf(node, nextIndex) ? OptionKind.DIRECT_SIGNAL : OptionKind.CONTAINER;
  }
}
