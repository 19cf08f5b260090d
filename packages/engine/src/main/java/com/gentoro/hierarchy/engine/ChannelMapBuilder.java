package com.gentoro.hierarchy.engine;

import com.gentoro.hierarchy.logging.LoggingService;
import com.gentoro.hierarchy.schema.HierarchySchema;
import com.gentoro.hierarchy.schema.LevelSpec;
import com.gentoro.hierarchy.schema.TreeNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Materializes every identifier the tree can produce with one depth-first walk. The resulting map
 * preserves walk order and keeps the first record when two branches render the same identifier.
 */
public final class ChannelMapBuilder {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ChannelMapBuilder.class);

  private final HierarchySchema schema;
  private final LeafDetector leafDetector;
  private final ExpansionEngine expansions;
  private final IdentifierSynthesizer synthesizer;

  public ChannelMapBuilder(
      HierarchySchema schema,
      LeafDetector leafDetector,
      ExpansionEngine expansions,
      IdentifierSynthesizer synthesizer) {
    this.schema = schema;
    this.leafDetector = leafDetector;
    this.expansions = expansions;
    this.synthesizer = synthesizer;
  }

  public Map<String, ChannelRecord> build(TreeNode root) {
    Map<String, ChannelRecord> channels = new LinkedHashMap<>();
    expand(root, 0, SelectionPath.empty(), channels);
    log.debug("Materialized {} channels", channels.size());
    return Collections.unmodifiableMap(channels);
  }

  private void expand(
      TreeNode node, int index, SelectionPath path, Map<String, ChannelRecord> out) {
    if (index > 0 && leafDetector.isLeaf(node, index)) {
      record(node, path, out);
      if (node.hasChildren()) {
        expandLeafChildren(node, index, path, out);
      }
      return;
    }
    if (index >= schema.size()) return;

    LevelSpec level = schema.level(index);
    switch (level.kind()) {
      case TREE -> expandTreeLevel(node, index, path, out);
      case INSTANCES -> expandInstances(node, index, level, path, out);
      case LEGACY_CONTAINER -> expandLegacy(node, index, level, path, out);
    }
  }

  /** Children of an explicit leaf are values of the next tree level, e.g. RB/SP suffixes. */
  private void expandLeafChildren(
      TreeNode node, int index, SelectionPath path, Map<String, ChannelRecord> out) {
    int next = schema.nextTreeLevel(index);
    if (next < 0) {
      log.debug("Children of leaf '{}' ignored: no tree level after index {}", node, index);
      return;
    }
    SelectionPath base = path;
    for (int i = index; i < next; i++) {
      base = base.skip(schema.level(i).name());
    }
    for (TreeNode child : node.children().values()) {
      expandChild(child, next, base, out);
    }
  }

  private void expandTreeLevel(
      TreeNode node, int index, SelectionPath path, Map<String, ChannelRecord> out) {
    LevelSpec level = schema.level(index);
    for (TreeNode child : node.children().values()) {
      if (leafDetector.skipsOptionalLevel(child, index)) {
        LevelSpec next = schema.level(index + 1);
        SelectionPath skipped =
            path.skip(level.name())
                .with(next.name(), child.channelPart(), child.metadata().separator());
        expand(child, index + 2, skipped, out);
      } else {
        expandChild(child, index, path, out);
      }
    }
  }

  /** Place a tree child at level {@code index}, once per expanded name for hybrid children. */
  private void expandChild(
      TreeNode child, int index, SelectionPath path, Map<String, ChannelRecord> out) {
    String levelName = schema.level(index).name();
    String separator = child.metadata().separator();
    if (child.metadata().hasExpansion()) {
      for (String name : expansions.expand(child.metadata().expansion())) {
        expand(child, index + 1, path.with(levelName, name, separator), out);
      }
    } else {
      expand(child, index + 1, path.with(levelName, child.channelPart(), separator), out);
    }
  }

  private void expandInstances(
      TreeNode node,
      int index,
      LevelSpec level,
      SelectionPath path,
      Map<String, ChannelRecord> out) {
    Optional<TreeNode> found = node.containerFor(level);
    if (found.isEmpty() || !found.get().metadata().hasExpansion()) {
      if (level.optional()) {
        expand(node, index + 1, path.skip(level.name()), out);
      } else {
        log.debug("No instances container for level '{}' under '{}'", level.name(), node);
      }
      return;
    }
    TreeNode container = found.get();
    String separator = container.metadata().separator();
    for (String name : expansions.expand(container.metadata().expansion())) {
      expand(container, index + 1, path.with(level.name(), name, separator), out);
    }
  }

  private void expandLegacy(
      TreeNode node,
      int index,
      LevelSpec level,
      SelectionPath path,
      Map<String, ChannelRecord> out) {
    Optional<TreeNode> found = node.containerFor(level);
    if (found.isEmpty()) return;
    TreeNode container = found.get();
    if (container.metadata().hasExpansion()) {
      String separator = container.metadata().separator();
      for (String name : expansions.expand(container.metadata().expansion())) {
        expand(node, index + 1, path.with(level.name(), name, separator), out);
      }
      return;
    }
    for (TreeNode child : container.children().values()) {
      expand(
          child,
          index + 1,
          path.with(level.name(), child.channelPart(), child.metadata().separator()),
          out);
    }
  }

  private void record(TreeNode node, SelectionPath path, Map<String, ChannelRecord> out) {
    String channel = synthesizer.render(path.values(), path.separators());
    if (channel.isEmpty()) {
      log.debug("Path {} renders an empty identifier; skipped", path);
      return;
    }
    ChannelRecord existing = out.get(channel);
    if (existing != null) {
      log.debug(
          "Duplicate identifier '{}' from path {}; keeping path {}", channel, path, existing.path());
      return;
    }
    out.put(channel, new ChannelRecord(channel, channel, path.values(), node.description(), node));
  }
}
