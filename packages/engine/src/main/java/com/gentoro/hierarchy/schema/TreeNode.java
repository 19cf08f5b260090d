package com.gentoro.hierarchy.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Immutable node of the schema tree. Children keep document order. */
public final class TreeNode {
  public static final String ROOT_KEY = "";

  private final String key;
  private final NodeMetadata metadata;
  private final Map<String, TreeNode> children;
  private final boolean root;

  private TreeNode(String key, NodeMetadata metadata, Map<String, TreeNode> children, boolean root) {
    this.key = Objects.requireNonNull(key, "key");
    this.metadata = metadata == null ? NodeMetadata.EMPTY : metadata;
    this.children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
    this.root = root;
  }

  public static TreeNode root(Map<String, TreeNode> children) {
    return new TreeNode(ROOT_KEY, NodeMetadata.EMPTY, children, true);
  }

  public static TreeNode of(String key, NodeMetadata metadata, Map<String, TreeNode> children) {
    return new TreeNode(key, metadata, children, false);
  }

  public static TreeNode leaf(String key) {
    return new TreeNode(key, NodeMetadata.EMPTY, Map.of(), false);
  }

  public String key() {
    return key;
  }

  public NodeMetadata metadata() {
    return metadata;
  }

  public Map<String, TreeNode> children() {
    return children;
  }

  public boolean isRoot() {
    return root;
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public Optional<TreeNode> child(String childKey) {
    return Optional.ofNullable(children.get(childKey));
  }

  /** Value this node contributes to identifiers: the {@code _channel_part} override or the key. */
  public String channelPart() {
    return metadata.channelPart() != null ? metadata.channelPart() : key;
  }

  public String description() {
    return metadata.description();
  }

  /** Locate the container child of an instances or legacy container level. */
  public Optional<TreeNode> containerFor(LevelSpec level) {
    TreeNode exact = children.get(level.containerKey());
    if (exact != null) return Optional.of(exact);
    return children.values().stream().filter(c -> level.isContainerKey(c.key)).findFirst();
  }

  @Override
  public String toString() {
    return root ? "<root>" : key;
  }
}
