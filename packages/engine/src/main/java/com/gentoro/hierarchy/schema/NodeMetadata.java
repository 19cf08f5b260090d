package com.gentoro.hierarchy.schema;

/**
 * Underscore-prefixed attributes of a tree node.
 *
 * @param description free text, never {@code null}
 * @param channelPart value used in identifiers instead of the node key; {@code ""} marks a
 *     navigation-only node; {@code null} when absent
 * @param leaf explicit {@code _is_leaf} marker
 * @param expansion generated names, {@code null} when absent
 * @param separator join string placed after this node's value, {@code null} to use the pattern
 */
public record NodeMetadata(
    String description, String channelPart, boolean leaf, ExpansionSpec expansion, String separator) {

  public static final NodeMetadata EMPTY = new NodeMetadata("", null, false, null, null);

  public NodeMetadata {
    if (description == null) description = "";
  }

  public boolean hasExpansion() {
    return expansion != null;
  }

  public boolean hasSeparator() {
    return separator != null;
  }
}
