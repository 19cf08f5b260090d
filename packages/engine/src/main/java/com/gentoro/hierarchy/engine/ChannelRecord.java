package com.gentoro.hierarchy.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.hierarchy.schema.TreeNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One materialized identifier.
 *
 * @param channel the identifier
 * @param address control-system address; equal to {@code channel}
 * @param path level to value for every level visited, skipped levels hold {@code ""}
 * @param description description of the node that ended the channel
 * @param source node that ended the channel
 */
@JsonPropertyOrder({"channel", "address", "path", "description"})
public record ChannelRecord(
    String channel,
    String address,
    Map<String, String> path,
    String description,
    @JsonIgnore TreeNode source) {

  public ChannelRecord {
    path = Collections.unmodifiableMap(new LinkedHashMap<>(path));
  }
}
