package com.gentoro.hierarchy;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/**
 * Summary of a loaded hierarchy.
 *
 * @param levelValueCounts number of distinct non-empty values per level across all channels
 * @param firstLevelBreakdown channel count per value of the first level, in tree order
 */
@JsonPropertyOrder({
  "totalChannels",
  "hierarchyLevels",
  "namingPattern",
  "patternLevels",
  "levelValueCounts",
  "firstLevelBreakdown"
})
public record HierarchyStatistics(
    int totalChannels,
    List<String> hierarchyLevels,
    String namingPattern,
    List<String> patternLevels,
    Map<String, Integer> levelValueCounts,
    List<GroupCount> firstLevelBreakdown) {

  public record GroupCount(String name, int channelCount) {}
}
