package com.gentoro.hierarchy;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.hierarchy.engine.ChannelMapBuilder;
import com.gentoro.hierarchy.engine.ChannelRecord;
import com.gentoro.hierarchy.engine.ExpansionEngine;
import com.gentoro.hierarchy.engine.IdentifierSynthesizer;
import com.gentoro.hierarchy.engine.LeafDetector;
import com.gentoro.hierarchy.engine.NavigationOption;
import com.gentoro.hierarchy.engine.SchemaValidator;
import com.gentoro.hierarchy.engine.SegmentResolver;
import com.gentoro.hierarchy.engine.SeparatorCleaner;
import com.gentoro.hierarchy.engine.TreeNavigator;
import com.gentoro.hierarchy.loader.SchemaLoader;
import com.gentoro.hierarchy.logging.LoggingService;
import com.gentoro.hierarchy.schema.HierarchyDocument;
import com.gentoro.hierarchy.schema.HierarchySchema;
import com.gentoro.hierarchy.schema.LevelSpec;
import com.gentoro.hierarchy.schema.SchemaDocumentParser;
import com.gentoro.hierarchy.schema.TreeNode;
import com.gentoro.hierarchy.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read API over one schema document. Everything is built eagerly by the factory methods; an
 * instance is immutable and safe to share between threads.
 */
public final class HierarchyEngine {
  private static final org.slf4j.Logger log = LoggingService.getLogger(HierarchyEngine.class);

  private final HierarchySchema schema;
  private final TreeNode root;
  private final TreeNavigator navigator;
  private final IdentifierSynthesizer synthesizer;
  private final Map<String, ChannelRecord> channels;

  private HierarchyEngine(HierarchyDocument document) {
    this.schema = document.schema();
    this.root = document.root();
    ExpansionEngine expansions = new ExpansionEngine();
    LeafDetector leafDetector = new LeafDetector(schema);
    this.navigator = new TreeNavigator(schema, root, leafDetector, expansions);
    this.synthesizer =
        new IdentifierSynthesizer(
            schema, new SegmentResolver(schema, root, navigator), new SeparatorCleaner());
    this.channels =
        new ChannelMapBuilder(schema, leafDetector, expansions, synthesizer).build(root);
  }

  /** Load a JSON ({@code .json}) or YAML ({@code .yaml}, {@code .yml}) schema file. */
  public static HierarchyEngine load(Path path) {
    return fromDocument(new SchemaLoader().read(path.toString()));
  }

  public static HierarchyEngine fromJson(String json) {
    return fromDocument(JacksonUtility.readJsonTree(json, "schema document"));
  }

  /**
   * Parse, validate and materialize a schema document.
   *
   * @throws com.gentoro.hierarchy.exception.SchemaException if the document is invalid
   */
  public static HierarchyEngine fromDocument(JsonNode document) {
    long started = System.nanoTime();
    HierarchyDocument parsed =
        new SchemaValidator().validate(new SchemaDocumentParser().parse(document));
    HierarchyEngine engine = new HierarchyEngine(parsed);
    log.info(
        "Loaded {} schema: {} levels, pattern '{}', {} channels in {} ms",
        parsed.schema().format(),
        engine.schema.size(),
        engine.schema.namingPattern().source(),
        engine.channels.size(),
        (System.nanoTime() - started) / 1_000_000);
    return engine;
  }

  public List<String> getHierarchyDefinition() {
    return schema.levelNames();
  }

  public HierarchySchema getSchema() {
    return schema;
  }

  public List<NavigationOption> getOptionsAtLevel(String level, Map<String, ?> selections) {
    return navigator.getOptions(level, selections);
  }

  public Optional<TreeNode> navigateTo(String level, Map<String, ?> selections) {
    return navigator.navigateTo(level, selections);
  }

  public List<String> buildChannelsFromSelections(Map<String, ?> selections) {
    return synthesizer.synthesize(selections);
  }

  public boolean validateChannel(String channel) {
    return channel != null && channels.containsKey(channel);
  }

  public Optional<ChannelRecord> getChannel(String channel) {
    return channel == null ? Optional.empty() : Optional.ofNullable(channels.get(channel));
  }

  public List<ChannelRecord> getAllChannels() {
    return List.copyOf(channels.values());
  }

  public int getChannelCount() {
    return channels.size();
  }

  public HierarchyStatistics getStatistics() {
    Map<String, Set<String>> distinct = new LinkedHashMap<>();
    for (LevelSpec level : schema.levels()) {
      distinct.put(level.name(), new HashSet<>());
    }
    String firstLevel = schema.level(0).name();
    Map<String, Integer> byFirstLevel = new LinkedHashMap<>();
    for (ChannelRecord channel : channels.values()) {
      channel.path().forEach(
          (level, value) -> {
            if (!value.isEmpty()) distinct.get(level).add(value);
          });
      String first = channel.path().getOrDefault(firstLevel, "");
      byFirstLevel.merge(first, 1, Integer::sum);
    }

    Map<String, Integer> levelValueCounts = new LinkedHashMap<>();
    distinct.forEach((level, values) -> levelValueCounts.put(level, values.size()));
    List<HierarchyStatistics.GroupCount> breakdown = new ArrayList<>();
    byFirstLevel.forEach(
        (name, count) -> breakdown.add(new HierarchyStatistics.GroupCount(name, count)));

    return new HierarchyStatistics(
        channels.size(),
        schema.levelNames(),
        schema.namingPattern().source(),
        schema.patternLevels().stream().map(LevelSpec::name).toList(),
        levelValueCounts,
        breakdown);
  }
}
