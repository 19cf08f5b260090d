package com.gentoro.hierarchy.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.hierarchy.exception.SchemaException;
import com.gentoro.hierarchy.logging.LoggingService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a JSON/YAML schema document into a {@link SchemaDocument}.
 *
 * <p>Three layouts are accepted:
 *
 * <ul>
 *   <li>{@code hierarchy: {levels: [...], naming_pattern: "..."}}
 *   <li>{@code hierarchy_definition: [...]}, {@code hierarchy_config: {levels: {...}}} and a
 *       top-level {@code naming_pattern}
 *   <li>{@code hierarchy_definition} and {@code naming_pattern} only, where {@code device}, {@code
 *       field} and {@code subfield} are container levels and every other level is a tree level
 * </ul>
 *
 * Only the document shape is checked here; structural rules are enforced by the validator.
 */
public final class SchemaDocumentParser {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SchemaDocumentParser.class);

  public static final String DESCRIPTION = "_description";
  public static final String CHANNEL_PART = "_channel_part";
  public static final String IS_LEAF = "_is_leaf";
  public static final String EXPANSION = "_expansion";
  public static final String SEPARATOR = "_separator";

  private static final String EXPANSION_TYPE = "_type";
  private static final String EXPANSION_PATTERN = "_pattern";
  private static final String EXPANSION_RANGE = "_range";
  private static final String EXPANSION_INSTANCES = "_instances";

  private static final Set<String> LEGACY_CONTAINER_LEVELS = Set.of("device", "field", "subfield");

  private static final String LEVELS_EXAMPLE =
      "{\"hierarchy\": {\"levels\": [{\"name\": \"system\", \"type\": \"tree\"}, "
          + "{\"name\": \"signal\", \"type\": \"tree\"}], \"naming_pattern\": \"{system}:{signal}\"}}";
  private static final String RANGE_EXAMPLE =
      "{\"_type\": \"range\", \"_pattern\": \"D{:02d}\", \"_range\": [1, 3]}";
  private static final String LIST_EXAMPLE =
      "{\"_type\": \"list\", \"_instances\": [\"DEV-A\", \"DEV-B\"]}";

  public SchemaDocument parse(JsonNode document) {
    if (document == null || !document.isObject()) {
      throw new SchemaException("Schema document must be a JSON/YAML object, e.g. " + LEVELS_EXAMPLE);
    }

    SchemaFormat format;
    List<LevelDeclaration> levels;
    String namingPattern;
    JsonNode hierarchy = document.get("hierarchy");
    if (hierarchy != null) {
      format = SchemaFormat.LEVELS;
      if (!hierarchy.isObject()) {
        throw new SchemaException("'hierarchy' must be an object, e.g. " + LEVELS_EXAMPLE);
      }
      levels = parseLevelList(hierarchy.get("levels"));
      namingPattern = requireText(hierarchy, "naming_pattern", "hierarchy.naming_pattern");
    } else if (document.has("hierarchy_definition")) {
      List<String> names = parseDefinition(document.get("hierarchy_definition"));
      namingPattern = requireText(document, "naming_pattern", "naming_pattern");
      if (document.has("hierarchy_config")) {
        format = SchemaFormat.HIERARCHY_CONFIG;
        levels = parseLevelConfig(names, document.get("hierarchy_config"));
      } else {
        format = SchemaFormat.LEGACY;
        levels = inferLegacyLevels(names);
      }
    } else {
      throw new SchemaException(
          "Schema document must define 'hierarchy.levels' (or the older 'hierarchy_definition'), e.g. "
              + LEVELS_EXAMPLE);
    }

    JsonNode tree = document.get("tree");
    if (tree == null || !tree.isObject()) {
      throw new SchemaException(
          "Schema document is missing the 'tree' object, e.g. {\"tree\": {\"MAG\": {\"CURRENT\": {}}}}");
    }
    TreeNode root = TreeNode.root(parseChildren(tree, ""));
    log.debug(
        "Parsed {} schema with {} levels and {} top-level nodes",
        format,
        levels.size(),
        root.children().size());
    return new SchemaDocument(format, levels, namingPattern, root);
  }

  private List<LevelDeclaration> parseLevelList(JsonNode levels) {
    if (levels == null || !levels.isArray() || levels.isEmpty()) {
      throw new SchemaException(
          "'hierarchy.levels' must be a non-empty list of level objects, e.g. " + LEVELS_EXAMPLE);
    }
    List<LevelDeclaration> result = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    int position = 0;
    for (JsonNode level : levels) {
      position++;
      if (!level.isObject()) {
        throw new SchemaException(
            "Level #" + position + " must be an object, e.g. {\"name\": \"system\", \"type\": \"tree\"}");
      }
      JsonNode name = level.get("name");
      if (name == null || !name.isTextual() || name.asText().isBlank()) {
        throw new SchemaException(
            "Level #"
                + position
                + " is missing 'name', e.g. {\"name\": \"system\", \"type\": \"tree\"}");
      }
      String levelName = name.asText().trim();
      if (!seen.add(levelName)) {
        throw new SchemaException(
            "Level '" + levelName + "' is declared more than once", Map.of("level", levelName));
      }
      result.add(
          new LevelDeclaration(
              levelName,
              optionalText(level, "type"),
              level.path("optional").asBoolean(false),
              optionalText(level, "container")));
    }
    return result;
  }

  private List<String> parseDefinition(JsonNode definition) {
    if (definition == null || !definition.isArray() || definition.isEmpty()) {
      throw new SchemaException(
          "'hierarchy_definition' must be a non-empty list of level names, e.g. [\"system\", \"family\", \"device\"]");
    }
    List<String> names = new ArrayList<>();
    for (JsonNode n : definition) {
      if (!n.isTextual() || n.asText().isBlank()) {
        throw new SchemaException("'hierarchy_definition' entries must be level names, found " + n);
      }
      String name = n.asText().trim();
      if (names.contains(name)) {
        throw new SchemaException(
            "Level '" + name + "' is declared more than once", Map.of("level", name));
      }
      names.add(name);
    }
    return names;
  }

  private List<LevelDeclaration> parseLevelConfig(List<String> names, JsonNode config) {
    JsonNode levels = config == null ? null : config.get("levels");
    if (levels == null || !levels.isObject()) {
      throw new SchemaException(
          "hierarchy_config must contain 'levels' key mapping each level to its settings, e.g. "
              + "{\"hierarchy_config\": {\"levels\": {\"system\": {\"type\": \"tree\"}}}}");
    }
    List<LevelDeclaration> result = new ArrayList<>();
    for (String name : names) {
      JsonNode levelConfig = levels.get(name);
      if (levelConfig == null || !levelConfig.isObject()) {
        throw new SchemaException(
            "Level '"
                + name
                + "' not found in hierarchy_config.levels. Add it, e.g. \""
                + name
                + "\": {\"type\": \"tree\"}",
            Map.of("level", name));
      }
      result.add(
          new LevelDeclaration(
              name,
              optionalText(levelConfig, "type"),
              levelConfig.path("optional").asBoolean(false),
              optionalText(levelConfig, "container")));
    }
    return result;
  }

  private List<LevelDeclaration> inferLegacyLevels(List<String> names) {
    List<LevelDeclaration> result = new ArrayList<>();
    for (String name : names) {
      LevelKind kind =
          LEGACY_CONTAINER_LEVELS.contains(name) ? LevelKind.LEGACY_CONTAINER : LevelKind.TREE;
      result.add(new LevelDeclaration(name, kind.typeName(), false, null));
    }
    return result;
  }

  private Map<String, TreeNode> parseChildren(JsonNode object, String trail) {
    Map<String, TreeNode> children = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = object.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      if (e.getKey().startsWith("_")) continue;
      children.put(e.getKey(), parseNode(e.getKey(), e.getValue(), join(trail, e.getKey())));
    }
    return children;
  }

  private TreeNode parseNode(String key, JsonNode value, String trail) {
    if (value == null || value.isNull()) {
      return TreeNode.leaf(key);
    }
    if (!value.isObject()) {
      throw new SchemaException(
          "Tree node '"
              + trail
              + "' must be an object, e.g. \""
              + key
              + "\": {\"_description\": \"...\"}",
          Map.of("node", trail));
    }

    ExpansionSpec expansion = null;
    JsonNode expansionNode = value.get(EXPANSION);
    if (expansionNode != null) {
      expansion = parseExpansion(expansionNode, trail);
    } else if (value.has(EXPANSION_TYPE)) {
      // legacy containers carry the expansion inline
      expansion = parseExpansion(value, trail);
    }

    NodeMetadata metadata =
        new NodeMetadata(
            value.hasNonNull(DESCRIPTION) ? value.get(DESCRIPTION).asText() : "",
            value.hasNonNull(CHANNEL_PART) ? value.get(CHANNEL_PART).asText() : null,
            value.path(IS_LEAF).asBoolean(false),
            expansion,
            value.hasNonNull(SEPARATOR) ? value.get(SEPARATOR).asText() : null);
    return TreeNode.of(key, metadata, parseChildren(value, trail));
  }

  private ExpansionSpec parseExpansion(JsonNode spec, String trail) {
    Map<String, Object> ctx = Map.of("node", trail);
    if (!spec.isObject()) {
      throw new SchemaException(
          "'_expansion' of '" + trail + "' must be an object, e.g. " + RANGE_EXAMPLE, ctx);
    }
    String type = spec.path(EXPANSION_TYPE).asText("");
    switch (type) {
      case "range":
        return parseRange(spec, trail, ctx);
      case "list":
        return parseList(spec, trail, ctx);
      default:
        throw new SchemaException(
            "Expansion of '"
                + trail
                + "' has invalid '_type' '"
                + type
                + "'. Use 'range' ("
                + RANGE_EXAMPLE
                + ") or 'list' ("
                + LIST_EXAMPLE
                + ")",
            ctx);
    }
  }

  private ExpansionSpec parseRange(JsonNode spec, String trail, Map<String, Object> ctx) {
    JsonNode pattern = spec.get(EXPANSION_PATTERN);
    if (pattern == null || !pattern.isTextual()) {
      throw new SchemaException(
          "Range expansion of '" + trail + "' requires '_pattern' field, e.g. " + RANGE_EXAMPLE,
          ctx);
    }
    JsonNode range = spec.get(EXPANSION_RANGE);
    if (range == null) {
      throw new SchemaException(
          "Range expansion of '" + trail + "' requires '_range' field, e.g. " + RANGE_EXAMPLE, ctx);
    }
    if (!range.isArray() || range.size() != 2) {
      throw new SchemaException(
          "'_range' of '" + trail + "' must be [start, end] list, e.g. [1, 3]", ctx);
    }
    if (!range.get(0).isIntegralNumber() || !range.get(1).isIntegralNumber()) {
      throw new SchemaException(
          "'_range' of '" + trail + "': start and end must be integers, e.g. [1, 3]", ctx);
    }
    long start = range.get(0).asLong();
    long end = range.get(1).asLong();
    if (start > end) {
      throw new SchemaException(
          "'_range' of '"
              + trail
              + "': start must be <= end, found ["
              + start
              + ", "
              + end
              + "]. Swap the bounds, e.g. ["
              + end
              + ", "
              + start
              + "]",
          ctx);
    }
    IndexPattern compiled;
    try {
      compiled = IndexPattern.compile(pattern.asText());
    } catch (IllegalArgumentException e) {
      throw new SchemaException(
          "Invalid '_pattern' of '" + trail + "': " + e.getMessage() + ". Example: \"D{:02d}\"",
          ctx);
    }
    return new ExpansionSpec.Range(compiled, start, end);
  }

  private ExpansionSpec parseList(JsonNode spec, String trail, Map<String, Object> ctx) {
    JsonNode instances = spec.get(EXPANSION_INSTANCES);
    if (instances == null || !instances.isArray()) {
      throw new SchemaException(
          "List expansion of '" + trail + "' requires '_instances' field, e.g. " + LIST_EXAMPLE,
          ctx);
    }
    if (instances.isEmpty()) {
      throw new SchemaException(
          "List expansion of '" + trail + "' must list at least one instance, e.g. " + LIST_EXAMPLE,
          ctx);
    }
    List<String> names = new ArrayList<>();
    for (JsonNode n : instances) {
      if (!n.isValueNode() || n.isNull()) {
        throw new SchemaException(
            "'_instances' of '" + trail + "' must contain plain names, found " + n, ctx);
      }
      names.add(n.asText());
    }
    return new ExpansionSpec.Names(names);
  }

  private static String requireText(JsonNode parent, String field, String displayName) {
    JsonNode value = parent.get(field);
    if (value == null || !value.isTextual()) {
      throw new SchemaException(
          "Schema is missing '" + displayName + "', e.g. \"" + field + "\": \"{system}:{signal}\"");
    }
    return value.asText();
  }

  private static String optionalText(JsonNode parent, String field) {
    JsonNode value = parent.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static String join(String trail, String key) {
    return trail.isEmpty() ? key : trail + "/" + key;
  }
}
