package com.gentoro.hierarchy.engine;

import com.gentoro.hierarchy.exception.SchemaException;
import com.gentoro.hierarchy.logging.LoggingService;
import com.gentoro.hierarchy.schema.HierarchyDocument;
import com.gentoro.hierarchy.schema.HierarchySchema;
import com.gentoro.hierarchy.schema.LevelDeclaration;
import com.gentoro.hierarchy.schema.LevelKind;
import com.gentoro.hierarchy.schema.LevelSpec;
import com.gentoro.hierarchy.schema.NamingPattern;
import com.gentoro.hierarchy.schema.SchemaDocument;
import com.gentoro.hierarchy.schema.TreeNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a parsed schema document and turns it into a {@link HierarchyDocument}. Fails on the first
 * violation with a {@link SchemaException} naming the offending element.
 *
 * <p>Checks run in this order: naming pattern placeholders refer to declared levels; every level
 * has a valid type; optional levels appear in the naming pattern; every reachable instances level
 * has a container with an expansion; adjacent instances levels are nested.
 */
public final class SchemaValidator {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SchemaValidator.class);

  private static final String VALID_TYPES =
      Arrays.stream(LevelKind.values()).map(LevelKind::typeName).collect(Collectors.joining(", "));

  public HierarchyDocument validate(SchemaDocument document) {
    NamingPattern pattern = compilePattern(document.namingPattern());
    List<LevelDeclaration> declarations = document.levels();
    if (declarations.isEmpty()) {
      throw new SchemaException("Schema must declare at least one hierarchy level");
    }

    checkPlaceholders(pattern, declarations);
    List<LevelSpec> levels = resolveLevels(declarations);
    checkOptionalLevels(pattern, levels);

    HierarchySchema schema = new HierarchySchema(levels, pattern, document.format());
    new TreeWalk(schema).walk(document.root(), 0, "");
    log.debug("Schema with levels {} passed validation", schema.levelNames());
    return new HierarchyDocument(schema, document.root());
  }

  private static NamingPattern compilePattern(String source) {
    try {
      return NamingPattern.compile(source);
    } catch (IllegalArgumentException e) {
      throw new SchemaException(
          "Invalid naming_pattern '"
              + source
              + "': "
              + e.getMessage()
              + ". Example: \"{system}:{device}:{signal}\"",
          Map.of("naming_pattern", String.valueOf(source)),
          e);
    }
  }

  private static void checkPlaceholders(NamingPattern pattern, List<LevelDeclaration> levels) {
    Set<String> declared =
        levels.stream()
            .map(LevelDeclaration::name)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    List<String> undefined =
        pattern.placeholders().stream()
            .filter(p -> !declared.contains(p))
            .collect(Collectors.toList());
    if (!undefined.isEmpty()) {
      throw new SchemaException(
          "Naming pattern '"
              + pattern.source()
              + "' references undefined hierarchy levels: "
              + undefined
              + ". Declared levels are "
              + declared
              + "; declare the missing level, e.g. {\"name\": \""
              + undefined.get(0)
              + "\", \"type\": \"tree\"}, or fix the placeholder",
          Map.of("placeholders", undefined));
    }
  }

  private static List<LevelSpec> resolveLevels(List<LevelDeclaration> declarations) {
    List<LevelSpec> levels = new ArrayList<>();
    for (LevelDeclaration d : declarations) {
      if (d.type() == null || d.type().isBlank()) {
        throw new SchemaException(
            "Level '"
                + d.name()
                + "' is missing required 'type' property. Use one of ["
                + VALID_TYPES
                + "], e.g. {\"name\": \""
                + d.name()
                + "\", \"type\": \"tree\"}",
            Map.of("level", d.name()));
      }
      Optional<LevelKind> kind = LevelKind.fromTypeName(d.type());
      if (kind.isEmpty()) {
        throw new SchemaException(
            "Level '"
                + d.name()
                + "' has invalid type '"
                + d.type()
                + "'. Use one of ["
                + VALID_TYPES
                + "], e.g. {\"name\": \""
                + d.name()
                + "\", \"type\": \"instances\"}",
            Map.of("level", d.name(), "type", d.type()));
      }
      levels.add(new LevelSpec(d.name(), kind.get(), d.optional(), d.container()));
    }
    return levels;
  }

  private static void checkOptionalLevels(NamingPattern pattern, List<LevelSpec> levels) {
    for (LevelSpec level : levels) {
      if (level.optional() && !pattern.references(level.name())) {
        throw new SchemaException(
            "Optional level '"
                + level.name()
                + "' must appear in naming_pattern '"
                + pattern.source()
                + "' so that channels without it can be rendered, e.g. add \":{"
                + level.name()
                + "}\"",
            Map.of("level", level.name()));
      }
    }
  }

  /** Visits the tree the same way channels are built, without expanding instance names. */
  private static final class TreeWalk {
    private final HierarchySchema schema;
    private final LeafDetector leafDetector;

    TreeWalk(HierarchySchema schema) {
      this.schema = schema;
      this.leafDetector = new LeafDetector(schema);
    }

    void walk(TreeNode node, int index, String trail) {
      if (index >= schema.size()) return;
      if (index > 0 && leafDetector.isLeaf(node, index)) {
        int next = schema.nextTreeLevel(index);
        if (next >= 0) {
          for (TreeNode child : node.children().values()) {
            walk(child, next + 1, join(trail, child.key()));
          }
        }
        return;
      }

      LevelSpec level = schema.level(index);
      switch (level.kind()) {
        case TREE -> {
          for (TreeNode child : node.children().values()) {
            int next = leafDetector.skipsOptionalLevel(child, index) ? index + 2 : index + 1;
            walk(child, next, join(trail, child.key()));
          }
        }
        case INSTANCES -> walkInstances(node, index, level, trail);
        case LEGACY_CONTAINER -> {
          Optional<TreeNode> container = node.containerFor(level);
          if (container.isEmpty()) return;
          if (container.get().metadata().hasExpansion()) {
            walk(node, index + 1, trail);
          } else {
            for (TreeNode child : container.get().children().values()) {
              walk(child, index + 1, join(join(trail, container.get().key()), child.key()));
            }
          }
        }
      }
    }

    private void walkInstances(TreeNode node, int index, LevelSpec level, String trail) {
      Optional<TreeNode> found = node.containerFor(level);
      if (found.isEmpty()) {
        if (level.optional()) {
          walk(node, index + 1, trail);
          return;
        }
        throw new SchemaException(
            "Instances level '"
                + level.name()
                + "' has no container under '"
                + display(trail)
                + "'. Add a child such as \""
                + level.containerKey().toUpperCase(Locale.ROOT)
                + "\": {\"_expansion\": {\"_type\": \"range\", \"_pattern\": \"D{:02d}\", \"_range\": [1, 3]}}",
            Map.of("level", level.name(), "node", display(trail)));
      }

      TreeNode container = found.get();
      String containerTrail = join(trail, container.key());
      if (!container.metadata().hasExpansion()) {
        throw new SchemaException(
            "Instances container '"
                + containerTrail
                + "' for level '"
                + level.name()
                + "' is missing '_expansion' definition, e.g. \""
                + container.key()
                + "\": {\"_expansion\": {\"_type\": \"list\", \"_instances\": [\"DEV-A\", \"DEV-B\"]}}",
            Map.of("level", level.name(), "node", containerTrail));
      }

      if (index + 1 < schema.size() && schema.level(index + 1).kind() == LevelKind.INSTANCES) {
        LevelSpec next = schema.level(index + 1);
        boolean nested = container.containerFor(next).isPresent();
        Optional<TreeNode> sibling = node.containerFor(next).filter(s -> s != container);
        if (!nested && sibling.isPresent()) {
          throw new SchemaException(
              "Consecutive instance levels '"
                  + level.name()
                  + "' and '"
                  + next.name()
                  + "' must be nested: move '"
                  + join(trail, sibling.get().key())
                  + "' inside '"
                  + containerTrail
                  + "', e.g. \""
                  + container.key()
                  + "\": {\"_expansion\": {...}, \""
                  + sibling.get().key()
                  + "\": {\"_expansion\": {...}}}",
              Map.of("level", level.name(), "next_level", next.name(), "node", containerTrail));
        }
      }

      walk(container, index + 1, containerTrail);
    }

    private static String join(String trail, String key) {
      return trail.isEmpty() ? key : trail + "/" + key;
    }

    private static String display(String trail) {
      return trail.isEmpty() ? "<root>" : trail;
    }
  }
}
