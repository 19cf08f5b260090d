package com.gentoro.hierarchy.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.hierarchy.exception.HierarchyErrorCode;
import com.gentoro.hierarchy.exception.SchemaException;
import com.gentoro.hierarchy.schema.HierarchyDocument;
import com.gentoro.hierarchy.schema.LevelKind;
import com.gentoro.hierarchy.schema.SchemaDocumentParser;
import com.gentoro.hierarchy.utility.JacksonUtility;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SchemaValidatorTest {
  private final SchemaDocumentParser parser = new SchemaDocumentParser();
  private final SchemaValidator validator = new SchemaValidator();

  private HierarchyDocument validate(String json) throws Exception {
    return validator.validate(parser.parse(JacksonUtility.getJsonMapper().readTree(json)));
  }

  private SchemaException rejected(String json) {
    return assertThrows(SchemaException.class, () -> validate(json));
  }

  @Test
  @DisplayName("valid document resolves level kinds and pattern levels")
  void validDocument() throws Exception {
    HierarchyDocument doc =
        validate(
            """
            {"hierarchy": {"levels": [
                {"name": "system", "type": "tree"},
                {"name": "location", "type": "tree"},
                {"name": "device", "type": "instances"},
                {"name": "signal", "type": "tree"}],
              "naming_pattern": "{system}:{device}:{signal}"},
             "tree": {"RF": {"Hall-A": {"DEVICE": {
                "_expansion": {"_type": "range", "_pattern": "CAV{:02d}", "_range": [1, 2]},
                "Voltage": {}}}}}}
            """);

    assertEquals(List.of("system", "location", "device", "signal"), doc.schema().levelNames());
    assertEquals(LevelKind.INSTANCES, doc.schema().level(2).kind());
    assertEquals(
        List.of("system", "device", "signal"),
        doc.schema().patternLevels().stream().map(l -> l.name()).toList());
  }

  @Test
  void undefinedPlaceholder() {
    SchemaException e =
        rejected(
            """
            {"hierarchy": {"levels": [{"name": "system", "type": "tree"},
                                      {"name": "device", "type": "tree"}],
                           "naming_pattern": "{system}:{undefined_level}"},
             "tree": {"SYS": {"DEV": {}}}}
            """);
    assertTrue(e.getMessage().contains("undefined hierarchy levels"));
    assertTrue(e.getMessage().contains("undefined_level"));
  }

  @Test
  void missingType() {
    SchemaException e =
        rejected(
            """
            {"hierarchy": {"levels": [{"name": "system"}], "naming_pattern": "{system}"},
             "tree": {}}
            """);
    assertTrue(e.getMessage().contains("is missing required 'type' property"));
  }

  @Test
  void invalidType() {
    SchemaException e =
        rejected(
            """
            {"hierarchy": {"levels": [{"name": "system", "type": "branch"}],
                           "naming_pattern": "{system}"},
             "tree": {}}
            """);
    assertTrue(e.getMessage().contains("has invalid type 'branch'"));
    assertEquals("system", e.getContext().get("level"));
  }

  @Test
  void optionalLevelMustBeInPattern() {
    SchemaException e =
        rejected(
            """
            {"hierarchy": {"levels": [{"name": "system", "type": "tree"},
                                      {"name": "subsystem", "type": "tree", "optional": true},
                                      {"name": "signal", "type": "tree"}],
                           "naming_pattern": "{system}:{signal}"},
             "tree": {"SYS": {"SIG": {}}}}
            """);
    assertTrue(e.getMessage().contains("Optional level 'subsystem' must appear in naming_pattern"));
  }

  @Test
  void formatSpecInNamingPattern() {
    SchemaException e =
        rejected(
            """
            {"hierarchy": {"levels": [{"name": "device", "type": "tree"}],
                           "naming_pattern": "{device:02d}"},
             "tree": {}}
            """);
    assertTrue(e.getMessage().startsWith("Invalid naming_pattern"));
  }

  @Test
  @DisplayName("unbalanced naming pattern keeps the pattern in context and the parse failure as cause")
  void unbalancedNamingPatternCarriesContextAndCause() {
    SchemaException e =
        rejected(
            """
            {"hierarchy": {"levels": [{"name": "device", "type": "tree"}],
                           "naming_pattern": "{device"},
             "tree": {}}
            """);
    assertEquals(HierarchyErrorCode.INVALID_SCHEMA, e.getCode());
    assertEquals("{device", e.getContext().get("naming_pattern"));
    assertInstanceOf(IllegalArgumentException.class, e.getCause());
    assertTrue(e.getMessage().contains("Unclosed '{'"), e.getMessage());
  }

  @Test
  void instancesLevelWithoutContainer() {
    SchemaException e =
        rejected(
            """
            {"hierarchy": {"levels": [{"name": "system", "type": "tree"},
                                      {"name": "device", "type": "instances"},
                                      {"name": "signal", "type": "tree"}],
                           "naming_pattern": "{system}:{device}:{signal}"},
             "tree": {"SYS": {"SIG": {}}}}
            """);
    assertTrue(e.getMessage().contains("Instances level 'device' has no container under 'SYS'"));
  }

  @Test
  void containerWithoutExpansion() {
    SchemaException e =
        rejected(
            """
            {"hierarchy": {"levels": [{"name": "system", "type": "tree"},
                                      {"name": "device", "type": "instances"},
                                      {"name": "signal", "type": "tree"}],
                           "naming_pattern": "{system}:{device}:{signal}"},
             "tree": {"SYS": {"DEVICE": {"SIG": {}}}}}
            """);
    assertTrue(e.getMessage().contains("is missing '_expansion' definition"));
    assertEquals("SYS/DEVICE", e.getContext().get("node"));
  }

  @Test
  @DisplayName("consecutive instance levels declared as siblings are rejected")
  void consecutiveInstancesAsSiblings() {
    SchemaException e =
        rejected(
            """
            {"hierarchy_definition": ["floor", "room"],
             "naming_pattern": "F{floor}:R{room}",
             "hierarchy_config": {"levels": {"floor": {"type": "instances"},
                                             "room": {"type": "instances"}}},
             "tree": {
               "FLOOR": {"_expansion": {"_type": "range", "_pattern": "{}", "_range": [1, 2]}},
               "ROOM": {"_expansion": {"_type": "range", "_pattern": "{:03d}", "_range": [101, 102]}}}}
            """);
    assertTrue(e.getMessage().contains("Consecutive instance levels 'floor' and 'room'"));
  }

  @Test
  void consecutiveInstancesNested() throws Exception {
    HierarchyDocument doc =
        validate(
            """
            {"hierarchy_definition": ["floor", "room"],
             "naming_pattern": "F{floor}:R{room}",
             "hierarchy_config": {"levels": {"floor": {"type": "instances"},
                                             "room": {"type": "instances"}}},
             "tree": {
               "FLOOR": {"_expansion": {"_type": "range", "_pattern": "{}", "_range": [1, 2]},
                 "ROOM": {"_expansion": {"_type": "range", "_pattern": "{:03d}", "_range": [101, 102]}}}}}
            """);
    assertEquals(2, doc.schema().size());
  }

  @Test
  void optionalInstancesLevelMayBeAbsent() throws Exception {
    HierarchyDocument doc =
        validate(
            """
            {"hierarchy": {"levels": [{"name": "system", "type": "tree"},
                                      {"name": "device", "type": "instances", "optional": true},
                                      {"name": "signal", "type": "tree"}],
                           "naming_pattern": "{system}:{device}:{signal}"},
             "tree": {"SYS": {"SIG": {}}}}
            """);
    assertTrue(doc.schema().level(1).optional());
  }
}
