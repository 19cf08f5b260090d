package com.gentoro.hierarchy.loader;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.hierarchy.HierarchyEngine;
import com.gentoro.hierarchy.exception.IoException;
import com.gentoro.hierarchy.exception.SerializationException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaLoaderTest {
  private final SchemaLoader loader = new SchemaLoader();

  @Test
  void readsClasspathJson() {
    JsonNode doc = loader.read("classpath:schemas/legacy_dipoles.json");
    assertEquals("{system}:{family}[{device}]:{field}:{subfield}", doc.get("naming_pattern").asText());
  }

  @Test
  void readsClasspathYaml() {
    JsonNode doc = loader.read("classpath:/schemas/optional_levels.yaml");
    assertEquals(6, doc.get("hierarchy").get("levels").size());
    assertTrue(doc.get("hierarchy").get("levels").get(3).get("optional").asBoolean());
  }

  @Test
  void readsFiles(@TempDir Path dir) throws Exception {
    Path yaml = dir.resolve("schema.yml");
    Files.writeString(
        yaml,
        String.join(
            "\n",
            "hierarchy:",
            "  levels:",
            "    - {name: system, type: tree}",
            "    - {name: signal, type: tree}",
            "  naming_pattern: \"{system}:{signal}\"",
            "tree:",
            "  MAG:",
            "    CURRENT: {}",
            "    VOLTAGE:",
            ""));

    HierarchyEngine engine = HierarchyEngine.load(yaml);
    assertEquals(2, engine.getChannelCount());
    assertTrue(engine.validateChannel("MAG:VOLTAGE"));

    Path json = dir.resolve("schema.json");
    Files.writeString(
        json,
        "{\"hierarchy\": {\"levels\": [{\"name\": \"system\", \"type\": \"tree\"}],"
            + " \"naming_pattern\": \"{system}\"}, \"tree\": {\"MAG\": {}, \"RF\": {}}}");
    assertEquals(2, HierarchyEngine.load(json).getChannelCount());
  }

  @Test
  void missingLocations() {
    IoException resource =
        assertThrows(IoException.class, () -> loader.read("classpath:schemas/absent.json"));
    assertEquals("classpath:schemas/absent.json", resource.getLocation());
    IoException file = assertThrows(IoException.class, () -> loader.read("/nonexistent/absent.json"));
    assertEquals("/nonexistent/absent.json", file.getLocation());
    assertThrows(IoException.class, () -> loader.read(" "));
  }

  @Test
  void malformedContent(@TempDir Path dir) throws Exception {
    Path broken = dir.resolve("broken.json");
    Files.writeString(broken, "{\"hierarchy\": ");
    SerializationException e =
        assertThrows(SerializationException.class, () -> loader.read(broken.toString()));
    assertEquals(broken.toString(), e.getContext().get("source"));
    assertEquals(1, e.getContext().get("line"));
  }

  @Test
  @DisplayName("a key repeated in one object is rejected instead of replacing a subtree")
  void repeatedKeyIsRejected(@TempDir Path dir) throws Exception {
    Path twice = dir.resolve("twice.json");
    Files.writeString(
        twice,
        "{\"tree\": {\"MAG\": {\"QF\": {}}, \"MAG\": {\"QD\": {}}}}");
    SerializationException e =
        assertThrows(SerializationException.class, () -> loader.read(twice.toString()));
    assertTrue(e.getCause().getMessage().contains("Duplicate field 'MAG'"), e.getCause().getMessage());
  }
}
