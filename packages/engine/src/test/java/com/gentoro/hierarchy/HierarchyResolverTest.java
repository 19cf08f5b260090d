package com.gentoro.hierarchy;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.hierarchy.exception.ConfigException;
import com.gentoro.hierarchy.exception.IoException;
import com.gentoro.hierarchy.exception.StateException;
import com.gentoro.hierarchy.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HierarchyResolverTest {
  private static final String CONFIG = "classpath:application-test.yaml";

  private static HierarchyResolver resolver(String... args) {
    String[] all = new String[args.length + 2];
    all[0] = "--config-file";
    all[1] = CONFIG;
    System.arraycopy(args, 0, all, 2, args.length);
    HierarchyResolver resolver = new HierarchyResolver(all);
    resolver.initialize();
    return resolver;
  }

  private static JsonNode run(String... args) throws Exception {
    return JacksonUtility.getJsonMapper().readTree(resolver(args).run());
  }

  @Test
  void statisticsByDefault() throws Exception {
    JsonNode stats = run();
    assertEquals(16, stats.get("totalChannels").asInt());
    assertEquals("CTRL", stats.get("firstLevelBreakdown").get(0).get("name").asText());
  }

  @Test
  void optionsMode() throws Exception {
    JsonNode options =
        run("--mode", "options", "--level", "device", "--select", "system=CTRL,subsystem=MAIN");
    assertEquals(2, options.size());
    assertEquals("MC-01", options.get(0).get("name").asText());
    assertEquals("CONTAINER", options.get(0).get("kind").asText());
  }

  @Test
  void channelsFromSelections() throws Exception {
    JsonNode channels =
        run(
            "--mode",
            "channels",
            "--select",
            "system=CTRL,subsystem=MAIN,device=MC-01|MC-02,signal=Heartbeat");
    assertEquals(2, channels.size());
    assertEquals("CTRL:MAIN:MC-02:Heartbeat", channels.get(1).get("channel").asText());
    assertTrue(channels.get(1).get("valid").asBoolean());
  }

  @Test
  void validateMode() throws Exception {
    JsonNode found = run("--mode", "validate", "--channel", "CTRL:MAIN:MC-01:PSU:Voltage");
    assertTrue(found.get("valid").asBoolean());
    assertEquals("PSU", found.get("record").get("path").get("subdevice").asText());
    assertNull(found.get("record").get("source"));

    JsonNode missing = run("--mode", "validate", "--channel", "CTRL:MAIN:MC-03:Status");
    assertFalse(missing.get("valid").asBoolean());
    assertNull(missing.get("record"));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(HierarchyResolver.USAGE, resolver("--mode", "help").run());
  }

  @Test
  void schemaArgumentOverridesConfiguration() throws Exception {
    JsonNode stats = run("--schema", "classpath:schemas/legacy_dipoles.json");
    assertEquals(6, stats.get("totalChannels").asInt());
  }

  @Test
  void missingSchemaLocation(@TempDir Path dir) throws Exception {
    Path config = dir.resolve("app.yaml");
    Files.writeString(config, "logging:\n  level:\n    root: WARN\n");
    HierarchyResolver resolver =
        new HierarchyResolver(new String[] {"--config-file", config.toString()});
    assertThrows(ConfigException.class, resolver::initialize);
  }

  @Test
  void unreadableSchema() {
    HierarchyResolver resolver =
        new HierarchyResolver(
            new String[] {"--config-file", CONFIG, "--schema", "/nonexistent/schema.json"});
    assertThrows(IoException.class, resolver::initialize);
  }

  @Test
  void accessBeforeInitialize() {
    HierarchyResolver resolver = new HierarchyResolver(new String[0]);
    assertThrows(StateException.class, resolver::engine);
    assertThrows(StateException.class, resolver::configuration);
    assertThrows(StateException.class, resolver::reload);
  }

  @Test
  void reloadReplacesTheEngine(@TempDir Path dir) throws Exception {
    Path schema = dir.resolve("schema.json");
    Files.writeString(
        schema,
        "{\"hierarchy\": {\"levels\": [{\"name\": \"system\", \"type\": \"tree\"},"
            + " {\"name\": \"signal\", \"type\": \"tree\"}], \"naming_pattern\": \"{system}:{signal}\"},"
            + " \"tree\": {\"MAG\": {\"CURRENT\": {}}}}");
    HierarchyResolver resolver = resolver("--schema", schema.toString());
    HierarchyEngine first = resolver.engine();
    assertEquals(1, first.getChannelCount());

    Files.writeString(
        schema,
        "{\"hierarchy\": {\"levels\": [{\"name\": \"system\", \"type\": \"tree\"},"
            + " {\"name\": \"signal\", \"type\": \"tree\"}], \"naming_pattern\": \"{system}:{signal}\"},"
            + " \"tree\": {\"MAG\": {\"CURRENT\": {}, \"VOLTAGE\": {}}}}");
    HierarchyEngine second = resolver.reload();
    assertNotSame(first, second);
    assertSame(second, resolver.engine());
    assertEquals(2, second.getChannelCount());
    assertEquals(1, first.getChannelCount());
  }
}
