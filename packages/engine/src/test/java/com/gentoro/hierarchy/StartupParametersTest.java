package com.gentoro.hierarchy;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.hierarchy.exception.ValidationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);
    assertEquals("stats", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
    assertTrue(params.selections().isEmpty());
    assertFalse(params.isParameterPresent("schema"));
  }

  @Test
  void namedValues() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--mode", "channels", "--config-file", "/etc/h.yaml", "--schema", "s.json"});
    assertEquals("channels", params.mode());
    assertEquals("/etc/h.yaml", params.configFile());
    assertEquals("s.json", params.getOptionalParameter("schema", String.class).orElseThrow());
  }

  @Test
  void flagWithoutValue() {
    StartupParameters params = new StartupParameters(new String[] {"--verbose", "--mode", "stats"});
    assertTrue(params.isParameterPresent("verbose"));
    assertTrue(params.getOptionalParameter("verbose", String.class).isEmpty());
  }

  @Test
  void selectionsWithSeveralValues() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--mode", "channels", "--select", "system=MAG, device=D01|D02"});
    assertEquals(
        Map.of("system", "MAG", "device", List.of("D01", "D02")), params.selections());
  }

  @Test
  void malformedSelection() {
    StartupParameters params = new StartupParameters(new String[] {"--select", "MAG"});
    assertThrows(ValidationException.class, params::selections);
  }

  @Test
  void invalidMode() {
    ValidationException e =
        assertThrows(
            ValidationException.class, () -> new StartupParameters(new String[] {"--mode", "dump"}));
    assertTrue(e.getMessage().contains("Invalid mode: dump"));
    assertEquals("mode", e.getContext().get("argument"));
  }

  @Test
  void modesWithRequiredArguments() {
    assertThrows(
        ValidationException.class, () -> new StartupParameters(new String[] {"--mode", "options"}));
    assertThrows(
        ValidationException.class, () -> new StartupParameters(new String[] {"--mode", "validate"}));
    assertEquals(
        "options",
        new StartupParameters(new String[] {"--mode", "options", "--level", "device"}).mode());
  }
}
