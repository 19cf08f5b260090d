package com.gentoro.hierarchy;

import com.gentoro.hierarchy.exception.ValidationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Command line arguments given as {@code --name value} pairs. */
public class StartupParameters {
  public static final Set<String> MODES = Set.of("stats", "channels", "options", "validate", "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "stats");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new ValidationException("mode", "Invalid mode: " + mode + ". Expected one of " + MODES);
    }
    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new ValidationException("config-file", "Missing config file location");
    }
    if ("options".equals(mode) && getOptionalParameter("level", String.class).isEmpty()) {
      throw new ValidationException("level", "Mode 'options' requires --level <name>");
    }
    if ("validate".equals(mode) && getOptionalParameter("channel", String.class).isEmpty()) {
      throw new ValidationException("channel", "Mode 'validate' requires --channel <identifier>");
    }
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/hierarchy.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  /**
   * Selections from {@code --select}, written as {@code level=value} pairs separated by commas.
   * Several values for one level are separated by {@code |}, e.g. {@code
   * system=MAG,device=D01|D02}.
   */
  public Map<String, Object> selections() {
    Map<String, Object> result = new LinkedHashMap<>();
    String raw = getOptionalParameter("select", String.class).orElse("");
    if (raw.isBlank()) return result;
    for (String pair : raw.split(",")) {
      int eq = pair.indexOf('=');
      if (eq <= 0) {
        throw new ValidationException(
            "select",
            "Invalid selection '" + pair + "'. Use level=value, e.g. --select system=MAG,device=D01");
      }
      String level = pair.substring(0, eq).trim();
      List<String> values = new ArrayList<>(Arrays.asList(pair.substring(eq + 1).split("\\|")));
      values.replaceAll(String::trim);
      result.put(level, values.size() == 1 ? values.get(0) : values);
    }
    return result;
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
