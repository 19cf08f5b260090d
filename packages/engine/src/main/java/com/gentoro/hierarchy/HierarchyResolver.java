package com.gentoro.hierarchy;

import com.gentoro.hierarchy.engine.ChannelRecord;
import com.gentoro.hierarchy.exception.ConfigException;
import com.gentoro.hierarchy.exception.StateException;
import com.gentoro.hierarchy.loader.ReloadableHierarchyEngine;
import com.gentoro.hierarchy.logging.LoggingService;
import com.gentoro.hierarchy.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/** Application root: reads configuration, loads the hierarchy and runs the requested command. */
public class HierarchyResolver {
  private static final org.slf4j.Logger log = LoggingService.getLogger(HierarchyResolver.class);

  public static final String USAGE =
      String.join(
          "\n",
          "Usage: hierarchy-resolver --mode <stats|channels|options|validate|help> [options]",
          "  --config-file <location>  application YAML (default classpath:application.yaml)",
          "  --schema <location>       schema document, overrides hierarchy.schema",
          "  --level <name>            level to list options for (mode options)",
          "  --select <k=v,...>        selections, several values as v1|v2",
          "  --channel <identifier>    identifier to check (mode validate)");

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ReloadableHierarchyEngine hierarchy;

  public HierarchyResolver(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    String location = schemaLocation();
    this.hierarchy = ReloadableHierarchyEngine.forLocation(location);
    hierarchy.reload();
    log.info("Hierarchy resolver initialized from {}", location);
  }

  /** Execute the selected mode and return its JSON output. */
  public String run() {
    HierarchyEngine engine = engine();
    Map<String, Object> selections = startupParameters.selections();
    Object result;
    switch (startupParameters.mode()) {
      case "stats":
        result = engine.getStatistics();
        break;
      case "channels":
        result = selections.isEmpty() ? engine.getAllChannels() : synthesize(engine, selections);
        break;
      case "options":
        result =
            engine.getOptionsAtLevel(
                startupParameters.getParameter("level", String.class), selections);
        break;
      case "validate":
        result = validate(engine, startupParameters.getParameter("channel", String.class));
        break;
      default:
        return USAGE;
    }
    return JacksonUtility.toJson(result);
  }

  private static List<Map<String, Object>> synthesize(
      HierarchyEngine engine, Map<String, Object> selections) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (String channel : engine.buildChannelsFromSelections(selections)) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("channel", channel);
      entry.put("valid", engine.validateChannel(channel));
      out.add(entry);
    }
    return out;
  }

  private static Map<String, Object> validate(HierarchyEngine engine, String channel) {
    Map<String, Object> out = new LinkedHashMap<>();
    Optional<ChannelRecord> found = engine.getChannel(channel);
    out.put("channel", channel);
    out.put("valid", found.isPresent());
    found.ifPresent(r -> out.put("record", r));
    return out;
  }

  private String schemaLocation() {
    return startupParameters
        .getOptionalParameter("schema", String.class)
        .or(() -> Optional.ofNullable(configuration().getString("hierarchy.schema", null)))
        .filter(s -> !s.isBlank())
        .orElseThrow(
            () ->
                new ConfigException(
                    "No schema location configured. Pass --schema <location> or set"
                        + " hierarchy.schema in the application YAML"));
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException(
          "HierarchyResolver", "HierarchyResolver not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public HierarchyEngine engine() {
    if (hierarchy == null) {
      throw new StateException(
          "HierarchyResolver", "HierarchyResolver not initialized. Call initialize() first.");
    }
    return hierarchy.current();
  }

  /** Rebuild the hierarchy from its schema location; the previous one stays active on failure. */
  public HierarchyEngine reload() {
    if (hierarchy == null) {
      throw new StateException(
          "HierarchyResolver", "HierarchyResolver not initialized. Call initialize() first.");
    }
    return hierarchy.reload();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }
}
