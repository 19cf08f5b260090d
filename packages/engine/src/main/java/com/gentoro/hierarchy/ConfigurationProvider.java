package com.gentoro.hierarchy;

import com.gentoro.hierarchy.exception.ConfigException;
import com.gentoro.hierarchy.exception.SerializationException;
import com.gentoro.hierarchy.logging.LoggingService;
import java.io.File;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.ConfigurationInterpolator;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the application YAML and exposes it as a Commons Configuration instance.
 *
 * <p>Locations: {@code classpath:some/path.yaml}, a {@code file:} URI, or a plain file system path.
 * Values may reference {@code ${env:NAME}}; a missing environment variable falls back to the
 * system property of the same name.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(ConfigurationProvider.class);
  private static final String CLASSPATH_PREFIX = "classpath:";
  private static final String DEFAULT_LOCATION = CLASSPATH_PREFIX + "application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromLocation(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    if (loc.startsWith(CLASSPATH_PREFIX)) {
      return loadYamlFromClasspath(loc.substring(CLASSPATH_PREFIX.length()));
    }
    try {
      URI uri = URI.create(loc);
      if ("file".equalsIgnoreCase(uri.getScheme())) {
        return loadYamlFromFile(new File(uri));
      }
    } catch (IllegalArgumentException e) {
      log.debug("'{}' is not a URI; treating it as a file path", loc);
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader.getResource(resourceName) == null) {
      log.warn("Configuration resource '{}' not found on classpath; using defaults", resourceName);
      return addOns(new YAMLConfiguration());
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input = classLoader.getResourceAsStream(resourceName);
        Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(reader);
      return addOns(config);
    } catch (Exception e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, "classpath:" + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException(
          "Configuration file not found: " + file.getAbsolutePath(), file.getPath(), null);
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file));
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, file.getPath(), e);
    }
  }

  private static Configuration addOns(Configuration config) {
    ConfigurationInterpolator interpolator = config.getInterpolator();
    interpolator.registerLookup("env", new EnvOrSystemPropertyLookup());
    return config;
  }

  private static final class EnvOrSystemPropertyLookup implements Lookup {
    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }
      return System.getProperty(key);
    }
  }
}
