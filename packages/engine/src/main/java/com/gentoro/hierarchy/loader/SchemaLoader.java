package com.gentoro.hierarchy.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.hierarchy.exception.IoException;
import com.gentoro.hierarchy.exception.SerializationException;
import com.gentoro.hierarchy.logging.LoggingService;
import com.gentoro.hierarchy.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads schema documents from {@code classpath:} resources or the file system. Files ending in
 * {@code .yaml} or {@code .yml} are parsed as YAML, everything else as JSON.
 */
public final class SchemaLoader {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SchemaLoader.class);
  private static final String CLASSPATH_PREFIX = "classpath:";

  public JsonNode read(String location) {
    if (location == null || location.isBlank()) {
      throw new IoException("Schema location must not be empty", location);
    }
    String loc = location.trim();
    if (loc.startsWith(CLASSPATH_PREFIX)) {
      return readClasspath(loc.substring(CLASSPATH_PREFIX.length()));
    }
    return readFile(Path.of(loc));
  }

  private JsonNode readClasspath(String resource) {
    String name = resource.startsWith("/") ? resource.substring(1) : resource;
    log.info("Loading hierarchy schema from classpath resource: {}", name);
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    try (InputStream input = classLoader.getResourceAsStream(name)) {
      if (input == null) {
        throw new IoException("Schema resource not found on classpath: " + name, CLASSPATH_PREFIX + name);
      }
      return JacksonUtility.mapperForFile(name).readTree(input);
    } catch (JsonProcessingException e) {
      throw new SerializationException(
          "Failed to parse schema resource: " + name, CLASSPATH_PREFIX + name, e);
    } catch (IOException e) {
      throw new IoException("Failed to read schema resource: " + name, CLASSPATH_PREFIX + name, e);
    }
  }

  private JsonNode readFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new IoException("Schema file not found: " + path.toAbsolutePath(), path.toString());
    }
    log.info("Loading hierarchy schema from file: {}", path.toAbsolutePath());
    try (InputStream input = Files.newInputStream(path)) {
      return JacksonUtility.mapperForFile(path.getFileName().toString()).readTree(input);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to parse schema file: " + path, path.toString(), e);
    } catch (IOException e) {
      throw new IoException("Failed to read schema file: " + path, path.toString(), e);
    }
  }
}
