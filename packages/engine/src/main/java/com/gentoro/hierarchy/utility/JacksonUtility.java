package com.gentoro.hierarchy.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.gentoro.hierarchy.exception.SerializationException;
import java.util.Locale;

/**
 * Jackson mappers for schema documents and command line output. Schema documents are read as
 * trees only; a repeated key or a second document after the root is a parse error, since either
 * would silently replace part of the hierarchy.
 */
public final class JacksonUtility {
  private static final ObjectMapper YAML_MAPPER =
      YAMLMapper.builder()
          .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
          .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
          .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
          .build();

  private static final ObjectMapper JSON_MAPPER =
      JsonMapper.builder()
          .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
          .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .serializationInclusion(JsonInclude.Include.NON_NULL)
          .build();

  private JacksonUtility() {}

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /** YAML for {@code .yaml} and {@code .yml} files, JSON for everything else. */
  public static ObjectMapper mapperForFile(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
      return YAML_MAPPER;
    }
    return JSON_MAPPER;
  }

  /** Parse an in-memory JSON document. */
  public static JsonNode readJsonTree(String json, String source) {
    try {
      return JSON_MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new SerializationException(
          "Invalid JSON in " + source + ": " + e.getOriginalMessage(), source, e);
    }
  }

  public static String toJson(Object value) {
    try {
      return JSON_MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException(
          "Failed to write " + value.getClass().getSimpleName() + " as JSON", "output", e);
    }
  }
}
