package com.mesosphere.secrets.specification.yaml;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.util.LinkedHashMap;

/**
 * Root of the parsed environment YAML object model.
 */
public final class RawEnvironment {

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  static {
    // If the user provides duplicate fields (e.g. the same secret twice), throw an error instead of silently dropping
    // data:
    YAML_MAPPER.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    YAML_MAPPER.enable(JsonParser.Feature.ALLOW_YAML_COMMENTS);
    YAML_MAPPER.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  private final String name;

  private final String vaultPathPrefix;

  private final LinkedHashMap<String, RawApplication> applications;

  @JsonCreator
  private RawEnvironment(
      @JsonProperty("name") String name,
      @JsonProperty("vault-path-prefix") String vaultPathPrefix,
      @JsonProperty("applications") LinkedHashMap<String, RawApplication> applications)
  {
    this.name = name;
    this.vaultPathPrefix = vaultPathPrefix;
    this.applications = applications;
  }

  /**
   * Generates a {@link RawEnvironment} object representation from the provided YAML content.
   */
  public static RawEnvironment fromBytes(byte[] yamlContent) throws IOException {
    return YAML_MAPPER.readValue(yamlContent, RawEnvironment.class);
  }

  public String getName() {
    return name;
  }

  public String getVaultPathPrefix() {
    return vaultPathPrefix;
  }

  public LinkedHashMap<String, RawApplication> getApplications() {
    return applications;
  }
}
