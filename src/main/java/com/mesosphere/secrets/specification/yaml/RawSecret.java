package com.mesosphere.secrets.specification.yaml;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw YAML secret.
 */
public final class RawSecret {

  private final String description;

  private final String value;

  private final RawCopyRules copy;

  private final RawGenerateRules generate;

  @JsonCreator
  private RawSecret(
      @JsonProperty("description") String description,
      @JsonProperty("value") String value,
      @JsonProperty("copy") RawCopyRules copy,
      @JsonProperty("generate") RawGenerateRules generate)
  {
    this.description = description;
    this.value = value;
    this.copy = copy;
    this.generate = generate;
  }

  public String getDescription() {
    return description;
  }

  public String getValue() {
    return value;
  }

  public RawCopyRules getCopy() {
    return copy;
  }

  public RawGenerateRules getGenerate() {
    return generate;
  }
}
