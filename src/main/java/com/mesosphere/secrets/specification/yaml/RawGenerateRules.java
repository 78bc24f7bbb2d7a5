package com.mesosphere.secrets.specification.yaml;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw YAML generate rules.
 */
public final class RawGenerateRules {

  private final String type;

  private final String source;

  @JsonCreator
  private RawGenerateRules(
      @JsonProperty("type") String type,
      @JsonProperty("source") String source)
  {
    this.type = type;
    this.source = source;
  }

  public String getType() {
    return type;
  }

  public String getSource() {
    return source;
  }
}
