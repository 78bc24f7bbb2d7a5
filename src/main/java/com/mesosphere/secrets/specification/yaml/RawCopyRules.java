package com.mesosphere.secrets.specification.yaml;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw YAML copy rules.
 */
public final class RawCopyRules {

  private final String application;

  private final String key;

  @JsonCreator
  private RawCopyRules(
      @JsonProperty("application") String application,
      @JsonProperty("key") String key)
  {
    this.application = application;
    this.key = key;
  }

  public String getApplication() {
    return application;
  }

  public String getKey() {
    return key;
  }
}
