package com.mesosphere.secrets.specification.yaml;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;

/**
 * Raw YAML application.
 */
public final class RawApplication {

  private final LinkedHashMap<String, RawSecret> secrets;

  @JsonCreator
  private RawApplication(@JsonProperty("secrets") LinkedHashMap<String, RawSecret> secrets) {
    this.secrets = secrets;
  }

  public LinkedHashMap<String, RawSecret> getSecrets() {
    return secrets;
  }
}
