package com.mesosphere.secrets.config;

import java.util.HashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * Utility class for grabbing values from a mapping of flag values (typically the process env).
 */
public class EnvStore {

  private final Map<String, String> envMap;

  public static EnvStore fromEnv() {
    return new EnvStore(System.getenv());
  }

  public static EnvStore fromMap(Map<String, String> envMap) {
    return new EnvStore(envMap);
  }

  EnvStore(Map<String, String> envMap) {
    this.envMap = new HashMap<>(envMap);
  }

  public int getOptionalInt(String envKey, int defaultValue) {
    return toInt(envKey, getOptional(envKey, String.valueOf(defaultValue)));
  }

  /**
   * Returns the requested value if set, or {@code defaultValue} if it's missing from the map entirely.
   */
  public String getOptional(String envKey, String defaultValue) {
    String value = envMap.get(envKey);
    return (value == null) ? defaultValue : value;
  }

  /**
   * Returns the requested value if set and non-empty, or {@code defaultValue} if it's missing from the map or is
   * empty or whitespace.
   */
  public String getOptionalNonEmpty(String envKey, String defaultValue) {
    String value = envMap.get(envKey);
    return (StringUtils.isBlank(value)) ? defaultValue : value;
  }

  /**
   * Returns the requested value if set and non-empty, or throws an exception if it's missing from the map or blank.
   */
  public String getRequired(String envKey) {
    String value = envMap.get(envKey);
    if (StringUtils.isBlank(value)) {
      throw ConfigException.notFound(String.format("Missing required environment variable: %s", envKey));
    }
    return value;
  }

  public boolean isPresent(String envKey) {
    return envMap.containsKey(envKey);
  }

  /**
   * If the value cannot be parsed as an int, this points to the source envKey, and ensures that calls only throw
   * {@link ConfigException}.
   */
  private static int toInt(String envKey, String envVal) {
    try {
      return Integer.parseInt(envVal);
    } catch (NumberFormatException e) {
      throw ConfigException.invalidValue(String.format(
          "Failed to parse configured environment variable '%s' as an integer: %s", envKey, envVal));
    }
  }
}
