package com.mesosphere.secrets.config;

/**
 * Exception which is thrown when failing to retrieve or parse a configuration value or file.
 */
public class ConfigException extends RuntimeException {

  /**
   * A machine-accessible error type.
   */
  public enum Type {
    UNKNOWN,
    NOT_FOUND,
    INVALID_VALUE
  }

  static ConfigException notFound(String message) {
    return new ConfigException(Type.NOT_FOUND, message, null);
  }

  static ConfigException invalidValue(String message) {
    return new ConfigException(Type.INVALID_VALUE, message, null);
  }

  static ConfigException invalidValue(String message, Throwable cause) {
    return new ConfigException(Type.INVALID_VALUE, message, cause);
  }

  static ConfigException unknown(String message, Throwable cause) {
    return new ConfigException(Type.UNKNOWN, message, cause);
  }

  private final Type type;

  private ConfigException(Type type, String message, Throwable cause) {
    super(message, cause);
    this.type = type;
  }

  public Type getType() {
    return type;
  }

  @Override
  public String getMessage() {
    return String.format("%s (errtype: %s)", super.getMessage(), type);
  }
}
