package com.mesosphere.secrets.store;

/**
 * General secret store exception.
 */
public class SecretsException extends Exception {

  private final String store;

  private final String path;

  public SecretsException(String message, String store, String path) {
    super(message);
    this.store = store;
    this.path = path;
  }

  public SecretsException(String message, Throwable cause, String store, String path) {
    super(message, cause);
    this.store = store;
    this.path = path;
  }

  /**
   * Returns the address of the store which failed.
   */
  public String getStore() {
    return store;
  }

  /**
   * Returns the store path which was being accessed.
   */
  public String getPath() {
    return path;
  }
}
