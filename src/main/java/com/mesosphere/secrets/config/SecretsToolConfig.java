package com.mesosphere.secrets.config;

import com.mesosphere.secrets.util.LoggingUtils;

import org.slf4j.Logger;

import java.io.File;
import java.time.Duration;

/**
 * Global settings of the secrets tool, retrieved from the environment. Presented as a non-static object to simplify
 * tests.
 */
public final class SecretsToolConfig {

  /**
   * Envvar pointing to the directory which holds one {@code <environment>.yaml} file per environment.
   */
  public static final String CONFIG_DIR_ENV = "SECRETS_CONFIG_DIR";

  /**
   * Envvar with the base URL of the Vault server, e.g. {@code https://vault.example.com}.
   */
  public static final String VAULT_ADDR_ENV = "VAULT_ADDR";

  /**
   * Envvar with the token used to authenticate to Vault.
   */
  public static final String VAULT_TOKEN_ENV = "VAULT_TOKEN";

  /**
   * Envvar to specify a custom timeout in milliseconds for connecting to Vault.
   */
  public static final String VAULT_CONNECTION_TIMEOUT_MS_ENV = "VAULT_CONNECTION_TIMEOUT_MS";

  private static final String DEFAULT_CONFIG_DIR = ".";

  private static final int DEFAULT_VAULT_CONNECTION_TIMEOUT_MS = 30000;

  private static final Logger LOGGER = LoggingUtils.getLogger(SecretsToolConfig.class);

  private final EnvStore envStore;

  private SecretsToolConfig(EnvStore envStore) {
    this.envStore = envStore;
  }

  /**
   * Returns a new {@link SecretsToolConfig} instance which is based off the process environment.
   */
  public static SecretsToolConfig fromEnv() {
    return fromEnvStore(EnvStore.fromEnv());
  }

  /**
   * Returns a new {@link SecretsToolConfig} instance which is based off the provided env store.
   */
  public static SecretsToolConfig fromEnvStore(EnvStore envStore) {
    return new SecretsToolConfig(envStore);
  }

  public File getConfigDir() {
    return new File(envStore.getOptionalNonEmpty(CONFIG_DIR_ENV, DEFAULT_CONFIG_DIR));
  }

  /**
   * Returns the Vault address without any trailing slash, or throws {@link ConfigException} if it is not set.
   */
  public String getVaultAddress() {
    String address = envStore.getRequired(VAULT_ADDR_ENV);
    while (address.endsWith("/")) {
      address = address.substring(0, address.length() - 1);
    }
    return address;
  }

  /**
   * Returns the Vault token, or throws {@link ConfigException} if it is not set.
   */
  public String getVaultToken() {
    return envStore.getRequired(VAULT_TOKEN_ENV);
  }

  public Duration getVaultConnectionTimeout() {
    int timeoutMs = envStore.getOptionalInt(VAULT_CONNECTION_TIMEOUT_MS_ENV, DEFAULT_VAULT_CONNECTION_TIMEOUT_MS);
    if (timeoutMs <= 0) {
      LOGGER.warn("Ignoring non-positive {}={}, using {}ms",
          VAULT_CONNECTION_TIMEOUT_MS_ENV, timeoutMs, DEFAULT_VAULT_CONNECTION_TIMEOUT_MS);
      timeoutMs = DEFAULT_VAULT_CONNECTION_TIMEOUT_MS;
    }
    return Duration.ofMillis(timeoutMs);
  }
}
