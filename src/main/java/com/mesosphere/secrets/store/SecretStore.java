package com.mesosphere.secrets.store;

import com.mesosphere.secrets.specification.Environment;
import com.mesosphere.secrets.specification.SecretValue;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the secret store backing one or more environments.
 */
public interface SecretStore {

  /**
   * Returns the stored secrets of every application under the environment's store path, plus an empty entry for
   * every application of the environment which has nothing stored.
   *
   * @throws IOException if the store could not be reached
   * @throws SecretsException if the store rejected a request
   */
  StoreSnapshot getEnvironmentSecrets(Environment environment) throws IOException, SecretsException;

  /**
   * Returns the stored secrets of one application, or an empty map if there are none.
   *
   * @throws IOException if the store could not be reached
   * @throws SecretsException if the store rejected a request
   */
  Map<String, Optional<SecretValue>> getApplicationSecrets(Environment environment, String application)
      throws IOException, SecretsException;

  /**
   * Replaces the stored secrets of one application. Keys mapped to an empty value are stored without a value.
   *
   * @throws IOException if the store could not be reached
   * @throws SecretsException if the store rejected a request
   */
  void storeApplicationSecrets(
      Environment environment, String application, Map<String, Optional<SecretValue>> secrets)
      throws IOException, SecretsException;
}
