package com.mesosphere.secrets.config;

import com.mesosphere.secrets.specification.Environment;

/**
 * Supplies the declared secrets of a named environment.
 */
public interface RequirementSource {

  /**
   * Loads an environment and all of its secret requirements.
   *
   * @throws ConfigException if the environment does not exist or its configuration is invalid
   */
  Environment loadEnvironment(String name);
}
