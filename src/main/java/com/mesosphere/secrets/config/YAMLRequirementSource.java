package com.mesosphere.secrets.config;

import com.mesosphere.secrets.specification.Environment;
import com.mesosphere.secrets.specification.yaml.RawEnvironment;
import com.mesosphere.secrets.specification.yaml.YAMLToInternalMappers;
import com.mesosphere.secrets.util.LoggingUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * {@link RequirementSource} which reads one YAML file per environment from a configuration directory.
 */
public class YAMLRequirementSource implements RequirementSource {

  private static final Logger LOGGER = LoggingUtils.getLogger(YAMLRequirementSource.class);

  private static final List<String> EXTENSIONS = Arrays.asList(".yaml", ".yml");

  private final File configDir;

  public YAMLRequirementSource(File configDir) {
    this.configDir = configDir;
  }

  @Override
  public Environment loadEnvironment(String name) {
    File file = findEnvironmentFile(name);
    LOGGER.info("Loading environment '{}' from {}", name, file.getAbsolutePath());

    RawEnvironment rawEnvironment;
    try {
      rawEnvironment = RawEnvironment.fromBytes(FileUtils.readFileToByteArray(file));
    } catch (JsonProcessingException e) {
      throw ConfigException.invalidValue(String.format(
          "Failed to parse environment file %s: %s", file.getName(), e.getOriginalMessage()), e);
    } catch (IOException e) {
      throw ConfigException.unknown(String.format("Failed to read environment file %s", file.getName()), e);
    }

    if (rawEnvironment == null) {
      throw ConfigException.invalidValue(String.format("Environment file %s is empty", file.getName()));
    }

    Environment environment;
    try {
      environment = YAMLToInternalMappers.convertEnvironment(rawEnvironment);
    } catch (IllegalArgumentException e) {
      throw ConfigException.invalidValue(String.format(
          "Invalid environment file %s: %s", file.getName(), e.getMessage()), e);
    }

    if (!environment.getName().equals(name)) {
      throw ConfigException.invalidValue(String.format(
          "Environment file %s declares name '%s'", file.getName(), environment.getName()));
    }
    return environment;
  }

  private File findEnvironmentFile(String name) {
    for (String extension : EXTENSIONS) {
      File file = new File(configDir, name + extension);
      if (file.isFile()) {
        return file;
      }
    }
    throw ConfigException.notFound(String.format(
        "No configuration for environment '%s' in %s", name, configDir.getAbsolutePath()));
  }
}
