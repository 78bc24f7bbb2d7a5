package com.mesosphere.secrets.specification.yaml;

import com.mesosphere.secrets.specification.CopyRules;
import com.mesosphere.secrets.specification.Environment;
import com.mesosphere.secrets.specification.GenerateRules;
import com.mesosphere.secrets.specification.SecretGenerateType;
import com.mesosphere.secrets.specification.SecretRequirement;
import com.mesosphere.secrets.util.LoggingUtils;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Adapter utilities for mapping Raw YAML objects to internal objects.
 */
public final class YAMLToInternalMappers {

  private static final Logger LOGGER = LoggingUtils.getLogger(YAMLToInternalMappers.class);

  private YAMLToInternalMappers() {}

  /**
   * Converts the provided YAML {@link RawEnvironment} into a new {@link Environment}.
   *
   * @param rawEnvironment the raw environment representing a YAML file
   * @throws IllegalArgumentException if the raw environment is incomplete or invalid
   */
  public static Environment convertEnvironment(RawEnvironment rawEnvironment) {
    if (StringUtils.isBlank(rawEnvironment.getName())) {
      throw new IllegalArgumentException("Missing mandatory environment name");
    }
    if (StringUtils.isBlank(rawEnvironment.getVaultPathPrefix())) {
      throw new IllegalArgumentException(String.format(
          "Missing mandatory vault-path-prefix in environment '%s'", rawEnvironment.getName()));
    }

    Environment.Builder builder = Environment.newBuilder(
        rawEnvironment.getName(),
        StringUtils.removeEnd(rawEnvironment.getVaultPathPrefix().trim(), "/"));
    if (rawEnvironment.getApplications() != null) {
      for (Map.Entry<String, RawApplication> application : rawEnvironment.getApplications().entrySet()) {
        builder.addApplication(application.getKey());
        RawApplication rawApplication = application.getValue();
        if (rawApplication == null || rawApplication.getSecrets() == null) {
          continue;
        }
        for (Map.Entry<String, RawSecret> secret : rawApplication.getSecrets().entrySet()) {
          builder.addSecret(convertSecret(application.getKey(), secret.getKey(), secret.getValue()));
        }
      }
    }

    Environment environment = builder.build();
    LOGGER.info("Loaded environment '{}' with {} applications and {} secrets",
        environment.getName(), environment.getApplications().size(), environment.getAllSecrets().size());
    return environment;
  }

  private static SecretRequirement convertSecret(String application, String key, RawSecret rawSecret) {
    SecretRequirement.Builder builder = SecretRequirement.newBuilder(application, key);
    if (rawSecret == null) {
      // A bare key: a plain secret whose value comes from the store.
      return builder.build();
    }

    builder.description(rawSecret.getDescription()).value(rawSecret.getValue());

    RawCopyRules rawCopy = rawSecret.getCopy();
    if (rawCopy != null) {
      builder.copyRules(new CopyRules(rawCopy.getApplication(), rawCopy.getKey()));
    }

    RawGenerateRules rawGenerate = rawSecret.getGenerate();
    if (rawGenerate != null) {
      builder.generateRules(convertGenerateRules(application, key, rawGenerate));
    }

    return builder.build();
  }

  private static GenerateRules convertGenerateRules(String application, String key, RawGenerateRules rawGenerate) {
    SecretGenerateType type = SecretGenerateType.fromYamlName(rawGenerate.getType())
        .orElseThrow(() -> new IllegalArgumentException(String.format(
            "Unknown generate type '%s' for secret '%s %s', expected one of: %s",
            rawGenerate.getType(), application, key,
            Arrays.stream(SecretGenerateType.values())
                .map(SecretGenerateType::getYamlName)
                .collect(Collectors.toList()))));

    if (type.requiresSource()) {
      if (StringUtils.isBlank(rawGenerate.getSource())) {
        throw new IllegalArgumentException(String.format(
            "Generate type '%s' for secret '%s %s' requires a source", type.getYamlName(), application, key));
      }
      return GenerateRules.fromSource(type, rawGenerate.getSource());
    }

    if (rawGenerate.getSource() != null) {
      throw new IllegalArgumentException(String.format(
          "Generate type '%s' for secret '%s %s' does not take a source", type.getYamlName(), application, key));
    }
    return GenerateRules.simple(type);
  }
}
