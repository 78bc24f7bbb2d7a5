package com.mesosphere.secrets.service;

import com.mesosphere.secrets.audit.AuditReport;
import com.mesosphere.secrets.audit.AuditReportFormatter;
import com.mesosphere.secrets.audit.SecretAuditor;
import com.mesosphere.secrets.config.RequirementSource;
import com.mesosphere.secrets.resolve.ResolvedSecret;
import com.mesosphere.secrets.resolve.ResolvedSecrets;
import com.mesosphere.secrets.resolve.SecretResolver;
import com.mesosphere.secrets.resolve.UnresolvedSecretsException;
import com.mesosphere.secrets.specification.Environment;
import com.mesosphere.secrets.specification.SecretId;
import com.mesosphere.secrets.specification.SecretRequirement;
import com.mesosphere.secrets.specification.SecretValue;
import com.mesosphere.secrets.store.SecretStore;
import com.mesosphere.secrets.store.SecretsException;
import com.mesosphere.secrets.store.StoreSnapshot;
import com.mesosphere.secrets.util.LoggingUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Operations on the secrets of a whole environment: ties together the environment configuration, the secret store,
 * resolution and audit.
 */
public class SecretsService {

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory()
      .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
      .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

  private final RequirementSource requirementSource;

  private final SecretStore secretStore;

  private final SecretResolver resolver;

  private final SecretAuditor auditor;

  public SecretsService(RequirementSource requirementSource, SecretStore secretStore) {
    this(requirementSource, secretStore, new SecretResolver(), new SecretAuditor());
  }

  public SecretsService(
      RequirementSource requirementSource,
      SecretStore secretStore,
      SecretResolver resolver,
      SecretAuditor auditor)
  {
    this.requirementSource = requirementSource;
    this.secretStore = secretStore;
    this.resolver = resolver;
    this.auditor = auditor;
  }

  /**
   * Compares the stored secrets of an environment to its configuration and returns the report as text, which is
   * empty when there are no problems.
   */
  public String audit(String environmentName) throws IOException, SecretsException, UnresolvedSecretsException {
    return AuditReportFormatter.format(auditReport(environmentName));
  }

  /**
   * Compares the stored secrets of an environment to its configuration.
   */
  public AuditReport auditReport(String environmentName)
      throws IOException, SecretsException, UnresolvedSecretsException
  {
    Environment environment = requirementSource.loadEnvironment(environmentName);
    StoreSnapshot snapshot = secretStore.getEnvironmentSecrets(environment);
    ResolvedSecrets resolved = resolver.resolve(environment.getAllSecrets(), snapshot);
    return auditor.audit(resolved, snapshot);
  }

  /**
   * Resolves every secret of an environment against the current store contents.
   */
  public ResolvedSecrets resolve(String environmentName)
      throws IOException, SecretsException, UnresolvedSecretsException
  {
    Environment environment = requirementSource.loadEnvironment(environmentName);
    return resolver.resolve(environment.getAllSecrets(), secretStore.getEnvironmentSecrets(environment));
  }

  /**
   * Lists all secrets required by an environment.
   */
  public List<SecretRequirement> listSecrets(String environmentName) {
    return requirementSource.loadEnvironment(environmentName).getAllSecrets();
  }

  /**
   * Returns a YAML template with room for every secret of the environment which must be supplied by a person, i.e.
   * which is not static, copied or generated. Once filled in, each entry holds the value to store.
   */
  public String generateStaticTemplate(String environmentName) throws IOException {
    Map<String, Map<String, Map<String, String>>> template = new TreeMap<>();
    for (SecretRequirement secret : listSecrets(environmentName)) {
      if (secret.getStrategy() != SecretRequirement.Strategy.STORED) {
        continue;
      }
      Map<String, String> entry = new LinkedHashMap<>();
      entry.put("description", secret.getDescription().orElse(""));
      entry.put("value", null);
      template.computeIfAbsent(secret.getApplication(), k -> new TreeMap<>()).put(secret.getKey(), entry);
    }
    return YAML_MAPPER.writeValueAsString(template);
  }

  /**
   * Writes the stored secrets of an environment to one {@code <application>.json} file per application in the
   * provided directory. Keys without a value are written as {@code null}.
   */
  public List<File> saveStoreSecrets(String environmentName, File directory) throws IOException, SecretsException {
    Environment environment = requirementSource.loadEnvironment(environmentName);
    Logger logger = LoggingUtils.getLogger(getClass(), environment.getName());
    StoreSnapshot snapshot = secretStore.getEnvironmentSecrets(environment);

    FileUtils.forceMkdir(directory);
    List<File> written = new ArrayList<>();
    for (String application : snapshot.getApplications()) {
      Map<String, String> values = new TreeMap<>();
      snapshot.getSecrets(application).forEach((key, value) -> values.put(key, value.map(SecretValue::reveal).orElse(null)));

      File file = new File(directory, application + ".json");
      FileUtils.writeStringToFile(
          file, JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(values) + "\n", StandardCharsets.UTF_8);
      written.add(file);
    }
    logger.info("Wrote secrets of {} applications to {}", written.size(), directory.getAbsolutePath());
    return written;
  }

  /**
   * Resolves the secrets of an environment and writes back every application whose resolved values are not what the
   * store holds. Stored keys which are not part of the configuration are kept, with or without a value. Secrets which
   * resolved without a value are left alone.
   *
   * @return the secrets which were written
   */
  public List<SecretId> syncSecrets(String environmentName)
      throws IOException, SecretsException, UnresolvedSecretsException
  {
    Environment environment = requirementSource.loadEnvironment(environmentName);
    Logger logger = LoggingUtils.getLogger(getClass(), environment.getName());
    StoreSnapshot snapshot = secretStore.getEnvironmentSecrets(environment);
    ResolvedSecrets resolved = resolver.resolve(environment.getAllSecrets(), snapshot);

    List<SecretId> changed = new ArrayList<>();
    for (String application : resolved.getApplications()) {
      Map<String, Optional<SecretValue>> values = new TreeMap<>(snapshot.getSecrets(application));

      List<SecretId> applicationChanges = new ArrayList<>();
      for (ResolvedSecret secret : resolved.getSecrets(application).values()) {
        Optional<SecretValue> value = secret.getValue();
        if (value.isPresent() && !value.equals(snapshot.getValue(secret.getId()))) {
          values.put(secret.getKey(), value);
          applicationChanges.add(secret.getId());
        }
      }

      if (!applicationChanges.isEmpty()) {
        logger.info("Updating {} secrets of application {}: {}",
            applicationChanges.size(), application, applicationChanges);
        secretStore.storeApplicationSecrets(environment, application, values);
        changed.addAll(applicationChanges);
      }
    }
    logger.info("Sync complete, {} secrets updated", changed.size());
    return changed;
  }
}
