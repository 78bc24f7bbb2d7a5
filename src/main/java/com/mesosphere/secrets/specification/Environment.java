package com.mesosphere.secrets.specification;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A deployment environment: a set of applications, each with its declared secrets, and the location of the
 * environment's secrets in the secret store.
 */
public final class Environment {

  private final String name;

  private final String vaultPathPrefix;

  private final Map<String, List<SecretRequirement>> applications;

  private Environment(Builder builder) {
    this.name = builder.name;
    this.vaultPathPrefix = builder.vaultPathPrefix;
    this.applications = new LinkedHashMap<>();
    for (Map.Entry<String, List<SecretRequirement>> entry : builder.applications.entrySet()) {
      this.applications.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }

    ValidationUtils.nonBlank(this, "name", name);
    ValidationUtils.nonBlank(this, "vaultPathPrefix", vaultPathPrefix);
    ValidationUtils.isUnique(this, "secrets", getAllSecrets().stream().map(SecretRequirement::getId));
  }

  public static Builder newBuilder(String name, String vaultPathPrefix) {
    return new Builder(name, vaultPathPrefix);
  }

  public String getName() {
    return name;
  }

  /**
   * Returns the store path under which each application's secrets are kept, e.g. {@code secret/k8s/dev}.
   */
  public String getVaultPathPrefix() {
    return vaultPathPrefix;
  }

  /**
   * Returns the names of all applications in declaration order.
   */
  public List<String> getApplications() {
    return new ArrayList<>(applications.keySet());
  }

  /**
   * Returns the secrets of one application, or an empty list if the application is unknown.
   */
  public List<SecretRequirement> getSecrets(String application) {
    return applications.getOrDefault(application, ImmutableList.of());
  }

  /**
   * Returns every secret required by the environment, ordered by application and then declaration.
   */
  public List<SecretRequirement> getAllSecrets() {
    return applications.values().stream()
        .flatMap(List::stream)
        .collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
        .append("name", name)
        .append("vaultPathPrefix", vaultPathPrefix)
        .append("applications", applications.keySet())
        .toString();
  }

  /**
   * {@link Environment} builder static inner class.
   */
  public static final class Builder {

    private final String name;

    private final String vaultPathPrefix;

    private final Map<String, List<SecretRequirement>> applications = new LinkedHashMap<>();

    private Builder(String name, String vaultPathPrefix) {
      this.name = name;
      this.vaultPathPrefix = vaultPathPrefix;
    }

    /**
     * Adds an application, which may have no secrets.
     */
    public Builder addApplication(String application) {
      applications.computeIfAbsent(application, k -> new ArrayList<>());
      return this;
    }

    /**
     * Adds a secret, creating its application if needed.
     */
    public Builder addSecret(SecretRequirement secret) {
      applications.computeIfAbsent(secret.getApplication(), k -> new ArrayList<>()).add(secret);
      return this;
    }

    public Environment build() {
      return new Environment(this);
    }
  }
}
