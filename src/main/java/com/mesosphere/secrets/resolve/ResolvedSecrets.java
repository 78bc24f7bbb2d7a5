package com.mesosphere.secrets.resolve;

import com.mesosphere.secrets.specification.SecretId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resolved secrets by application and key. Entries are added while resolving and can never be replaced. Iteration is
 * ordered by application and then key.
 */
public final class ResolvedSecrets {

  private final Map<String, Map<String, ResolvedSecret>> secrets = new TreeMap<>();

  /**
   * Adds a resolved secret.
   *
   * @throws IllegalStateException if the secret was already resolved
   */
  void put(ResolvedSecret secret) {
    Map<String, ResolvedSecret> application =
        secrets.computeIfAbsent(secret.getApplication(), k -> new TreeMap<>());
    if (application.containsKey(secret.getKey())) {
      throw new IllegalStateException(String.format("Secret %s was already resolved", secret.getId()));
    }
    application.put(secret.getKey(), secret);
  }

  public Optional<ResolvedSecret> get(SecretId id) {
    Map<String, ResolvedSecret> application = secrets.get(id.getApplication());
    return application == null ? Optional.empty() : Optional.ofNullable(application.get(id.getKey()));
  }

  public Set<String> getApplications() {
    return Collections.unmodifiableSet(secrets.keySet());
  }

  /**
   * Returns the resolved secrets of one application by key, or an empty map if it has none.
   */
  public Map<String, ResolvedSecret> getSecrets(String application) {
    Map<String, ResolvedSecret> values = secrets.get(application);
    return values == null ? Collections.emptyMap() : Collections.unmodifiableMap(values);
  }

  /**
   * Returns every resolved secret, ordered by application and then key.
   */
  public List<ResolvedSecret> getAll() {
    List<ResolvedSecret> all = new ArrayList<>();
    secrets.values().forEach(values -> all.addAll(values.values()));
    return all;
  }

  public int size() {
    return secrets.values().stream().mapToInt(Map::size).sum();
  }

  @Override
  public String toString() {
    return getAll().toString();
  }
}
