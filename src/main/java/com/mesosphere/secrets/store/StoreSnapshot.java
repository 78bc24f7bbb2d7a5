package com.mesosphere.secrets.store;

import com.mesosphere.secrets.specification.SecretId;
import com.mesosphere.secrets.specification.SecretValue;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Point-in-time view of the secret store for one environment: application to key to value. A key may be present
 * without a value, which is distinct from the key being absent.
 *
 * <p>Applications and keys are kept sorted so that anything iterating a snapshot does so in a stable order.
 */
public final class StoreSnapshot {

  private final Map<String, Map<String, Optional<SecretValue>>> secrets;

  private StoreSnapshot(Map<String, Map<String, Optional<SecretValue>>> secrets) {
    this.secrets = secrets;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static StoreSnapshot empty() {
    return newBuilder().build();
  }

  public Set<String> getApplications() {
    return Collections.unmodifiableSet(secrets.keySet());
  }

  /**
   * Returns the stored secrets of one application. An application missing from the store has no secrets.
   */
  public Map<String, Optional<SecretValue>> getSecrets(String application) {
    Map<String, Optional<SecretValue>> values = secrets.get(application);
    return values == null ? Collections.emptyMap() : Collections.unmodifiableMap(values);
  }

  /**
   * Returns whether the store has an entry for the secret, with or without a value.
   */
  public boolean contains(SecretId id) {
    return getSecrets(id.getApplication()).containsKey(id.getKey());
  }

  /**
   * Returns the stored value of the secret, or an empty value if the secret is absent or has no value.
   */
  public Optional<SecretValue> getValue(SecretId id) {
    Optional<SecretValue> value = getSecrets(id.getApplication()).get(id.getKey());
    return value == null ? Optional.empty() : value;
  }

  /**
   * Returns a deep, mutable copy of this snapshot which the caller owns exclusively.
   */
  public Map<String, Map<String, Optional<SecretValue>>> mutableCopy() {
    Map<String, Map<String, Optional<SecretValue>>> copy = new TreeMap<>();
    for (Map.Entry<String, Map<String, Optional<SecretValue>>> entry : secrets.entrySet()) {
      copy.put(entry.getKey(), new TreeMap<>(entry.getValue()));
    }
    return copy;
  }

  /**
   * Returns the number of stored keys across all applications.
   */
  public int size() {
    return secrets.values().stream().mapToInt(Map::size).sum();
  }

  @Override
  public String toString() {
    // Keys only, never values
    Map<String, Set<String>> keys = new TreeMap<>();
    secrets.forEach((application, values) -> keys.put(application, values.keySet()));
    return String.format("StoreSnapshot%s", keys);
  }

  /**
   * {@link StoreSnapshot} builder static inner class.
   */
  public static final class Builder {

    private final Map<String, Map<String, Optional<SecretValue>>> secrets = new TreeMap<>();

    private Builder() {}

    /**
     * Records an application which may have no stored secrets.
     */
    public Builder addApplication(String application) {
      secrets.computeIfAbsent(application, k -> new TreeMap<>());
      return this;
    }

    public Builder put(String application, String key, SecretValue value) {
      return put(application, key, Optional.of(value));
    }

    public Builder put(String application, String key, String value) {
      return put(application, key, SecretValue.of(value));
    }

    /**
     * Records a key which is present in the store but has no value.
     */
    public Builder putUnset(String application, String key) {
      return put(application, key, Optional.empty());
    }

    public Builder put(String application, String key, Optional<SecretValue> value) {
      secrets.computeIfAbsent(application, k -> new TreeMap<>()).put(key, value);
      return this;
    }

    public Builder putAll(String application, Map<String, Optional<SecretValue>> values) {
      addApplication(application);
      values.forEach((key, value) -> put(application, key, value));
      return this;
    }

    public StoreSnapshot build() {
      Map<String, Map<String, Optional<SecretValue>>> copy = new TreeMap<>();
      secrets.forEach((application, values) -> copy.put(application, new TreeMap<>(values)));
      return new StoreSnapshot(copy);
    }
  }
}
