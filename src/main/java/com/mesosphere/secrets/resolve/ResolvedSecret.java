package com.mesosphere.secrets.resolve;

import com.mesosphere.secrets.specification.SecretId;
import com.mesosphere.secrets.specification.SecretValue;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of resolving one secret requirement. The value may be absent: the secret is required but no value is
 * known yet. That is a valid resolution, left for the audit to report.
 */
public final class ResolvedSecret {

  private final SecretId id;

  private final Optional<SecretValue> value;

  public ResolvedSecret(SecretId id, Optional<SecretValue> value) {
    this.id = id;
    this.value = value;
  }

  public SecretId getId() {
    return id;
  }

  public String getApplication() {
    return id.getApplication();
  }

  public String getKey() {
    return id.getKey();
  }

  public Optional<SecretValue> getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ResolvedSecret other = (ResolvedSecret) o;
    return id.equals(other.id) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, value);
  }

  @Override
  public String toString() {
    return String.format("%s (%s)", id, value.isPresent() ? "set" : "unset");
  }
}
