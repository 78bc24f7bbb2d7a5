package com.mesosphere.secrets.specification;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Declares that a secret takes the resolved value of a secret belonging to (possibly) another application.
 */
public final class CopyRules {

  private final SecretId source;

  public CopyRules(String application, String key) {
    this.source = SecretId.of(application, key);
  }

  public String getApplication() {
    return source.getApplication();
  }

  public String getKey() {
    return source.getKey();
  }

  /**
   * Returns the identity of the secret whose value is copied.
   */
  public SecretId getSource() {
    return source;
  }

  @Override
  public boolean equals(Object o) {
    return EqualsBuilder.reflectionEquals(this, o);
  }

  @Override
  public int hashCode() {
    return HashCodeBuilder.reflectionHashCode(this);
  }

  @Override
  public String toString() {
    return String.format("copy from %s", source);
  }
}
