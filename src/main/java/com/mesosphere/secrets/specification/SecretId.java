package com.mesosphere.secrets.specification;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.Comparator;

/**
 * Identifies one secret: a key within an application. Rendered as {@code "application key"}, which is the only form
 * in which secrets are named in reports and errors.
 */
public final class SecretId implements Comparable<SecretId> {

  private static final Comparator<SecretId> ORDER =
      Comparator.comparing(SecretId::getApplication).thenComparing(SecretId::getKey);

  private final String application;

  private final String key;

  private SecretId(String application, String key) {
    this.application = application;
    this.key = key;
  }

  public static SecretId of(String application, String key) {
    ValidationUtils.nonBlank(application, "application", application);
    ValidationUtils.nonBlank(application, "key", key);
    return new SecretId(application, key);
  }

  public String getApplication() {
    return application;
  }

  public String getKey() {
    return key;
  }

  @Override
  public int compareTo(SecretId other) {
    return ORDER.compare(this, other);
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
    return String.format("%s %s", application, key);
  }
}
