package com.mesosphere.secrets.audit;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Differences between the resolved secrets of an environment and the contents of its secret store. Each entry is an
 * {@code "application key"} identifier, in the order it was found.
 */
public final class AuditReport {

  private final List<String> missing;

  private final List<String> mismatched;

  private final List<String> unknown;

  private AuditReport(Builder builder) {
    this.missing = ImmutableList.copyOf(builder.missing);
    this.mismatched = ImmutableList.copyOf(builder.mismatched);
    this.unknown = ImmutableList.copyOf(builder.unknown);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Returns secrets which are required but absent from the store.
   */
  public List<String> getMissing() {
    return missing;
  }

  /**
   * Returns secrets whose stored value differs from the resolved value.
   */
  public List<String> getMismatched() {
    return mismatched;
  }

  /**
   * Returns secrets which are in the store but not required by the environment.
   */
  public List<String> getUnknown() {
    return unknown;
  }

  /**
   * Returns whether the store agrees with the resolved secrets.
   */
  public boolean isClean() {
    return missing.isEmpty() && mismatched.isEmpty() && unknown.isEmpty();
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
    return String.format("missing=%s mismatched=%s unknown=%s", missing, mismatched, unknown);
  }

  /**
   * {@link AuditReport} builder static inner class.
   */
  public static final class Builder {

    private final List<String> missing = new ArrayList<>();

    private final List<String> mismatched = new ArrayList<>();

    private final List<String> unknown = new ArrayList<>();

    private Builder() {}

    public Builder missing(String secret) {
      missing.add(secret);
      return this;
    }

    public Builder mismatched(String secret) {
      mismatched.add(secret);
      return this;
    }

    public Builder unknown(String secret) {
      unknown.add(secret);
      return this;
    }

    public AuditReport build() {
      return new AuditReport(this);
    }
  }
}
