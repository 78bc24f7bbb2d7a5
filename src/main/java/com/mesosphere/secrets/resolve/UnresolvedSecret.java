package com.mesosphere.secrets.resolve;

import com.mesosphere.secrets.specification.SecretId;
import com.mesosphere.secrets.specification.SecretRequirement;

/**
 * A requirement which could not be resolved, along with the reference it was waiting on.
 */
public final class UnresolvedSecret {

  /**
   * Why a requirement remained unresolved.
   */
  public enum Reason {
    /** The referenced application or key is not declared anywhere in the environment. */
    REFERENCE_NOT_FOUND,

    /** The secret a generator reads from was resolved, but has no value. */
    SOURCE_HAS_NO_VALUE,

    /** The referenced secret is declared but never resolved: a cycle, or a chain to another unresolved secret. */
    UNRESOLVED_REFERENCE
  }

  private final SecretRequirement requirement;

  private final SecretId reference;

  private final Reason reason;

  public UnresolvedSecret(SecretRequirement requirement, SecretId reference, Reason reason) {
    this.requirement = requirement;
    this.reference = reference;
    this.reason = reason;
  }

  public SecretRequirement getRequirement() {
    return requirement;
  }

  public SecretId getId() {
    return requirement.getId();
  }

  /**
   * Returns the secret this requirement depends on.
   */
  public SecretId getReference() {
    return reference;
  }

  public Reason getReason() {
    return reason;
  }

  @Override
  public String toString() {
    return String.format("%s (waiting on %s: %s)", requirement.getId(), reference, reason);
  }
}
