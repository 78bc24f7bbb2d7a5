package com.mesosphere.secrets.resolve;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when secret resolution stops making progress. Lists every requirement left unresolved, not only the first.
 * This always indicates a defect in the declared secrets, so retrying cannot help.
 */
public class UnresolvedSecretsException extends Exception {

  private final List<UnresolvedSecret> secrets;

  public UnresolvedSecretsException(List<UnresolvedSecret> secrets) {
    super(String.format("Unable to resolve %d secrets: %s", secrets.size(), Joiner.on(", ").join(secrets)));
    this.secrets = ImmutableList.copyOf(secrets);
  }

  public List<UnresolvedSecret> getSecrets() {
    return secrets;
  }
}
