package com.mesosphere.secrets.specification;

/**
 * Derives a secret value from the plaintext of another secret.
 */
@FunctionalInterface
public interface SecretFunction {

  SecretValue apply(SecretValue source);
}
