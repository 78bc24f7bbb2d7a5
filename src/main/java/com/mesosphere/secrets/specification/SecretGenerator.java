package com.mesosphere.secrets.specification;

/**
 * Produces a fresh secret value with no input.
 */
@FunctionalInterface
public interface SecretGenerator {

  SecretValue generate();
}
