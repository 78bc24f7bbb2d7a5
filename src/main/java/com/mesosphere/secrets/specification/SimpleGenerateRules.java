package com.mesosphere.secrets.specification;

/**
 * Generation with no dependency on other secrets, e.g. a random password.
 */
public final class SimpleGenerateRules extends GenerateRules {

  private final SecretGenerator generator;

  SimpleGenerateRules(SecretGenerateType type, SecretGenerator generator) {
    super(type);
    ValidationUtils.nonNull(this, "generator", generator);
    this.generator = generator;
  }

  public SecretValue generate() {
    return generator.generate();
  }

  @Override
  public String toString() {
    return String.format("generate %s", getTypeName());
  }
}
