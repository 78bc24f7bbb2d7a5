package com.mesosphere.secrets.specification;

/**
 * Generation from the value of another secret in the same application, e.g. a password hash.
 */
public final class SourceGenerateRules extends GenerateRules {

  private final String source;

  private final SecretFunction function;

  SourceGenerateRules(SecretGenerateType type, String source, SecretFunction function) {
    super(type);
    this.source = source;
    this.function = function;
    ValidationUtils.nonBlank(this, "source", source);
    ValidationUtils.nonNull(this, "function", function);
  }

  /**
   * Returns the key, within the same application, of the secret this one is derived from.
   */
  public String getSource() {
    return source;
  }

  public SecretValue generate(SecretValue sourceValue) {
    return function.apply(sourceValue);
  }

  @Override
  public String toString() {
    return String.format("generate %s from %s", getTypeName(), source);
  }
}
