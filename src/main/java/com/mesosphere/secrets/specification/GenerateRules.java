package com.mesosphere.secrets.specification;

import java.util.Optional;

/**
 * Declares that a secret is generated when the store holds no value for it. There are exactly two kinds:
 * {@link SimpleGenerateRules}, which need no input, and {@link SourceGenerateRules}, which derive their value from
 * another secret of the same application.
 */
public abstract class GenerateRules {

  private final SecretGenerateType type;

  GenerateRules(SecretGenerateType type) {
    this.type = type;
  }

  /**
   * Returns rules using the built-in generator for an independent {@code type}.
   *
   * @throws IllegalArgumentException if the type requires a source secret
   */
  public static SimpleGenerateRules simple(SecretGenerateType type) {
    if (type.requiresSource()) {
      throw new IllegalArgumentException(String.format(
          "Generator type '%s' requires a source secret", type.getYamlName()));
    }
    return new SimpleGenerateRules(type, SecretGenerators.generator(type));
  }

  /**
   * Returns rules using the built-in function for a derived {@code type}, reading {@code source} in the same
   * application.
   *
   * @throws IllegalArgumentException if the type does not take a source secret
   */
  public static SourceGenerateRules fromSource(SecretGenerateType type, String source) {
    if (!type.requiresSource()) {
      throw new IllegalArgumentException(String.format(
          "Generator type '%s' does not take a source secret", type.getYamlName()));
    }
    return new SourceGenerateRules(type, source, SecretGenerators.function(type));
  }

  /**
   * Returns rules using a caller-provided generator.
   */
  public static SimpleGenerateRules custom(SecretGenerator generator) {
    return new SimpleGenerateRules(null, generator);
  }

  /**
   * Returns rules using a caller-provided function of {@code source} in the same application.
   */
  public static SourceGenerateRules custom(String source, SecretFunction function) {
    return new SourceGenerateRules(null, source, function);
  }

  /**
   * Returns the built-in generator type, or an empty value for caller-provided generators.
   */
  public Optional<SecretGenerateType> getType() {
    return Optional.ofNullable(type);
  }

  String getTypeName() {
    return type == null ? "custom" : type.getYamlName();
  }
}
