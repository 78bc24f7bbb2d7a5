package com.mesosphere.secrets.specification;

import java.util.Arrays;
import java.util.Optional;

/**
 * The built-in ways of generating a secret value.
 */
public enum SecretGenerateType {
  /** 32 random bytes, hex encoded. */
  PASSWORD("password", false),

  /** Random bearer token of the form {@code gt-<key>.<secret>}. */
  TOKEN("token", false),

  /** 32 random bytes, url-safe base64 encoded with padding. */
  FERNET_KEY("fernet-key", false),

  /** 2048-bit RSA private key in PKCS#8 PEM encoding. */
  RSA_PRIVATE_KEY("rsa-private-key", false),

  /** bcrypt hash of the source secret. */
  BCRYPT_PASSWORD_HASH("bcrypt-password-hash", true),

  /** Time the source secret was first seen without a stored value. */
  MTIME("mtime", true);

  private final String yamlName;

  private final boolean requiresSource;

  SecretGenerateType(String yamlName, boolean requiresSource) {
    this.yamlName = yamlName;
    this.requiresSource = requiresSource;
  }

  /**
   * Returns the name used for this type in environment YAML files.
   */
  public String getYamlName() {
    return yamlName;
  }

  /**
   * Returns whether generation takes the value of another secret in the same application as input.
   */
  public boolean requiresSource() {
    return requiresSource;
  }

  public static Optional<SecretGenerateType> fromYamlName(String name) {
    return Arrays.stream(values())
        .filter(type -> type.yamlName.equals(name))
        .findFirst();
  }
}
