package com.mesosphere.secrets.specification;

import java.util.Objects;
import java.util.Optional;

/**
 * A single secret plaintext. The plaintext is only available through {@link #reveal()}: the string form of this
 * object is always masked so that secrets do not end up in logs or exception messages.
 */
public final class SecretValue {

  private static final String MASK = "**********";

  private final String value;

  private SecretValue(String value) {
    this.value = value;
  }

  /**
   * Wraps the provided plaintext, which must not be {@code null}.
   */
  public static SecretValue of(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Secret value cannot be null");
    }
    return new SecretValue(value);
  }

  /**
   * Wraps the provided plaintext if it is non-empty. Empty and {@code null} plaintexts count as "no value".
   */
  public static Optional<SecretValue> ofNullable(String value) {
    return isSet(value) ? Optional.of(new SecretValue(value)) : Optional.empty();
  }

  /**
   * Returns whether the provided optional holds a non-empty plaintext.
   */
  public static boolean isSet(Optional<SecretValue> value) {
    return value.isPresent() && !value.get().isEmpty();
  }

  private static boolean isSet(String value) {
    return value != null && !value.isEmpty();
  }

  /**
   * Returns the plaintext of this secret.
   */
  public String reveal() {
    return value;
  }

  public boolean isEmpty() {
    return value.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return value.equals(((SecretValue) o).value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value);
  }

  @Override
  public String toString() {
    return MASK;
  }
}
