package com.mesosphere.secrets.specification;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;

/**
 * Utilities for validating members of secret requirements and environments.
 */
public class ValidationUtils {

  private ValidationUtils() {
    // do not instantiate
  }

  // Collection checks

  /**
   * Throws an exception if there are any duplicate entries in the provided list.
   */
  public static <T> void isUnique(Object parent, String fieldName, Stream<T> field) {
    Set<T> found = new HashSet<>();
    Set<T> duplicates = field.filter(e -> !found.add(e)).collect(Collectors.toSet());
    if (!duplicates.isEmpty()) {
      throw new IllegalArgumentException(String.format(
          "%s cannot have any duplicates (%s): %s", fieldName, duplicates, parent));
    }
  }

  // String checks

  /**
   * Throws an exception if {@code field} is whitespace-only, empty, or {@code null}.
   */
  public static void nonBlank(Object parent, String fieldName, String field) {
    nonNull(parent, fieldName, field);
    if (StringUtils.isBlank(field)) {
      throw new IllegalArgumentException(String.format("%s cannot be blank or empty: %s", fieldName, parent));
    }
  }

  // Object checks

  /**
   * Throws an exception if {@code field} is {@code null}.
   */
  public static void nonNull(Object parent, String fieldName, Object field) {
    if (field == null) {
      throw new IllegalArgumentException(String.format("%s cannot be null: %s", fieldName, parent));
    }
  }

  /**
   * Throws an exception if {@code field} is not {@code null}.
   */
  public static void isNull(Object parent, String fieldName, Object field) {
    if (field != null) {
      throw new IllegalArgumentException(String.format("%s must be null: %s", fieldName, parent));
    }
  }
}
