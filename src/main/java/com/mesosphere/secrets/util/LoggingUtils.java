package com.mesosphere.secrets.util;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility methods around construction of loggers.
 */
public final class LoggingUtils {

  private LoggingUtils() {
  }

  /**
   * Creates a logger which is tagged with the provided class.
   *
   * @param clazz the class using this logger
   */
  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(getClassName(clazz));
  }

  /**
   * Creates a logger which is tagged with the provided class and the name of the environment being handled.
   *
   * @param clazz the class using this logger
   * @param environmentName the environment whose secrets are being processed, or blank for none
   */
  public static Logger getLogger(Class<?> clazz, String environmentName) {
    if (StringUtils.isBlank(environmentName)) {
      return getLogger(clazz);
    } else {
      return LoggerFactory.getLogger(String.format("(%s) %s", environmentName, getClassName(clazz)));
    }
  }

  /**
   * Returns a class name suitable for using in logs, e.g. "{@code LoggingUtils}".
   */
  private static String getClassName(Class<?> clazz) {
    return clazz.getSimpleName();
  }
}
