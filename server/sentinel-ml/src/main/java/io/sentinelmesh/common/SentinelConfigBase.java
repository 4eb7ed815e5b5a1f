/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.sentinelmesh.common;

import io.sentinelmesh.errors.exception.InvalidConfigurationException;
import java.util.Properties;

public class SentinelConfigBase {
  private static SentinelConfigBase instance;

  private Properties properties = System.getProperties();

  /**
   * SentinelConfigBase is instantiated as a singleton.
   *
   * @return The instance.
   */
  public static synchronized SentinelConfigBase getInstance() {
    if (instance == null) {
      instance = new SentinelConfigBase();
    }
    return instance;
  }

  public static void setProperties(Properties properties) {
    getInstance().properties = properties;
  }

  /**
   * Generic method to get property as string.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a string.
   */
  public String getString(String key, String defaultValue) {
    String value = properties.getProperty(key);
    return value != null ? value.trim() : defaultValue;
  }

  /**
   * Generic method to get property as integer.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as an integer.
   */
  public int getInt(String key, int defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidConfigurationException(key + "=" + value, e);
    }
  }

  /**
   * Generic method to get property as integer.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @param minimumValue allowed minimum value
   * @param maximumValue allowed maximum value
   * @return property as an integer.
   */
  public int getInt(String key, int defaultValue, int minimumValue, int maximumValue) {
    final int intValue = getInt(key, defaultValue);
    if (intValue < minimumValue || intValue > maximumValue) {
      throw new InvalidConfigurationException(
          String.format(
              "Value of parameter %s is out of allowed range [%d : %d]: %d",
              key, minimumValue, maximumValue, intValue));
    }
    return intValue;
  }

  /**
   * Generic method to get property as double.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a double.
   */
  public double getDouble(String key, double defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidConfigurationException(key + "=" + value, e);
    }
  }

  /**
   * Generic method to get property as double within an exclusive range.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @param lowerExclusive the value must be greater than this
   * @param upperExclusive the value must be less than this
   * @return property as a double.
   */
  public double getDouble(
      String key, double defaultValue, double lowerExclusive, double upperExclusive) {
    final double doubleValue = getDouble(key, defaultValue);
    if (!(doubleValue > lowerExclusive && doubleValue < upperExclusive)) {
      throw new InvalidConfigurationException(
          String.format(
              "Value of parameter %s is out of allowed range (%s : %s): %s",
              key, lowerExclusive, upperExclusive, doubleValue));
    }
    return doubleValue;
  }

  /**
   * Generic method to get property as long.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a long.
   */
  public long getLong(String key, long defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidConfigurationException(key + "=" + value, e);
    }
  }

  /**
   * Generic method to get property as boolean.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a boolean.
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  /**
   * Generic method to get property as list of string.
   *
   * @param key the property key
   * @param delimiter delimiter that splits the property
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as an array of string, empty when the value is blank.
   */
  public String[] getStringArray(String key, String delimiter, String defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      value = defaultValue;
    }
    if (value.isBlank()) {
      return new String[0];
    }
    String[] values = value.split(delimiter);
    for (int i = 0; i < values.length; ++i) {
      values[i] = values[i].trim();
    }
    return values;
  }
}
