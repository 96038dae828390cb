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
package io.isima.chartdata.common;

import java.util.Properties;

/** Generic property reader that backs {@link ChartDataConfig}. */
public class ChartDataConfigBase {

  private static ChartDataConfigBase instance;

  private Properties properties = System.getProperties();

  /**
   * ChartDataConfigBase is instantiated as a singleton.
   *
   * @return The instance.
   */
  public static synchronized ChartDataConfigBase getInstance() {
    if (instance == null) {
      instance = new ChartDataConfigBase();
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
   * @param minimumValue allowed minimum value
   * @param maximumValue allowed maximum value
   * @return property as an integer.
   */
  public int getInt(String key, int defaultValue, int minimumValue, int maximumValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      final var intValue = Integer.parseInt(value.trim());
      if (intValue < minimumValue || intValue > maximumValue) {
        throw new RuntimeException(
            String.format(
                "Value of parameter %s is out of allowed range [%d : %d]: %d",
                key, minimumValue, maximumValue, intValue));
      }
      return intValue;
    } catch (NumberFormatException e) {
      throw new RuntimeException(e);
    }
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
      throw new RuntimeException(e);
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
}
