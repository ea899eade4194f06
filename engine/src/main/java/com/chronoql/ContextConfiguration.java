/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.chronoql;

import com.chronoql.exception.ConfigurationException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-coordinator overrides of {@link GlobalConfiguration} settings. A setting without an override resolves to the global value,
 * so an empty instance reads the process-wide configuration.
 * <p>
 * Values may be stored as strings (as read from the environment or a command line) and are converted on read by the typed getters.
 */
public class ContextConfiguration {
  private final Map<GlobalConfiguration, Object> overrides = new ConcurrentHashMap<>();

  public ContextConfiguration() {
  }

  public ContextConfiguration(final Map<GlobalConfiguration, ?> overrides) {
    for (Map.Entry<GlobalConfiguration, ?> entry : overrides.entrySet())
      setValue(entry.getKey(), entry.getValue());
  }

  /**
   * Overrides a setting for this context only. A null value drops the override and restores the global value.
   *
   * @return the previous override, or null
   */
  public Object setValue(final GlobalConfiguration setting, final Object value) {
    if (value == null)
      return overrides.remove(setting);
    return overrides.put(setting, value);
  }

  public boolean isOverridden(final GlobalConfiguration setting) {
    return overrides.containsKey(setting);
  }

  public Object getValue(final GlobalConfiguration setting) {
    final Object value = overrides.get(setting);
    return value != null ? value : setting.getValue();
  }

  public String getValueAsString(final GlobalConfiguration setting) {
    final Object value = getValue(setting);
    return value != null ? value.toString() : null;
  }

  public boolean getValueAsBoolean(final GlobalConfiguration setting) {
    final Object value = getValue(setting);
    if (value instanceof Boolean)
      return (Boolean) value;
    return value != null && Boolean.parseBoolean(value.toString().trim());
  }

  public int getValueAsInteger(final GlobalConfiguration setting) {
    final Object value = getValue(setting);
    if (value instanceof Number)
      return ((Number) value).intValue();
    return value != null ? parse(setting, value, Integer.class).intValue() : 0;
  }

  public long getValueAsLong(final GlobalConfiguration setting) {
    final Object value = getValue(setting);
    if (value instanceof Number)
      return ((Number) value).longValue();
    return value != null ? parse(setting, value, Long.class).longValue() : 0L;
  }

  private static Number parse(final GlobalConfiguration setting, final Object value, final Class<? extends Number> type) {
    final String text = value.toString().trim();
    try {
      return type == Integer.class ? (Number) Integer.valueOf(text) : (Number) Long.valueOf(text);
    } catch (final NumberFormatException e) {
      throw new ConfigurationException("Invalid value '" + text + "' for setting '" + setting.getKey() + "'", e);
    }
  }
}
