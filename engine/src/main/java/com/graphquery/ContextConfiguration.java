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
package com.graphquery;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents a context configuration where custom setting could be defined for the context only, for example a single query. If not
 * defined, globals will be taken.
 **/
public class ContextConfiguration {
  private final Map<String, Object> config = new ConcurrentHashMap<>();

  /**
   * Empty constructor to create just a proxy for the GlobalConfiguration. No values are set.
   */
  public ContextConfiguration() {
  }

  /**
   * Initializes the context with custom parameters.
   *
   * @param config Map of parameters of type {@literal Map<String, Object>}.
   */
  public ContextConfiguration(final Map<String, Object> config) {
    this.config.putAll(config);
  }

  public ContextConfiguration(final ContextConfiguration parent) {
    if (parent != null)
      config.putAll(parent.config);
  }

  public void fromJSON(final String input) {
    if (input == null)
      return;

    final JsonObject json = JsonParser.parseString(input).getAsJsonObject();
    final JsonObject cfg = json.getAsJsonObject("configuration");
    if (cfg == null)
      return;

    for (final Map.Entry<String, JsonElement> entry : cfg.entrySet()) {
      final GlobalConfiguration cfgEntry = GlobalConfiguration.findByKey(GlobalConfiguration.PREFIX + entry.getKey());
      if (cfgEntry != null)
        setValue(cfgEntry, GlobalConfiguration.toValue(entry.getValue()));
    }
  }

  public String toJSON() {
    final JsonObject json = new JsonObject();
    final JsonObject cfg = new JsonObject();
    json.add("configuration", cfg);

    for (final Map.Entry<String, Object> entry : config.entrySet())
      cfg.add(entry.getKey().substring(GlobalConfiguration.PREFIX.length()), GlobalConfiguration.toJsonValue(entry.getValue()));

    return json.toString();
  }

  /**
   * Overrides a setting for this context only. The value is converted to the type of the setting. A null value removes the
   * override.
   *
   * @return the previous override, if any
   */
  public Object setValue(final GlobalConfiguration setting, final Object value) {
    if (value == null)
      return config.remove(setting.getKey());

    return config.put(setting.getKey(), setting.convert(value));
  }

  public Object getValue(final GlobalConfiguration setting) {
    final Object value = config.get(setting.getKey());
    return value != null ? value : setting.getValue();
  }

  /**
   * @return Value of configuration parameter stored in this context as enumeration if such one exists, otherwise value stored in
   * passed in {@link GlobalConfiguration} instance.
   *
   * @throws ClassCastException       if stored value can not be casted and parsed from string to passed in enumeration class.
   * @throws IllegalArgumentException if value associated with configuration parameter is a string but can not be converted to
   *                                  instance of passed in enumeration class.
   */
  public <T extends Enum<T>> T getValueAsEnum(final GlobalConfiguration setting, final Class<T> enumType) {
    return GlobalConfiguration.toEnum(getValue(setting), enumType);
  }

  public boolean hasValue(final GlobalConfiguration setting) {
    return config.containsKey(setting.getKey());
  }

  public boolean getValueAsBoolean(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    if (v == null)
      return false;
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    if (v == null)
      return 0;
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    if (v == null)
      return 0;
    return v instanceof Number ? ((Number) v).longValue() : Long.parseLong(v.toString());
  }

  public int getContextSize() {
    return config.size();
  }
}
