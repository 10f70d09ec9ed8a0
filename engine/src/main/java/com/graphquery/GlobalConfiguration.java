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
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.graphquery.log.LogManager;
import com.graphquery.query.groupby.AggregateStorage;
import com.graphquery.query.groupby.GroupingStrategy;
import com.graphquery.utility.Callable;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and then environment
 * variables.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("graphquery.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false,
      new Callable<Object, Object>() {
        @Override
        public Object call(final Object value) {
          if (Boolean.TRUE.equals(value))
            dumpConfiguration(System.out);
          return value;
        }
      }),

  // GROUP BY
  GROUP_BY_THREADS("graphquery.groupBy.threads",
      "Number of worker threads used to group the rows of a query. 1 disables every parallel code path", Integer.class, 1,
      new Callable<Object, Object>() {
        @Override
        public Object call(final Object value) {
          if (((Integer) value) < 1)
            throw new IllegalArgumentException("Grouping thread count must be at least 1, found " + value);
          return value;
        }
      }),

  GROUP_BY_STRATEGY("graphquery.groupBy.strategy",
      "Grouping algorithm: 'local_merge' (per thread groups merged in a binary tree), 'global_merge' (per thread groups merged into one shared "
          + "dictionary) or 'global' (every thread works on the shared dictionary)", GroupingStrategy.class, GroupingStrategy.LOCAL_MERGE),

  GROUP_BY_STORAGE("graphquery.groupBy.storage",
      "Representation of the partial aggregate values: 'buckets' (one cell per group), 'lists' (growable lists indexed by group ordinal) or "
          + "'arrays' (pre-sized arrays indexed by group ordinal)", AggregateStorage.class, AggregateStorage.BUCKETS),

  GROUP_BY_ARRAY_INITIAL_SIZE("graphquery.groupBy.arrayInitialSize",
      "Initial capacity of the shared aggregate arrays used by the 'global' strategy with 'arrays' storage. They double when full", Integer.class,
      512),

  GROUP_BY_LOG_TIMINGS("graphquery.groupBy.logTimings", "Logs at INFO level the time spent scanning and merging by every grouping run",
      Boolean.class, false);

  private final Object nullValue = new Object();

  private final       String                   key;
  private final       Object                   defValue;
  private final       Class<?>                 type;
  private final       Callable<Object, Object> callback;
  private volatile    Object                   value  = nullValue;
  private final       String                   description;
  public final static String                   PREFIX = "graphquery.";

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue) {
    this(key, description, type, defValue, null);
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue,
      final Callable<Object, Object> callback) {
    this.key = key;
    this.description = description;
    this.defValue = defValue;
    this.type = type;
    this.callback = callback;
  }

  public static void resetAll() {
    for (final GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.print(Constants.PRODUCT.toUpperCase(Locale.ENGLISH));
    out.print(" ");
    out.print(Constants.getRawVersion());
    out.println(" configuration:");

    String lastSection = "";
    for (final GlobalConfiguration v : values()) {
      final String keyWithoutPrefix = v.key.substring(PREFIX.length());
      final int dot = keyWithoutPrefix.indexOf('.');
      final String section = dot > -1 ? keyWithoutPrefix.substring(0, dot) : "environment";

      if (!lastSection.equals(section)) {
        out.print("- ");
        out.println(section.toUpperCase(Locale.ENGLISH));
        lastSection = section;
      }
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JsonObject json = JsonParser.parseString(input).getAsJsonObject();
    final JsonObject cfg = json.getAsJsonObject("configuration");
    if (cfg == null)
      return;

    for (final Map.Entry<String, JsonElement> entry : cfg.entrySet()) {
      final GlobalConfiguration cfgEntry = findByKey(PREFIX + entry.getKey());
      if (cfgEntry != null)
        cfgEntry.setValue(toValue(entry.getValue()));
      else
        LogManager.instance().log(GlobalConfiguration.class, Level.WARNING, "Ignored unknown configuration setting '%s'", entry.getKey());
    }
  }

  public static String toJSON() {
    final JsonObject json = new JsonObject();
    final JsonObject cfg = new JsonObject();
    json.add("configuration", cfg);

    for (final GlobalConfiguration k : values())
      cfg.add(k.key.substring(PREFIX.length()), toJsonValue(k.getValue()));

    return json.toString();
  }

  /**
   * Finds the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @return GlobalConfiguration instance if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (final GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(key))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values
   */
  public static void setConfiguration(final Map<String, Object> config) {
    for (final Map.Entry<String, Object> entry : config.entrySet()) {
      for (final GlobalConfiguration v : values()) {
        if (v.getKey().equals(entry.getKey()) || v.name().equals(entry.getKey())) {
          v.setValue(entry.getValue());
          break;
        }
      }
    }
  }

  /**
   * Assign configuration values by reading system properties.
   */
  private static void readConfiguration() {
    for (final GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null)
        try {
          config.setValue(prop);
        } catch (final IllegalArgumentException e) {
          LogManager.instance().log(GlobalConfiguration.class, Level.SEVERE, "Invalid value for setting %s=%s, using default", e, config.key, prop);
        }
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != nullValue && value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  /**
   * @return Value of configuration parameter stored as enumeration if such one exists.
   *
   * @throws ClassCastException       if stored value can not be casted and parsed from string to passed in enumeration class.
   * @throws IllegalArgumentException if value associated with configuration parameter is a string but can not be converted to
   *                                  instance of passed in enumeration class.
   */
  public <T extends Enum<T>> T getValueAsEnum(final Class<T> enumType) {
    return toEnum(getValue(), enumType);
  }

  /**
   * Sets the value after converting it to the type of the setting. Strings are parsed, enum names are case insensitive.
   *
   * @throws IllegalArgumentException if the value cannot be converted or the setting rejects it
   */
  public void setValue(final Object newValue) {
    final Object converted = convert(newValue);
    if (callback != null) {
      final Object result = callback.call(converted);
      value = result;
    } else
      value = converted;
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).longValue() : Long.parseLong(v.toString());
  }

  public String getKey() {
    return key;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }

  Object convert(final Object newValue) {
    if (newValue == null)
      return null;

    if (type == Boolean.class)
      return newValue instanceof Boolean ? newValue : Boolean.parseBoolean(newValue.toString());
    else if (type == Integer.class)
      return newValue instanceof Number ? ((Number) newValue).intValue() : parseNumber(newValue).intValue();
    else if (type == Long.class)
      return newValue instanceof Number ? ((Number) newValue).longValue() : parseNumber(newValue);
    else if (type == String.class)
      return newValue.toString();
    else if (type.isEnum()) {
      if (type.isInstance(newValue))
        return newValue;

      if (newValue instanceof String) {
        for (final Object constant : type.getEnumConstants()) {
          if (((Enum<?>) constant).name().equalsIgnoreCase((String) newValue))
            return constant;
        }
      }
      throw new IllegalArgumentException("Invalid value '" + newValue + "' of `" + key + "` option");
    }
    return newValue;
  }

  static <T extends Enum<T>> T toEnum(final Object value, final Class<T> enumType) {
    if (value == null)
      return null;

    if (enumType.isAssignableFrom(value.getClass()))
      return enumType.cast(value);
    else if (value instanceof String) {
      for (final T constant : enumType.getEnumConstants())
        if (constant.name().equalsIgnoreCase((String) value))
          return constant;
      throw new IllegalArgumentException("Value '" + value + "' is not a valid " + enumType.getSimpleName());
    }
    throw new ClassCastException("Value " + value + " can not be cast to enumeration " + enumType.getSimpleName());
  }

  static Object toValue(final JsonElement element) {
    if (element == null || element.isJsonNull())
      return null;
    if (element.isJsonPrimitive()) {
      final JsonPrimitive primitive = element.getAsJsonPrimitive();
      if (primitive.isBoolean())
        return primitive.getAsBoolean();
      if (primitive.isNumber())
        return primitive.getAsNumber();
      return primitive.getAsString();
    }
    return element.toString();
  }

  static JsonElement toJsonValue(final Object value) {
    if (value instanceof Boolean)
      return new JsonPrimitive((Boolean) value);
    if (value instanceof Number)
      return new JsonPrimitive((Number) value);
    if (value instanceof Enum)
      return new JsonPrimitive(((Enum<?>) value).name().toLowerCase(Locale.ENGLISH));
    return value == null ? JsonNull.INSTANCE : new JsonPrimitive(value.toString());
  }

  private Long parseNumber(final Object value) {
    final String text = value.toString().trim();
    try {
      return Long.parseLong(text);
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid numeric value '" + text + "' of `" + key + "` option", e);
    }
  }
}
