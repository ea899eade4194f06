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

import com.chronoql.log.LogManager;

import java.io.PrintStream;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and, when a
 * property is missing, the environment.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("chronoql.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false, value -> {
    if (Boolean.TRUE.equals(value))
      dumpConfiguration(System.out);
    return value;
  }),

  // QUERY
  QUERY_DEFAULT_LOOKBACK_SECS("chronoql.query.defaultLookbackSecs",
      "Minimum resolution (in seconds) used to size the time partitions of a range query", Long.class, 300L, value -> {
    if ((long) value < 1)
      throw new IllegalArgumentException("Default lookback must be at least 1 second");
    return value;
  }),

  QUERY_MAX_POINTS_PER_SERIES("chronoql.query.maxPointsPerSeries",
      "Maximum number of points a single series can return. 0 means the built-in default of 30000",
      Long.class, 0L),

  QUERY_TIMEOUT("chronoql.query.timeout", "Deadline (in seconds) applied to every call made to a worker node", Long.class, 600L, value -> {
    if ((long) value < 1)
      throw new IllegalArgumentException("Query timeout must be at least 1 second");
    return value;
  }),

  QUERY_MAX_FILE_RETENTION_TIME("chronoql.query.maxFileRetentionTime",
      "Maximum time (in seconds) ingested data can stay in the write-ahead buffer before it is persisted", Long.class, 600L),

  QUERY_WAL_RECENCY_MULTIPLIER("chronoql.query.walRecencyMultiplier",
      "Multiplier applied to the max file retention time to compute the window where partitions must also read the write-ahead buffer",
      Integer.class, 3),

  QUERY_RESULT_CACHE_ENABLED("chronoql.query.resultCacheEnabled",
      "Enables the result cache on the workers. When enabled the query range is aligned to the step", Boolean.class, true),

  // GRPC
  GRPC_MAX_MESSAGE_SIZE("chronoql.grpc.maxMessageSize", "Maximum size (in MB) of a message exchanged with a worker node", Integer.class, 16),

  GRPC_ORG_HEADER_KEY("chronoql.grpc.orgHeaderKey", "Name of the call header that carries the organization identifier", String.class,
      "organization"),

  GRPC_INTERNAL_TOKEN("chronoql.grpc.internalToken", "Credential presented to worker nodes as the authorization header", String.class, "",
      null, true),

  // CLUSTER
  CLUSTER_WORKERS("chronoql.cluster.workers",
      "List of <id>@<hostname/ip-address>:<port> worker nodes separated by comma. Example: 1@localhost:5081,2@192.168.0.1:5081",
      String.class, ""),

  // USAGE
  USAGE_REPORTING_ENABLED("chronoql.usage.reportingEnabled", "Publishes a usage record after every search", Boolean.class, true),
  ;

  public static final long DEFAULT_MAX_POINTS_PER_SERIES = 30_000L;

  /**
   * Place holder for the "undefined" value of setting.
   */
  private final Object nullValue = new Object();

  private final       String                 key;
  private final       Object                 defValue;
  private final       Class<?>               type;
  private final       UnaryOperator<Object>  callback;
  private volatile    Object                 value  = nullValue;
  private final       String                 description;
  private final       boolean                hidden;
  public final static String                 PREFIX = "chronoql.";

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue) {
    this(iKey, iDescription, iType, iDefValue, null, false);
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue,
      final UnaryOperator<Object> callback) {
    this(iKey, iDescription, iType, iDefValue, callback, false);
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue,
      final UnaryOperator<Object> callback, final boolean hidden) {
    this.key = iKey;
    this.description = iDescription;
    this.defValue = iDefValue;
    this.type = iType;
    this.callback = callback;
    this.hidden = hidden;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.println("CHRONOQL configuration:");

    String lastSection = "";
    for (GlobalConfiguration v : values()) {
      final String relative = v.key.substring(PREFIX.length());
      final int dot = relative.indexOf('.');
      final String section = dot > -1 ? relative.substring(0, dot) : "environment";

      if (!lastSection.equals(section)) {
        out.print("- ");
        out.println(section.toUpperCase(Locale.ENGLISH));
        lastSection = section;
      }
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(v.isHidden() ? "<hidden>" : String.valueOf((Object) v.getValue()));
    }
  }

  /**
   * Assign configuration values by reading system properties.
   */
  private static void readConfiguration() {
    for (GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null)
        try {
          config.setValue(prop);
        } catch (IllegalArgumentException e) {
          LogManager.instance().log(GlobalConfiguration.class, Level.WARNING, "Ignoring setting %s=%s, using default %s", config.key, prop,
              config.defValue);
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

  public void setValue(final Object iValue) {
    if (iValue == null)
      return;

    final Object converted;
    if (type == Boolean.class)
      converted = Boolean.parseBoolean(iValue.toString());
    else if (type == Integer.class)
      converted = Integer.parseInt(iValue.toString().trim());
    else if (type == Long.class)
      converted = Long.parseLong(iValue.toString().trim());
    else if (type == String.class)
      converted = iValue.toString();
    else
      converted = iValue;

    if (callback != null)
      try {
        value = callback.apply(converted);
      } catch (IllegalArgumentException e) {
        LogManager.instance().log(this, Level.SEVERE, "Invalid value for property %s=%s", e, key, converted);
        throw e;
      }
    else
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

  public boolean isHidden() {
    return hidden;
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
}
