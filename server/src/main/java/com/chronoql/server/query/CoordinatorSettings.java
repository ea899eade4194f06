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
package com.chronoql.server.query;

import com.chronoql.ContextConfiguration;
import com.chronoql.GlobalConfiguration;
import com.chronoql.remote.grpc.DispatchSettings;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Snapshot of the settings a coordinator works with, taken once at construction. Durations are in microseconds.
 */
public record CoordinatorSettings(long lookbackMicros, long maxPointsPerSeries, long recencyWindowMicros, boolean resultCacheEnabled,
                                  boolean usageReportingEnabled, DispatchSettings dispatchSettings) {
  public CoordinatorSettings {
    if (lookbackMicros <= 0)
      throw new IllegalArgumentException("Lookback must be greater than zero, found " + lookbackMicros);
    if (recencyWindowMicros < 0)
      throw new IllegalArgumentException("Recency window cannot be negative, found " + recencyWindowMicros);
    Objects.requireNonNull(dispatchSettings, "dispatchSettings");
    // 0 OR NEGATIVE = BUILT-IN DEFAULT
    if (maxPointsPerSeries <= 0)
      maxPointsPerSeries = GlobalConfiguration.DEFAULT_MAX_POINTS_PER_SERIES;
  }

  public static CoordinatorSettings fromConfiguration(final ContextConfiguration configuration) {
    final long lookback = TimeUnit.SECONDS.toMicros(configuration.getValueAsLong(GlobalConfiguration.QUERY_DEFAULT_LOOKBACK_SECS));
    final long retention = TimeUnit.SECONDS.toMicros(configuration.getValueAsLong(GlobalConfiguration.QUERY_MAX_FILE_RETENTION_TIME));
    final long recencyWindow = Math.multiplyExact(retention,
        (long) configuration.getValueAsInteger(GlobalConfiguration.QUERY_WAL_RECENCY_MULTIPLIER));

    return new CoordinatorSettings(lookback, configuration.getValueAsLong(GlobalConfiguration.QUERY_MAX_POINTS_PER_SERIES), recencyWindow,
        configuration.getValueAsBoolean(GlobalConfiguration.QUERY_RESULT_CACHE_ENABLED),
        configuration.getValueAsBoolean(GlobalConfiguration.USAGE_REPORTING_ENABLED), DispatchSettings.fromConfiguration(configuration));
  }
}
