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
package com.chronoql.server.usage;

import com.chronoql.log.LogManager;
import org.json.JSONObject;

import java.util.Locale;
import java.util.logging.Level;

/**
 * Writes usage records to the log. Used when no billing sink is plugged in.
 */
public class LoggingUsageReporter implements UsageReporter {
  @Override
  public void report(final RequestStats stats, final String orgId, final String streamName, final StreamType streamType,
      final UsageType usageType, final int numFunctions, final long startedAtMicros) {
    final JSONObject json = stats.toJSON();
    json.put("org_id", orgId);
    json.put("stream_name", streamName);
    json.put("stream_type", streamType.name().toLowerCase(Locale.ENGLISH));
    json.put("event", usageType.getName());
    json.put("num_functions", numFunctions);
    json.put("started_at", startedAtMicros);
    LogManager.instance().log(this, Level.FINE, "usage: %s", json);
  }
}
