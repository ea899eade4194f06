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

import org.json.JSONObject;

/**
 * What a search cost: records and bytes scanned, response time in seconds and the request details the usage sink keeps. Time
 * bounds are in microseconds.
 */
public record RequestStats(long records, double size, double responseTime, String requestBody, String userEmail, long minTs,
                           long maxTs, String traceId) {

  public JSONObject toJSON() {
    final JSONObject json = new JSONObject();
    json.put("records", records);
    json.put("size", size);
    json.put("response_time", responseTime);
    json.put("request_body", requestBody);
    json.put("user_email", userEmail);
    json.put("min_ts", minTs);
    json.put("max_ts", maxTs);
    json.put("trace_id", traceId);
    return json;
  }
}
