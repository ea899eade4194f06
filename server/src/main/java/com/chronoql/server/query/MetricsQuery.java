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

import java.util.Objects;

/**
 * A range query as received from the caller. Times and step are in microseconds, the timeout in seconds.
 */
public record MetricsQuery(String orgId, String query, long start, long end, long step, boolean noCache, long timeoutSecs) {
  public MetricsQuery {
    Objects.requireNonNull(query, "query");
    orgId = orgId != null ? orgId : "";
  }

  public MetricsQuery withOrgAndTimeout(final String orgId, final long timeoutSecs) {
    return new MetricsQuery(orgId, query, start, end, step, noCache, timeoutSecs);
  }
}
