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
package com.chronoql.remote.grpc;

import com.chronoql.ContextConfiguration;
import com.chronoql.GlobalConfiguration;

/**
 * Per-call settings of the dispatcher: the deadline of every call (independent of the end-to-end timeout of the query), the
 * message size cap and the name of the organization header.
 */
public record DispatchSettings(long callTimeoutSecs, int maxMessageSizeMb, String orgHeaderKey) {
  public DispatchSettings {
    if (callTimeoutSecs < 1)
      throw new IllegalArgumentException("Call timeout must be at least 1 second, found " + callTimeoutSecs);
    if (maxMessageSizeMb < 1)
      throw new IllegalArgumentException("Max message size must be at least 1 MB, found " + maxMessageSizeMb);
    if (orgHeaderKey == null || orgHeaderKey.isBlank())
      throw new IllegalArgumentException("Organization header key is required");
  }

  public static DispatchSettings fromConfiguration(final ContextConfiguration configuration) {
    return new DispatchSettings(configuration.getValueAsLong(GlobalConfiguration.QUERY_TIMEOUT),
        configuration.getValueAsInteger(GlobalConfiguration.GRPC_MAX_MESSAGE_SIZE),
        configuration.getValueAsString(GlobalConfiguration.GRPC_ORG_HEADER_KEY));
  }

  public int maxMessageSizeBytes() {
    return maxMessageSizeMb * 1024 * 1024;
  }
}
