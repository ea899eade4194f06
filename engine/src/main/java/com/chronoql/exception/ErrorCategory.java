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
package com.chronoql.exception;

/**
 * Categories for organizing error codes in the ChronoQL exception hierarchy.
 * <p>
 * Each {@link ErrorCode} belongs to exactly one category, derived from the thousands of its numeric code:
 * <ul>
 *   <li>{@link #QUERY} - 1xxx, invalid or oversized queries</li>
 *   <li>{@link #CLUSTER} - 2xxx, worker selection and remote execution</li>
 *   <li>{@link #CONFIGURATION} - 3xxx, invalid settings</li>
 *   <li>{@link #INTERNAL} - 99xxx, unexpected conditions</li>
 * </ul>
 *
 * @see ErrorCode
 * @see ChronoQLException
 */
public enum ErrorCategory {
  QUERY("Query"),
  CLUSTER("Cluster"),
  CONFIGURATION("Configuration"),
  INTERNAL("Internal"),
  UNKNOWN("Unknown");

  private final String displayName;

  ErrorCategory(final String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the human-readable display name for this category, used in error messages, logs and JSON responses.
   *
   * @return the display name (e.g., "Query", "Cluster")
   */
  public String getDisplayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
