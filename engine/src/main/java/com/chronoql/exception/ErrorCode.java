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

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for ChronoQL exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - Query errors (parameters, resolution limits)</li>
 *   <li>2xxx - Cluster errors (worker selection, transport, remote execution)</li>
 *   <li>3xxx - Configuration errors</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 * Codes travel across nodes inside the JSON form of a {@link ChronoQLException}, so a code must never be renumbered.
 *
 * @see ChronoQLException
 */
public enum ErrorCode {

  // ========== Query Errors (1xxx) ==========
  /** Request parameters are invalid (for example a non positive step) */
  INVALID_PARAMS(1001, "Invalid parameters"),

  /** The requested resolution exceeds the configured maximum points per series */
  TOO_MANY_POINTS(1002, "Too many points per series"),

  /** The query failed while being evaluated on a worker */
  QUERY_EXECUTION_ERROR(1003, "Query execution error"),

  /** The query exceeded its end-to-end timeout */
  QUERY_TIMEOUT(1004, "Query timeout"),

  // ========== Cluster Errors (2xxx) ==========
  /** No healthy worker node is available for the query */
  NO_WORKERS_AVAILABLE(2001, "No workers available"),

  /** A worker node could not be reached */
  WORKER_UNREACHABLE(2002, "Worker unreachable"),

  /** A worker node failed without reporting a structured error */
  WORKER_EXECUTION_ERROR(2003, "Worker execution error"),

  // ========== Configuration Errors (3xxx) ==========
  /** A setting holds a value that cannot be used */
  CONFIGURATION_ERROR(3001, "Configuration error"),

  // ========== Internal Errors (99xxx) ==========
  /** A partial result carried a missing or unknown result type */
  INVALID_RESULT_SHAPE(99001, "Invalid result shape"),

  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  /**
   * Returns the numeric error code.
   *
   * @return the error code (e.g., 1001, 2001, etc.)
   */
  public int getCode() {
    return code;
  }

  /**
   * Returns the default human-readable error message.
   *
   * @return the default error message
   */
  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   *
   * @return the error category
   */
  public ErrorCategory getCategory() {
    return switch (code / 1000) {
      case 1 -> ErrorCategory.QUERY;
      case 2 -> ErrorCategory.CLUSTER;
      case 3 -> ErrorCategory.CONFIGURATION;
      case 99 -> ErrorCategory.INTERNAL;
      default -> ErrorCategory.UNKNOWN;
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @param code the numeric error code to look up
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
