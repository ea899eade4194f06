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
 * Exception thrown when worker selection or a remote call to a worker node fails.
 * <p>
 * This exception category covers:
 * <ul>
 *   <li>No healthy worker available</li>
 *   <li>Connection failures toward a worker</li>
 *   <li>Worker failures without a structured error</li>
 * </ul>
 * Messages are generic: transport details are logged, never returned to the caller.
 *
 * @see ErrorCode
 * @see ChronoQLException
 */
public class ClusterException extends ChronoQLException {

  public ClusterException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  public ClusterException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(errorCode, message, cause);
  }

  /**
   * Cluster exceptions map to 503 (Service Unavailable) when no worker can serve the request and to 502 (Bad Gateway) when a
   * worker answered with a failure.
   *
   * @return the HTTP status code
   */
  @Override
  public int getHttpStatus() {
    return switch (getErrorCode()) {
      case NO_WORKERS_AVAILABLE, WORKER_UNREACHABLE -> 503;
      case WORKER_EXECUTION_ERROR -> 502;
      default -> 503;
    };
  }
}
