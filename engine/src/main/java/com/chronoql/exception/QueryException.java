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
 * Exception thrown when a query is rejected or fails while being evaluated.
 * <p>
 * Example usage:
 * <pre>{@code
 * throw new QueryException(ErrorCode.INVALID_PARAMS, "step must be greater than zero")
 *     .addContext("step", step);
 * }</pre>
 *
 * @see ErrorCode
 * @see ChronoQLException
 */
public class QueryException extends ChronoQLException {

  public QueryException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  public QueryException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(errorCode, message, cause);
  }

  /**
   * Query exceptions map to 400 (Bad Request) when the caller can fix the request, 500 otherwise.
   *
   * @return the HTTP status code
   */
  @Override
  public int getHttpStatus() {
    return switch (getErrorCode()) {
      case INVALID_PARAMS, TOO_MANY_POINTS -> 400;
      case QUERY_TIMEOUT -> 408;
      default -> 500;
    };
  }
}
