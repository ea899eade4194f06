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

import com.chronoql.exception.ChronoQLException;
import com.chronoql.exception.WorkerExecutionException;
import com.chronoql.exception.WorkerUnreachableException;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

/**
 * Maps the failure of a call to a worker to the exception surfaced to the caller. Transport details never reach the message:
 * they stay in the cause.
 * <ul>
 *   <li>{@code UNAVAILABLE}: the worker cannot be reached</li>
 *   <li>{@code INTERNAL} with a serialized {@link ChronoQLException} as description: that error, unchanged</li>
 *   <li>anything else: a generic execution error</li>
 * </ul>
 */
public final class GrpcErrorTranslator {
  public static final String CONNECT_ERROR_MESSAGE = "connect search node error";
  public static final String SEARCH_ERROR_MESSAGE  = "search node error";

  private GrpcErrorTranslator() {
  }

  public static ChronoQLException translate(final Throwable error) {
    if (error instanceof ChronoQLException)
      return (ChronoQLException) error;

    final Status status;
    if (error instanceof StatusRuntimeException)
      status = ((StatusRuntimeException) error).getStatus();
    else if (error instanceof StatusException)
      status = ((StatusException) error).getStatus();
    else
      return new WorkerExecutionException(SEARCH_ERROR_MESSAGE, error);

    switch (status.getCode()) {
    case UNAVAILABLE:
      return new WorkerUnreachableException(CONNECT_ERROR_MESSAGE, error);
    case INTERNAL:
      final ChronoQLException structured = ChronoQLException.fromJSON(status.getDescription());
      if (structured != null)
        return structured;
      return new WorkerExecutionException(SEARCH_ERROR_MESSAGE, error);
    default:
      return new WorkerExecutionException(SEARCH_ERROR_MESSAGE, error);
    }
  }

  /**
   * Tells whether the exception was reported by a worker as a structured error, as opposed to one built on this side, including
   * errors raised while decoding a worker's response.
   */
  public static boolean isStructured(final ChronoQLException exception) {
    return exception.isRemote();
  }
}
