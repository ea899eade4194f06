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
import com.chronoql.exception.ErrorCode;
import com.chronoql.exception.InvalidResultShapeException;
import com.chronoql.exception.QueryException;
import com.chronoql.exception.WorkerExecutionException;
import com.chronoql.exception.WorkerUnreachableException;
import io.grpc.Status;
import io.grpc.StatusException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GrpcErrorTranslatorTest {

  @Test
  @DisplayName("Status.UNAVAILABLE maps to WorkerUnreachableException without transport details")
  void unavailable() {
    final ChronoQLException e = GrpcErrorTranslator.translate(Status.UNAVAILABLE.withDescription("io exception: 10.0.0.7:5081").asRuntimeException());

    assertThat(e).isInstanceOf(WorkerUnreachableException.class);
    assertThat(e.getMessage()).isEqualTo("connect search node error");
    assertThat(e.getCause()).hasMessageContaining("10.0.0.7");
  }

  @Test
  @DisplayName("Status.INTERNAL with a serialized error is propagated unchanged")
  void internalStructured() {
    final String json = new QueryException(ErrorCode.QUERY_EXECUTION_ERROR, "function rate() requires a range vector").toJSON();

    final ChronoQLException e = GrpcErrorTranslator.translate(Status.INTERNAL.withDescription(json).asRuntimeException());

    assertThat(e).isInstanceOf(QueryException.class);
    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.QUERY_EXECUTION_ERROR);
    assertThat(e.getMessage()).isEqualTo("function rate() requires a range vector");
    assertThat(GrpcErrorTranslator.isStructured(e)).isTrue();
  }

  @Test
  @DisplayName("Status.INTERNAL with free text maps to WorkerExecutionException")
  void internalUnstructured() {
    final ChronoQLException e = GrpcErrorTranslator.translate(Status.INTERNAL.withDescription("panic at worker").asException());

    assertThat(e).isInstanceOf(WorkerExecutionException.class);
    assertThat(e.getMessage()).isEqualTo("search node error");
    assertThat(GrpcErrorTranslator.isStructured(e)).isFalse();
  }

  @Test
  @DisplayName("Other status codes map to WorkerExecutionException")
  void otherStatus() {
    assertThat(GrpcErrorTranslator.translate(new StatusException(Status.DEADLINE_EXCEEDED))).isInstanceOf(WorkerExecutionException.class);
    assertThat(GrpcErrorTranslator.translate(Status.RESOURCE_EXHAUSTED.asRuntimeException())).isInstanceOf(WorkerExecutionException.class);
    assertThat(GrpcErrorTranslator.translate(new IllegalStateException("boom"))).isInstanceOf(WorkerExecutionException.class);
  }

  @Test
  @DisplayName("ChronoQL exceptions pass through")
  void passThrough() {
    final WorkerUnreachableException original = new WorkerUnreachableException("connect search node error", null);
    assertThat(GrpcErrorTranslator.translate(original)).isSameAs(original);
  }

  @Test
  @DisplayName("Only errors decoded from a worker's status count as structured")
  void locallyRaisedErrorIsNotStructured() {
    final InvalidResultShapeException local = new InvalidResultShapeException("invalid result type: string");
    assertThat(GrpcErrorTranslator.isStructured(local)).isFalse();
    assertThat(GrpcErrorTranslator.isStructured(GrpcErrorTranslator.translate(local))).isFalse();

    final ChronoQLException reported = GrpcErrorTranslator.translate(Status.INTERNAL.withDescription(local.toJSON()).asRuntimeException());
    assertThat(reported.getErrorCode()).isEqualTo(ErrorCode.INVALID_RESULT_SHAPE);
    assertThat(GrpcErrorTranslator.isStructured(reported)).isTrue();
  }
}
