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

import io.grpc.CallCredentials;
import io.grpc.Metadata;
import io.grpc.Status;

import java.util.concurrent.Executor;

/**
 * Attaches the internal credential and the organization of the query to every call.
 */
public class WorkerCallCredentials extends CallCredentials {
  public static final Metadata.Key<String> AUTHORIZATION = Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);

  private final InternalTokenProvider tokenProvider;
  private final Metadata.Key<String>  orgHeader;
  private final String                orgId;

  public WorkerCallCredentials(final InternalTokenProvider tokenProvider, final String orgHeaderKey, final String orgId) {
    this.tokenProvider = tokenProvider;
    this.orgHeader = Metadata.Key.of(orgHeaderKey, Metadata.ASCII_STRING_MARSHALLER);
    this.orgId = orgId;
  }

  @Override
  public void applyRequestMetadata(final RequestInfo requestInfo, final Executor appExecutor, final MetadataApplier applier) {
    try {
      final Metadata headers = new Metadata();
      final String token = tokenProvider.token();
      if (token != null && !token.isEmpty())
        headers.put(AUTHORIZATION, token);
      headers.put(orgHeader, orgId);
      applier.apply(headers);
    } catch (RuntimeException e) {
      applier.fail(Status.UNAUTHENTICATED.withDescription("cannot attach internal credentials").withCause(e));
    }
  }
}
