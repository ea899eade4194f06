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

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.context.propagation.TextMapSetter;

/**
 * Propagates the caller's trace context to the worker through call headers. The propagator comes from the global
 * OpenTelemetry instance unless one is given, which is W3C trace context once an SDK is installed.
 */
public class TracingClientInterceptor implements ClientInterceptor {
  private static final TextMapSetter<Metadata> METADATA_SETTER = (carrier, key, value) -> {
    if (carrier != null)
      carrier.put(Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER), value);
  };

  private final ContextPropagators propagators;

  public TracingClientInterceptor() {
    this(GlobalOpenTelemetry.getPropagators());
  }

  public TracingClientInterceptor(final ContextPropagators propagators) {
    this.propagators = propagators;
  }

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(final MethodDescriptor<ReqT, RespT> method, final CallOptions callOptions,
      final Channel next) {
    final Context context = Context.current();
    return new ForwardingClientCall.SimpleForwardingClientCall<>(next.newCall(method, callOptions)) {
      @Override
      public void start(final Listener<RespT> responseListener, final Metadata headers) {
        propagators.getTextMapPropagator().inject(context, headers, METADATA_SETTER);
        super.start(responseListener, headers);
      }
    };
  }
}
