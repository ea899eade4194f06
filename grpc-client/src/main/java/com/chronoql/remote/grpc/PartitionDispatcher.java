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

import com.chronoql.cluster.WorkerNode;
import com.chronoql.exception.ChronoQLException;
import com.chronoql.exception.WorkerUnreachableException;
import com.chronoql.log.LogManager;
import com.chronoql.query.merge.PartialResult;
import com.chronoql.query.partition.TimePartition;
import com.chronoql.server.grpc.MetricsGrpc;
import com.chronoql.server.grpc.MetricsQueryRequest;
import com.chronoql.server.grpc.MetricsQueryResponse;
import io.grpc.Channel;
import io.grpc.ClientInterceptor;
import io.grpc.stub.StreamObserver;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Sends every partition of a query to its worker and collects the partial results.
 * <p>
 * Partition {@code i} goes to node {@code i}; spare nodes stay idle. All calls are started before any result is awaited. The
 * first failure fails the whole dispatch right away: calls still in flight are not cancelled, their outcome is ignored. When
 * more failures are known at that moment, an error reported by a worker wins over a transport or generic one.
 */
public class PartitionDispatcher {
  private final WorkerChannelProvider   channelProvider;
  private final InternalTokenProvider   tokenProvider;
  private final DispatchSettings        settings;
  private final List<ClientInterceptor> interceptors;

  public PartitionDispatcher(final WorkerChannelProvider channelProvider, final InternalTokenProvider tokenProvider,
      final DispatchSettings settings) {
    this(channelProvider, tokenProvider, settings, List.of(new TracingClientInterceptor()));
  }

  public PartitionDispatcher(final WorkerChannelProvider channelProvider, final InternalTokenProvider tokenProvider,
      final DispatchSettings settings, final List<ClientInterceptor> interceptors) {
    this.channelProvider = channelProvider;
    this.tokenProvider = tokenProvider;
    this.settings = settings;
    this.interceptors = interceptors == null ? List.of() : List.copyOf(interceptors);
  }

  /**
   * Dispatches the partitions and waits for their results, returned in partition order.
   *
   * @throws ChronoQLException the failure of the first call that failed
   */
  public List<PartialResult> dispatch(final DispatchRequest request, final List<TimePartition> partitions, final List<WorkerNode> nodes) {
    try {
      return dispatchAsync(request, partitions, nodes).get();
    } catch (ExecutionException e) {
      throw GrpcErrorTranslator.translate(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChronoQLException("Interrupted while waiting for the workers", e);
    }
  }

  public CompletableFuture<List<PartialResult>> dispatchAsync(final DispatchRequest request, final List<TimePartition> partitions,
      final List<WorkerNode> nodes) {
    if (partitions.size() > nodes.size())
      throw new IllegalArgumentException("Cannot dispatch " + partitions.size() + " partitions on " + nodes.size() + " nodes");

    final CompletableFuture<List<PartialResult>> outcome = new CompletableFuture<>();
    final List<CompletableFuture<PartialResult>> calls = new ArrayList<>(partitions.size());
    final List<ChronoQLException> failures = new ArrayList<>();

    for (int i = 0; i < partitions.size(); i++) {
      final CompletableFuture<PartialResult> call = query(request, partitions.get(i), nodes.get(i));
      calls.add(call);

      call.whenComplete((result, error) -> {
        if (error == null)
          return;

        final ChronoQLException failure = GrpcErrorTranslator.translate(unwrap(error));
        synchronized (failures) {
          failures.add(failure);
          outcome.completeExceptionally(selectFailure(failures));
        }
      });
    }

    CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).thenRun(() -> {
      final List<PartialResult> results = new ArrayList<>(calls.size());
      for (CompletableFuture<PartialResult> call : calls)
        results.add(call.join());
      outcome.complete(results);
    });

    return outcome;
  }

  protected CompletableFuture<PartialResult> query(final DispatchRequest request, final TimePartition partition, final WorkerNode node) {
    final CompletableFuture<PartialResult> future = new CompletableFuture<>();

    LogManager.instance().log(this, Level.INFO, "promql->search->partition: node: %s, need_wal: %s, time_range: [%d, %d]",
        node.address(), partition.needWal(), partition.start(), partition.end());

    final Channel channel;
    try {
      channel = channelProvider.channel(node.address());
    } catch (RuntimeException e) {
      LogManager.instance().log(this, Level.SEVERE, "promql->search->grpc: node: %s, connect err: %s", e, node.address(), e.getMessage());
      future.completeExceptionally(new WorkerUnreachableException(GrpcErrorTranslator.CONNECT_ERROR_MESSAGE, e));
      return future;
    }

    final MetricsQueryRequest message = MetricsProtoConverter.toRequest(request, partition, node);
    final String traceId = request.traceId();

    newStub(channel, request.orgId()).query(message, new StreamObserver<>() {
      private MetricsQueryResponse response;

      @Override
      public void onNext(final MetricsQueryResponse value) {
        response = value;
      }

      @Override
      public void onError(final Throwable t) {
        logWithContext(traceId, Level.SEVERE, "promql->search->grpc: node: %s, search err: %s", t, node.address(), t.getMessage());
        future.completeExceptionally(t);
      }

      @Override
      public void onCompleted() {
        if (response == null) {
          future.completeExceptionally(new IllegalStateException("Worker " + node.address() + " completed without a response"));
          return;
        }

        try {
          final PartialResult result = MetricsProtoConverter.fromResponse(partition.index(), response);
          logWithContext(traceId, Level.INFO,
              "promql->search->grpc: result node: %s, need_wal: %s, took: %d ms, files: %d, scan_size: %d", null, node.address(),
              partition.needWal(), result.tookMs(), result.scanStats().getFiles(), result.scanStats().getOriginalSize());
          future.complete(result);
        } catch (RuntimeException e) {
          future.completeExceptionally(e);
        }
      }
    });

    return future;
  }

  protected MetricsGrpc.MetricsStub newStub(final Channel channel, final String orgId) {
    return MetricsGrpc.newStub(channel)
        .withInterceptors(interceptors.toArray(new ClientInterceptor[0]))
        .withCallCredentials(new WorkerCallCredentials(tokenProvider, settings.orgHeaderKey(), orgId))
        .withDeadlineAfter(settings.callTimeoutSecs(), TimeUnit.SECONDS)
        .withCompression("gzip")
        .withMaxInboundMessageSize(settings.maxMessageSizeBytes())
        .withMaxOutboundMessageSize(settings.maxMessageSizeBytes());
  }

  public DispatchSettings getSettings() {
    return settings;
  }

  private static ChronoQLException selectFailure(final List<ChronoQLException> failures) {
    for (ChronoQLException failure : failures)
      if (GrpcErrorTranslator.isStructured(failure))
        return failure;
    return failures.get(0);
  }

  private static Throwable unwrap(final Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null)
      current = current.getCause();
    return current;
  }

  private void logWithContext(final String context, final Level level, final String message, final Throwable error, final Object... args) {
    final String previous = LogManager.instance().getContext();
    LogManager.instance().setContext(context);
    try {
      LogManager.instance().log(this, level, message, error, args);
    } finally {
      LogManager.instance().setContext(previous);
    }
  }
}
