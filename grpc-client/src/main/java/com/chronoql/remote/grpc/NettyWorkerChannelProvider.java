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

import com.chronoql.log.LogManager;
import io.grpc.Channel;
import io.grpc.CompressorRegistry;
import io.grpc.DecompressorRegistry;
import io.grpc.ManagedChannel;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Plaintext Netty channels, one per worker address, created on first use and kept until {@link #close()}.
 */
public class NettyWorkerChannelProvider implements WorkerChannelProvider {
  private final ConcurrentMap<String, ManagedChannel> channels = new ConcurrentHashMap<>();
  private final int                                   maxMessageSizeBytes;
  private volatile boolean                            closed;

  public NettyWorkerChannelProvider(final int maxMessageSizeBytes) {
    this.maxMessageSizeBytes = maxMessageSizeBytes;
  }

  @Override
  public Channel channel(final String address) {
    if (closed)
      throw new IllegalStateException("Channel provider is closed");

    final ManagedChannel channel = channels.compute(address, (k, existing) -> {
      if (existing != null && !existing.isShutdown())
        return existing;
      return createChannel(k);
    });
    return channel;
  }

  protected ManagedChannel createChannel(final String address) {
    LogManager.instance().log(this, Level.FINE, "Opening channel to worker %s", address);

    return NettyChannelBuilder.forTarget(address)
        .usePlaintext()
        .maxInboundMessageSize(maxMessageSizeBytes)
        .keepAliveTime(30, TimeUnit.SECONDS)
        .keepAliveTimeout(10, TimeUnit.SECONDS)
        .keepAliveWithoutCalls(true)
        .decompressorRegistry(DecompressorRegistry.getDefaultInstance())
        .compressorRegistry(CompressorRegistry.getDefaultInstance())
        .build();
  }

  @Override
  public void close() {
    closed = true;

    final List<ManagedChannel> toClose = new ArrayList<>(channels.values());
    channels.clear();

    for (ManagedChannel channel : toClose)
      channel.shutdown();

    try {
      for (ManagedChannel channel : toClose)
        if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
          channel.shutdownNow();
          channel.awaitTermination(2, TimeUnit.SECONDS);
        }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      for (ManagedChannel channel : toClose)
        channel.shutdownNow();
    }
  }
}
