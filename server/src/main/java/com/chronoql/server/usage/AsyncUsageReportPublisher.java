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
package com.chronoql.server.usage;

import com.chronoql.log.LogManager;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Hands usage records to a delegate on a dedicated thread, so reporting never delays or fails a query. Failures of the delegate
 * are logged and dropped.
 */
public class AsyncUsageReportPublisher implements UsageReporter, AutoCloseable {
  private final UsageReporter   delegate;
  private final ExecutorService executor;

  public AsyncUsageReportPublisher(final UsageReporter delegate) {
    this.delegate = delegate;
    this.executor = Executors.newSingleThreadExecutor(r -> {
      final Thread thread = new Thread(r, "ChronoQL-UsagePublisher");
      thread.setDaemon(true);
      return thread;
    });
  }

  @Override
  public void report(final RequestStats stats, final String orgId, final String streamName, final StreamType streamType,
      final UsageType usageType, final int numFunctions, final long startedAtMicros) {
    try {
      executor.execute(() -> {
        try {
          delegate.report(stats, orgId, streamName, streamType, usageType, numFunctions, startedAtMicros);
        } catch (Exception e) {
          LogManager.instance().log(this, Level.WARNING, "Error on publishing usage of trace %s", e, stats.traceId());
        }
      });
    } catch (RejectedExecutionException e) {
      LogManager.instance().log(this, Level.WARNING, "Usage publisher is closed, dropping usage of trace %s", stats.traceId());
    }
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS))
        executor.shutdownNow();
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
