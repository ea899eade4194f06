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
package com.chronoql.server.metric;

import com.chronoql.exception.ChronoQLException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Query metrics using Micrometer. Errors are counted per error code.
 */
public class QueryMetrics {
  public static final String REQUESTS   = "chronoql.query.requests";
  public static final String ERRORS     = "chronoql.query.errors";
  public static final String DURATION   = "chronoql.query.duration";
  public static final String PARTITIONS = "chronoql.query.partitions";

  private final MeterRegistry       meterRegistry;
  private final Counter             requestCounter;
  private final Timer               requestTimer;
  private final DistributionSummary partitionSummary;

  public QueryMetrics() {
    this(new SimpleMeterRegistry());
  }

  public QueryMetrics(final MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;

    this.requestCounter = Counter.builder(REQUESTS)
        .description("Total number of distributed queries")
        .register(meterRegistry);

    this.requestTimer = Timer.builder(DURATION)
        .description("Distributed query duration")
        .register(meterRegistry);

    this.partitionSummary = DistributionSummary.builder(PARTITIONS)
        .description("Number of partitions a query was split in")
        .register(meterRegistry);
  }

  public Timer.Sample start() {
    requestCounter.increment();
    return Timer.start(meterRegistry);
  }

  public void recordSuccess(final Timer.Sample sample, final int partitions) {
    sample.stop(requestTimer);
    partitionSummary.record(partitions);
  }

  public void recordFailure(final Timer.Sample sample, final ChronoQLException error) {
    sample.stop(requestTimer);
    Counter.builder(ERRORS)
        .description("Total number of failed distributed queries")
        .tag("error", error.getErrorCode().name())
        .register(meterRegistry)
        .increment();
  }

  public MeterRegistry getMeterRegistry() {
    return meterRegistry;
  }
}
