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
package com.chronoql.server.query;

import com.chronoql.ContextConfiguration;
import com.chronoql.GlobalConfiguration;
import com.chronoql.cluster.WorkerNode;
import com.chronoql.exception.ChronoQLException;
import com.chronoql.exception.ErrorCode;
import com.chronoql.exception.QueryException;
import com.chronoql.exception.TooManyPointsException;
import com.chronoql.log.LogManager;
import com.chronoql.query.merge.PartialResult;
import com.chronoql.query.merge.ResultMerger;
import com.chronoql.query.merge.ScanStats;
import com.chronoql.query.partition.TimePartition;
import com.chronoql.query.partition.TimePartitioner;
import com.chronoql.query.partition.TimeRange;
import com.chronoql.query.value.QueryValue;
import com.chronoql.remote.grpc.DispatchRequest;
import com.chronoql.remote.grpc.InternalTokenProvider;
import com.chronoql.remote.grpc.NettyWorkerChannelProvider;
import com.chronoql.remote.grpc.PartitionDispatcher;
import com.chronoql.server.cluster.ClusterMembership;
import com.chronoql.server.cluster.NodeSelector;
import com.chronoql.server.cluster.StaticClusterMembership;
import com.chronoql.server.metric.QueryMetrics;
import com.chronoql.server.usage.AsyncUsageReportPublisher;
import com.chronoql.server.usage.LoggingUsageReporter;
import com.chronoql.server.usage.RequestStats;
import com.chronoql.server.usage.StreamType;
import com.chronoql.server.usage.UsageReporter;
import com.chronoql.server.usage.UsageType;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.logging.Level;

/**
 * Runs a range query across the cluster: picks the workers, splits the time range in one partition per worker, fans the
 * partitions out and merges the partial results. A usage record is published after every successful search.
 * <p>
 * Every search gets a fresh trace id, bound as log context for the duration of the call. Validation failures (bad step, too
 * many points, no workers) are raised before any worker is contacted.
 */
public class DistributedQueryCoordinator implements AutoCloseable {
  private final NodeSelector        nodeSelector;
  private final TimePartitioner     partitioner;
  private final PartitionDispatcher dispatcher;
  private final CoordinatorSettings settings;
  private final UsageReporter       usageReporter;
  private final QueryMetrics        metrics;
  private final LongSupplier        clockMicros;
  private final List<AutoCloseable> ownedResources = new ArrayList<>();

  public DistributedQueryCoordinator(final ClusterMembership membership, final PartitionDispatcher dispatcher,
      final CoordinatorSettings settings, final UsageReporter usageReporter, final QueryMetrics metrics) {
    this(membership, dispatcher, settings, usageReporter, metrics, DistributedQueryCoordinator::currentTimeMicros);
  }

  public DistributedQueryCoordinator(final ClusterMembership membership, final PartitionDispatcher dispatcher,
      final CoordinatorSettings settings, final UsageReporter usageReporter, final QueryMetrics metrics, final LongSupplier clockMicros) {
    this.nodeSelector = new NodeSelector(membership);
    this.partitioner = new TimePartitioner(settings.lookbackMicros(), settings.recencyWindowMicros(), clockMicros);
    this.dispatcher = dispatcher;
    this.settings = settings;
    this.usageReporter = usageReporter;
    this.metrics = metrics != null ? metrics : new QueryMetrics();
    this.clockMicros = clockMicros;
  }

  /**
   * Builds a coordinator over the statically configured workers, talking to them through Netty channels. The channels and the
   * usage publisher are released by {@link #close()}.
   */
  public static DistributedQueryCoordinator create(final ContextConfiguration configuration) {
    final CoordinatorSettings settings = CoordinatorSettings.fromConfiguration(configuration);

    final NettyWorkerChannelProvider channelProvider = new NettyWorkerChannelProvider(settings.dispatchSettings().maxMessageSizeBytes());
    final PartitionDispatcher dispatcher = new PartitionDispatcher(channelProvider, InternalTokenProvider.fromConfiguration(configuration),
        settings.dispatchSettings());
    final AsyncUsageReportPublisher usagePublisher = new AsyncUsageReportPublisher(new LoggingUsageReporter());

    final DistributedQueryCoordinator coordinator = new DistributedQueryCoordinator(StaticClusterMembership.fromConfiguration(configuration),
        dispatcher, settings, usagePublisher, new QueryMetrics());
    coordinator.ownedResources.add(usagePublisher);
    coordinator.ownedResources.add(channelProvider);
    return coordinator;
  }

  /**
   * Searches on behalf of {@code orgId}, with {@code timeoutSecs} as the end-to-end timeout the workers enforce.
   */
  public QueryValue search(final String orgId, final MetricsQuery query, final String userEmail, final long timeoutSecs) {
    return search(query.withOrgAndTimeout(orgId, timeoutSecs), userEmail);
  }

  public QueryValue search(final MetricsQuery query, final String userEmail) {
    final long startedNanos = System.nanoTime();
    final long startedAtMicros = clockMicros.getAsLong();
    final String traceId = newTraceId();
    final String jobId = traceId.substring(0, 6);

    final String previousContext = LogManager.instance().getContext();
    LogManager.instance().setContext(traceId);
    final Timer.Sample sample = metrics.start();
    try {
      LogManager.instance().log(this, Level.INFO, "promql->search->start: org_id: %s, no_cache: %s, start: %d, end: %d, query: %s",
          query.orgId(), query.noCache(), query.start(), query.end(), query.query());

      final List<WorkerNode> nodes = nodeSelector.select();

      if (query.step() <= 0)
        throw new QueryException(ErrorCode.INVALID_PARAMS, "step must be greater than zero, found " + query.step());

      final TimeRange range = adjustRange(query);

      checkMaxPoints(range, query.step());

      // SIZED ON THE ALIGNED RANGE: ALIGNMENT CAN WIDEN IT BY UP TO ONE STEP PER SIDE
      final long workerSpan = partitioner.workerSpan(range.start(), range.end(), query.step(), nodes.size());
      final List<TimePartition> partitions = partitioner.split(range, workerSpan, nodes.size());

      final DispatchRequest request = new DispatchRequest(traceId, jobId, query.orgId(), query.query(), query.step(), query.noCache(),
          query.timeoutSecs());
      final List<PartialResult> results = dispatcher.dispatch(request, partitions, nodes);

      final ScanStats scanStats = new ScanStats();
      for (PartialResult result : results)
        scanStats.add(result.scanStats());

      final QueryValue value = ResultMerger.merge(results);

      final long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
      LogManager.instance().log(this, Level.INFO, "promql->search->result: took: %d ms, file_count: %d, scan_size: %d", tookMs,
          scanStats.getFiles(), scanStats.getOriginalSize());

      metrics.recordSuccess(sample, partitions.size());

      publishUsage(query, userEmail, traceId, range, scanStats, startedNanos, startedAtMicros);
      return value;

    } catch (ChronoQLException e) {
      metrics.recordFailure(sample, e);
      throw e;
    } finally {
      LogManager.instance().setContext(previousContext);
    }
  }

  /**
   * Aligns the range to the step when the workers may answer from their result cache, so that repeated queries hit the same
   * cache entries. With the cache off or {@code no_cache} set the range is used as is.
   */
  TimeRange adjustRange(final MetricsQuery query) {
    final TimeRange range = new TimeRange(query.start(), query.end());
    if (query.noCache() || !settings.resultCacheEnabled())
      return range;
    return range.alignTo(query.step());
  }

  private void checkMaxPoints(final TimeRange range, final long step) {
    if (range.length() / step > settings.maxPointsPerSeries())
      throw new TooManyPointsException("too many points per series must be returned on the given range, you can change the limit by "
          + GlobalConfiguration.QUERY_MAX_POINTS_PER_SERIES.getKey());
  }

  private void publishUsage(final MetricsQuery query, final String userEmail, final String traceId, final TimeRange range,
      final ScanStats scanStats, final long startedNanos, final long startedAtMicros) {
    if (!settings.usageReportingEnabled() || usageReporter == null)
      return;

    final RequestStats stats = new RequestStats(scanStats.getRecords(), scanStats.getOriginalSize(),
        (System.nanoTime() - startedNanos) / 1_000_000_000.0, query.query(), userEmail, range.start(), range.end(), traceId);
    try {
      usageReporter.report(stats, query.orgId(), "", StreamType.METRICS, UsageType.METRIC_SEARCH, 0, startedAtMicros);
    } catch (RuntimeException e) {
      LogManager.instance().log(this, Level.WARNING, "Error on reporting usage", e);
    }
  }

  public CoordinatorSettings getSettings() {
    return settings;
  }

  public QueryMetrics getMetrics() {
    return metrics;
  }

  @Override
  public void close() {
    for (AutoCloseable resource : ownedResources)
      try {
        resource.close();
      } catch (Exception e) {
        LogManager.instance().log(this, Level.WARNING, "Error on closing %s", e, resource);
      }
    ownedResources.clear();
  }

  static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "");
  }

  private static long currentTimeMicros() {
    return TimeUnit.MILLISECONDS.toMicros(System.currentTimeMillis());
  }
}
