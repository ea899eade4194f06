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
import com.chronoql.cluster.RoleGroup;
import com.chronoql.cluster.WorkerNode;
import com.chronoql.exception.ErrorCode;
import com.chronoql.exception.NoWorkersAvailableException;
import com.chronoql.exception.QueryException;
import com.chronoql.exception.TooManyPointsException;
import com.chronoql.exception.WorkerUnreachableException;
import com.chronoql.query.partition.TimeRange;
import com.chronoql.query.value.Labels;
import com.chronoql.query.value.QueryValue;
import com.chronoql.query.value.RangeValue;
import com.chronoql.query.value.Sample;
import com.chronoql.remote.grpc.DispatchSettings;
import com.chronoql.remote.grpc.PartitionDispatcher;
import com.chronoql.server.cluster.ClusterMembership;
import com.chronoql.server.grpc.Label;
import com.chronoql.server.grpc.MetricsQueryRequest;
import com.chronoql.server.grpc.MetricsQueryResponse;
import com.chronoql.server.grpc.ScanStats;
import com.chronoql.server.grpc.Series;
import com.chronoql.server.metric.QueryMetrics;
import com.chronoql.server.usage.AsyncUsageReportPublisher;
import com.chronoql.server.usage.RequestStats;
import com.chronoql.server.usage.UsageReporter;
import io.grpc.Status;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DistributedQueryCoordinatorTest {
  private static final long SECOND = 1_000_000L;
  private static final long HOUR   = 3_600 * SECOND;
  // 1800s RECENCY WINDOW: ONLY PARTITIONS ENDING AFTER HALF AN HOUR READ THE WAL
  private static final long NOW    = HOUR;

  private final CoordinatorSettings settings = new CoordinatorSettings(300 * SECOND, 0, 1_800 * SECOND, true, true,
      new DispatchSettings(30, 16, "organization"));

  private InProcessWorkers          workers;
  private ClusterMembership         membership;
  private SimpleMeterRegistry       registry;
  private List<RequestStats>        usage;
  private AsyncUsageReportPublisher usagePublisher;

  @BeforeEach
  void setUp() {
    workers = new InProcessWorkers();
    membership = mock(ClusterMembership.class);
    registry = new SimpleMeterRegistry();
    usage = new CopyOnWriteArrayList<>();
    usagePublisher = new AsyncUsageReportPublisher(
        (stats, orgId, streamName, streamType, usageType, numFunctions, startedAt) -> usage.add(stats));
  }

  @AfterEach
  void tearDown() {
    usagePublisher.close();
    workers.close();
  }

  @Test
  @DisplayName("One hour on four workers is split in four quarters, merged back into one series")
  void searchAcrossFourWorkers() {
    final List<WorkerNode> nodes = new ArrayList<>();
    for (int i = 1; i <= 4; i++) {
      final String address = "querier-" + i + ":5081";
      workers.start(address, DistributedQueryCoordinatorTest::partitionSeries);
      nodes.add(new WorkerNode(i, address));
    }
    when(membership.getHealthyWorkers(RoleGroup.INTERACTIVE)).thenReturn(nodes);

    final QueryValue value = newCoordinator(dispatcher()).search("org1",
        new MetricsQuery(null, "rate(http_requests[5m])", 0, HOUR, 60 * SECOND, true, 0), "root@chronoql.com", 120);

    assertThat(value).isInstanceOf(QueryValue.Matrix.class);
    final List<RangeValue> series = ((QueryValue.Matrix) value).series();
    assertThat(series).hasSize(1);
    assertThat(series.get(0).labels()).isEqualTo(Labels.of("__name__", "http_requests", "job", "api"));
    // BOUNDARY INSTANTS ARE RETURNED BY TWO WORKERS AND KEPT ONCE
    assertThat(series.get(0).samples()).containsExactly(new Sample(0, 0), new Sample(900 * SECOND, 900), new Sample(1_800 * SECOND, 1_800),
        new Sample(2_700 * SECOND, 2_700), new Sample(HOUR, 3_600));

    long covered = 0;
    final List<String> traceIds = new ArrayList<>();
    for (int i = 1; i <= 4; i++) {
      final List<MetricsQueryRequest> received = workers.requests.get("querier-" + i + ":5081");
      assertThat(received).hasSize(1);

      final MetricsQueryRequest request = received.get(0);
      assertThat(request.getOrgId()).isEqualTo("org1");
      assertThat(request.getTimeout()).isEqualTo(120);
      assertThat(request.getJob().getPartition()).isEqualTo(i);
      assertThat(request.getQuery().getStart()).isEqualTo((i - 1) * 900 * SECOND);
      assertThat(request.getQuery().getEnd()).isEqualTo(i * 900 * SECOND);
      assertThat(request.getNeedWal()).isEqualTo(i > 1);
      covered += request.getQuery().getEnd() - request.getQuery().getStart();
      traceIds.add(request.getJob().getTraceId());
    }
    assertThat(covered).isEqualTo(3_600_000_000L);
    assertThat(traceIds).containsOnly(traceIds.get(0));
    assertThat(traceIds.get(0)).hasSize(32).matches("[0-9a-f]+");
    assertThat(workers.requests.get("querier-1:5081").get(0).getJob().getJob()).isEqualTo(traceIds.get(0).substring(0, 6));

    await().atMost(Duration.ofSeconds(5)).until(() -> usage.size() == 1);
    final RequestStats stats = usage.get(0);
    assertThat(stats.records()).isEqualTo(40);
    assertThat(stats.size()).isEqualTo(400.0);
    assertThat(stats.traceId()).isEqualTo(traceIds.get(0));
    assertThat(stats.userEmail()).isEqualTo("root@chronoql.com");
    assertThat(stats.requestBody()).isEqualTo("rate(http_requests[5m])");
    assertThat(stats.minTs()).isZero();
    assertThat(stats.maxTs()).isEqualTo(HOUR);

    assertThat(registry.get(QueryMetrics.PARTITIONS).summary().totalAmount()).isEqualTo(4.0);
  }

  @Test
  @DisplayName("A cacheable query with an unaligned start is covered up to the aligned end")
  void cacheableUnalignedRangeIsFullyCovered() {
    final List<WorkerNode> nodes = new ArrayList<>();
    for (int i = 1; i <= 4; i++) {
      final String address = "querier-" + i + ":5081";
      workers.start(address, DistributedQueryCoordinatorTest::partitionSeries);
      nodes.add(new WorkerNode(i, address));
    }
    when(membership.getHealthyWorkers(RoleGroup.INTERACTIVE)).thenReturn(nodes);

    newCoordinator(dispatcher()).search(new MetricsQuery("org1", "up", 30 * SECOND, 3_630 * SECOND, 60 * SECOND, false, 30), "");

    final List<MetricsQueryRequest> received = new ArrayList<>();
    for (WorkerNode node : nodes)
      received.addAll(workers.requests.get(node.address()));
    received.sort((a, b) -> Long.compare(a.getQuery().getStart(), b.getQuery().getStart()));

    assertThat(received).isNotEmpty();
    assertThat(received.get(0).getQuery().getStart()).isZero();
    assertThat(received.get(received.size() - 1).getQuery().getEnd()).isEqualTo(3_660 * SECOND);
    for (int i = 1; i < received.size(); i++)
      assertThat(received.get(i).getQuery().getStart()).isEqualTo(received.get(i - 1).getQuery().getEnd());
  }

  @Test
  void shortRangeUsesOneWorker() {
    workers.start("querier-1:5081", DistributedQueryCoordinatorTest::partitionSeries);
    workers.start("querier-2:5081", DistributedQueryCoordinatorTest::partitionSeries);
    when(membership.getHealthyWorkers(RoleGroup.INTERACTIVE)).thenReturn(
        List.of(new WorkerNode(2, "querier-2:5081"), new WorkerNode(1, "querier-1:5081")));

    newCoordinator(dispatcher()).search(new MetricsQuery("org1", "up", 0, 60 * SECOND, 15 * SECOND, true, 30), "");

    assertThat(workers.requests.get("querier-1:5081")).hasSize(1);
    assertThat(workers.requests.get("querier-2:5081")).isEmpty();
  }

  @Test
  void tooManyPointsFailsBeforeDispatching() {
    when(membership.getHealthyWorkers(RoleGroup.INTERACTIVE)).thenReturn(List.of(new WorkerNode(1, "querier-1:5081")));
    final PartitionDispatcher dispatcher = mock(PartitionDispatcher.class);

    assertThatThrownBy(() -> newCoordinator(dispatcher).search(new MetricsQuery("org1", "up", 0, 30_001 * SECOND, SECOND, true, 30), ""))
        .isInstanceOf(TooManyPointsException.class)
        .hasMessageContaining(GlobalConfiguration.QUERY_MAX_POINTS_PER_SERIES.getKey());

    verifyNoInteractions(dispatcher);
    assertThat(registry.get(QueryMetrics.ERRORS).tag("error", ErrorCode.TOO_MANY_POINTS.name()).counter().count()).isEqualTo(1.0);
  }

  @Test
  void pointsAtTheLimitAreAccepted() {
    workers.start("querier-1:5081", DistributedQueryCoordinatorTest::partitionSeries);
    when(membership.getHealthyWorkers(RoleGroup.INTERACTIVE)).thenReturn(List.of(new WorkerNode(1, "querier-1:5081")));

    newCoordinator(dispatcher()).search(new MetricsQuery("org1", "up", 0, 30_000 * SECOND, SECOND, true, 30), "");

    assertThat(workers.requests.get("querier-1:5081")).hasSize(1);
  }

  @Test
  void noWorkersFailsBeforePartitioning() {
    when(membership.getHealthyWorkers(RoleGroup.INTERACTIVE)).thenReturn(List.of());
    final PartitionDispatcher dispatcher = mock(PartitionDispatcher.class);

    // AN INVALID STEP IS NOT EVEN LOOKED AT
    assertThatThrownBy(() -> newCoordinator(dispatcher).search(new MetricsQuery("org1", "up", 0, HOUR, 0, true, 30), ""))
        .isInstanceOf(NoWorkersAvailableException.class)
        .hasMessage("no querier node found");

    verifyNoInteractions(dispatcher);
  }

  @Test
  void invalidStep() {
    when(membership.getHealthyWorkers(RoleGroup.INTERACTIVE)).thenReturn(List.of(new WorkerNode(1, "querier-1:5081")));
    final PartitionDispatcher dispatcher = mock(PartitionDispatcher.class);

    assertThatThrownBy(() -> newCoordinator(dispatcher).search(new MetricsQuery("org1", "up", 0, HOUR, -5, true, 30), ""))
        .isInstanceOf(QueryException.class)
        .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_PARAMS);

    verifyNoInteractions(dispatcher);
  }

  @Test
  void workerFailureFailsTheQuery() {
    workers.start("querier-1:5081", DistributedQueryCoordinatorTest::partitionSeries);
    workers.start("querier-2:5081", InProcessWorkers.failing(Status.UNAVAILABLE));
    when(membership.getHealthyWorkers(RoleGroup.INTERACTIVE)).thenReturn(
        List.of(new WorkerNode(1, "querier-1:5081"), new WorkerNode(2, "querier-2:5081")));

    final UsageReporter reporter = mock(UsageReporter.class);
    final DistributedQueryCoordinator coordinator = new DistributedQueryCoordinator(membership, dispatcher(), settings, reporter,
        new QueryMetrics(registry), () -> NOW);

    assertThatThrownBy(() -> coordinator.search(new MetricsQuery("org1", "up", 0, HOUR, 60 * SECOND, true, 30), ""))
        .isInstanceOf(WorkerUnreachableException.class);

    verify(reporter, never()).report(any(), anyString(), anyString(), any(), any(), anyInt(), anyLong());
  }

  @Test
  void usageIsNotReportedWhenDisabled() {
    workers.start("querier-1:5081", DistributedQueryCoordinatorTest::partitionSeries);
    when(membership.getHealthyWorkers(RoleGroup.INTERACTIVE)).thenReturn(List.of(new WorkerNode(1, "querier-1:5081")));

    final UsageReporter reporter = mock(UsageReporter.class);
    final CoordinatorSettings noUsage = new CoordinatorSettings(300 * SECOND, 0, 1_800 * SECOND, true, false,
        new DispatchSettings(30, 16, "organization"));

    new DistributedQueryCoordinator(membership, dispatcher(), noUsage, reporter, new QueryMetrics(registry), () -> NOW).search(
        new MetricsQuery("org1", "up", 0, HOUR, 60 * SECOND, true, 30), "");

    verifyNoInteractions(reporter);
  }

  @Test
  void failingUsageSinkDoesNotFailTheQuery() {
    workers.start("querier-1:5081", DistributedQueryCoordinatorTest::partitionSeries);
    when(membership.getHealthyWorkers(RoleGroup.INTERACTIVE)).thenReturn(List.of(new WorkerNode(1, "querier-1:5081")));

    final DistributedQueryCoordinator coordinator = new DistributedQueryCoordinator(membership, dispatcher(), settings,
        (stats, orgId, streamName, streamType, usageType, numFunctions, startedAt) -> {
          throw new IllegalStateException("usage stream is down");
        }, new QueryMetrics(registry), () -> NOW);

    assertThat(coordinator.search(new MetricsQuery("org1", "up", 0, HOUR, 60 * SECOND, true, 30), "")).isInstanceOf(QueryValue.Matrix.class);
  }

  @Test
  void rangeIsAlignedOnlyWhenCacheable() {
    final DistributedQueryCoordinator coordinator = newCoordinator(mock(PartitionDispatcher.class));

    assertThat(coordinator.adjustRange(new MetricsQuery("org1", "up", 10, 95, 20, false, 30))).isEqualTo(new TimeRange(0, 100));
    assertThat(coordinator.adjustRange(new MetricsQuery("org1", "up", 10, 95, 20, true, 30))).isEqualTo(new TimeRange(10, 95));

    final CoordinatorSettings cacheOff = new CoordinatorSettings(300 * SECOND, 0, 1_800 * SECOND, false, true,
        new DispatchSettings(30, 16, "organization"));
    final DistributedQueryCoordinator uncached = new DistributedQueryCoordinator(membership, mock(PartitionDispatcher.class), cacheOff,
        usagePublisher, new QueryMetrics(registry), () -> NOW);
    assertThat(uncached.adjustRange(new MetricsQuery("org1", "up", 10, 95, 20, false, 30))).isEqualTo(new TimeRange(10, 95));
  }

  @Test
  void settingsFromConfiguration() {
    final ContextConfiguration configuration = new ContextConfiguration();
    configuration.setValue(GlobalConfiguration.QUERY_DEFAULT_LOOKBACK_SECS, 60L);
    configuration.setValue(GlobalConfiguration.QUERY_MAX_POINTS_PER_SERIES, 0L);
    configuration.setValue(GlobalConfiguration.QUERY_MAX_FILE_RETENTION_TIME, 600L);
    configuration.setValue(GlobalConfiguration.QUERY_WAL_RECENCY_MULTIPLIER, 3);
    configuration.setValue(GlobalConfiguration.QUERY_RESULT_CACHE_ENABLED, "false");
    configuration.setValue(GlobalConfiguration.QUERY_TIMEOUT, 45L);

    final CoordinatorSettings fromConfig = CoordinatorSettings.fromConfiguration(configuration);

    assertThat(fromConfig.lookbackMicros()).isEqualTo(60 * SECOND);
    assertThat(fromConfig.maxPointsPerSeries()).isEqualTo(GlobalConfiguration.DEFAULT_MAX_POINTS_PER_SERIES);
    assertThat(fromConfig.recencyWindowMicros()).isEqualTo(1_800 * SECOND);
    assertThat(fromConfig.resultCacheEnabled()).isFalse();
    assertThat(fromConfig.dispatchSettings().callTimeoutSecs()).isEqualTo(45);
  }

  private DistributedQueryCoordinator newCoordinator(final PartitionDispatcher dispatcher) {
    return new DistributedQueryCoordinator(membership, dispatcher, settings, usagePublisher, new QueryMetrics(registry), () -> NOW);
  }

  private PartitionDispatcher dispatcher() {
    return new PartitionDispatcher(workers, () -> "", settings.dispatchSettings(), List.of());
  }

  /**
   * Answers with one sample at each end of the partition, valued with the timestamp in seconds.
   */
  private static MetricsQueryResponse partitionSeries(final MetricsQueryRequest request) {
    final long start = request.getQuery().getStart();
    final long end = request.getQuery().getEnd();

    return MetricsQueryResponse.newBuilder()
        .setResultType("matrix")
        .setTook(5)
        .addResult(Series.newBuilder()
            .addMetric(Label.newBuilder().setName("job").setValue("api"))
            .addMetric(Label.newBuilder().setName("__name__").setValue("http_requests"))
            .addSamples(com.chronoql.server.grpc.Sample.newBuilder().setTime(start).setValue(start / (double) SECOND))
            .addSamples(com.chronoql.server.grpc.Sample.newBuilder().setTime(end).setValue(end / (double) SECOND)))
        .setScanStats(ScanStats.newBuilder().setFiles(1).setRecords(10).setOriginalSize(100))
        .build();
  }
}
