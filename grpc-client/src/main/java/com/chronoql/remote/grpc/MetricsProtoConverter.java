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
import com.chronoql.query.merge.PartialResult;
import com.chronoql.query.merge.PartialSeries;
import com.chronoql.query.merge.ResultType;
import com.chronoql.query.merge.ScanStats;
import com.chronoql.query.partition.TimePartition;
import com.chronoql.query.value.Label;
import com.chronoql.query.value.Labels;
import com.chronoql.query.value.Sample;
import com.chronoql.server.grpc.Job;
import com.chronoql.server.grpc.MetricsQueryRequest;
import com.chronoql.server.grpc.MetricsQueryResponse;
import com.chronoql.server.grpc.MetricsQueryStmt;
import com.chronoql.server.grpc.Series;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the wire messages of the {@code Metrics} service and the query model. Result type tags are validated here,
 * so an unknown tag fails the call that returned it.
 */
public final class MetricsProtoConverter {
  static final int STAGE = 0;

  private MetricsProtoConverter() {
  }

  /**
   * The partition id of the job is the id of the node serving it, so repeated queries keep the same partition to node mapping.
   */
  public static MetricsQueryRequest toRequest(final DispatchRequest request, final TimePartition partition, final WorkerNode node) {
    return MetricsQueryRequest.newBuilder()
        .setJob(Job.newBuilder()
            .setTraceId(request.traceId())
            .setJob(request.jobId())
            .setStage(STAGE)
            .setPartition((int) node.id()))
        .setOrgId(request.orgId())
        .setNeedWal(partition.needWal())
        .setQuery(MetricsQueryStmt.newBuilder()
            .setQuery(request.query())
            .setStart(partition.start())
            .setEnd(partition.end())
            .setStep(request.step()))
        .setNoCache(request.noCache())
        .setTimeout(request.timeoutSecs())
        .build();
  }

  public static PartialResult fromResponse(final int partition, final MetricsQueryResponse response) {
    final ResultType resultType = ResultType.fromTag(response.getResultType());

    final List<PartialSeries> series = new ArrayList<>(response.getResultCount());
    for (Series s : response.getResultList())
      series.add(toSeries(s));

    return new PartialResult(partition, resultType, series, response.hasScanStats() ? toScanStats(response.getScanStats()) : new ScanStats(),
        response.getTook());
  }

  static PartialSeries toSeries(final Series series) {
    final List<Label> labels = new ArrayList<>(series.getMetricCount());
    for (com.chronoql.server.grpc.Label l : series.getMetricList())
      labels.add(new Label(l.getName(), l.getValue()));

    final List<Sample> samples = new ArrayList<>(series.getSamplesCount());
    for (com.chronoql.server.grpc.Sample s : series.getSamplesList())
      samples.add(new Sample(s.getTime(), s.getValue()));

    final Sample sample = series.hasSample() ? new Sample(series.getSample().getTime(), series.getSample().getValue()) : null;
    final Double scalar = series.hasScalar() ? series.getScalar() : null;

    return new PartialSeries(Labels.of(labels), sample, samples, scalar);
  }

  static ScanStats toScanStats(final com.chronoql.server.grpc.ScanStats stats) {
    return new ScanStats(stats.getFiles(), stats.getRecords(), stats.getOriginalSize(), stats.getCompressedSize(), stats.getQuerierFiles(),
        stats.getQuerierMemoryCachedFiles(), stats.getQuerierDiskCachedFiles(), stats.getIdxScanSize(), stats.getIdxTook(),
        stats.getFileListTook());
  }
}
