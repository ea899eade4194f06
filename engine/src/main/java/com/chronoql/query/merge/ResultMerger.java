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
package com.chronoql.query.merge;

import com.chronoql.exception.InvalidResultShapeException;
import com.chronoql.query.value.InstantValue;
import com.chronoql.query.value.Labels;
import com.chronoql.query.value.QueryValue;
import com.chronoql.query.value.RangeValue;
import com.chronoql.query.value.Sample;
import com.chronoql.query.value.Signature;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the partial results of the partitions of one query into a single value.
 * <p>
 * Series are grouped by {@link Signature}. When two partitions report a point for the same series and timestamp the one
 * processed last wins: partitions only overlap at their boundary instant, where the values are expected to agree. The result
 * is returned in canonical label order.
 */
public final class ResultMerger {

  private ResultMerger() {
  }

  /**
   * Merges the partial results in the order given. The result type of the first partial result that declares one is
   * authoritative.
   */
  public static QueryValue merge(final List<PartialResult> results) {
    ResultType resultType = null;
    final List<PartialSeries> series = new ArrayList<>();
    for (PartialResult result : results) {
      if (resultType == null)
        resultType = result.resultType();
      series.addAll(result.series());
    }
    return merge(resultType, series);
  }

  public static QueryValue merge(final ResultType resultType, final List<PartialSeries> series) {
    if (resultType == null)
      throw new InvalidResultShapeException("invalid result type");

    return switch (resultType) {
      case MATRIX -> mergeMatrix(series);
      case VECTOR -> mergeVector(series);
      case SCALAR -> mergeScalar(series);
    };
  }

  public static QueryValue.Matrix mergeMatrix(final List<PartialSeries> series) {
    final Map<Signature, Map<Long, Double>> points = new HashMap<>();
    final Map<Signature, Labels> labels = new HashMap<>();

    for (PartialSeries s : series) {
      final Signature signature = s.labels().signature();
      final Map<Long, Double> group = points.computeIfAbsent(signature, k -> new TreeMap<>());
      for (Sample sample : s.samples())
        group.put(sample.timestamp(), sample.value());
      labels.put(signature, s.labels());
    }

    final List<RangeValue> merged = new ArrayList<>(points.size());
    for (Map.Entry<Signature, Map<Long, Double>> entry : points.entrySet()) {
      final List<Sample> samples = new ArrayList<>(entry.getValue().size());
      for (Map.Entry<Long, Double> point : entry.getValue().entrySet())
        samples.add(new Sample(point.getKey(), point.getValue()));
      merged.add(new RangeValue(labels.get(entry.getKey()), samples));
    }
    return new QueryValue.Matrix(merged);
  }

  public static QueryValue.Vector mergeVector(final List<PartialSeries> series) {
    final Map<Signature, InstantValue> latest = new HashMap<>();
    for (PartialSeries s : series) {
      if (s.sample() == null)
        throw new InvalidResultShapeException("vector series " + s.labels() + " has no sample");
      latest.put(s.labels().signature(), new InstantValue(s.labels(), s.sample()));
    }
    return new QueryValue.Vector(new ArrayList<>(latest.values()));
  }

  /**
   * Keeps the last value processed. A full sample replaces both timestamp and value, a bare scalar only the value. With no
   * value at all the result is {@code (0, 0.0)}.
   */
  public static QueryValue.Scalar mergeScalar(final List<PartialSeries> series) {
    long timestamp = 0;
    double value = 0;
    for (PartialSeries s : series) {
      if (s.sample() != null) {
        timestamp = s.sample().timestamp();
        value = s.sample().value();
      } else if (s.scalar() != null)
        value = s.scalar();
    }
    return new QueryValue.Scalar(new Sample(timestamp, value));
  }
}
