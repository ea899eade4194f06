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
package com.chronoql.query.partition;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Splits the time range of a query in at most one partition per available worker.
 * <p>
 * The range is first cut in steps of {@code max(lookback, step)}. When there are more steps than workers every worker receives
 * the same number of whole steps (the last partition is clipped to the end of the range), otherwise every partition is one step
 * long and the spare workers stay idle. Partitions share their boundary instant and together cover the whole range.
 * <p>
 * A partition whose end falls within the recency window of "now" is flagged so that the worker also scans the data that is
 * still in the write-ahead buffer.
 */
public class TimePartitioner {
  private final long         lookbackMicros;
  private final long         recencyWindowMicros;
  private final LongSupplier clockMicros;

  public TimePartitioner(final long lookbackMicros, final long recencyWindowMicros) {
    this(lookbackMicros, recencyWindowMicros, TimePartitioner::currentTimeMicros);
  }

  public TimePartitioner(final long lookbackMicros, final long recencyWindowMicros, final LongSupplier clockMicros) {
    if (lookbackMicros <= 0)
      throw new IllegalArgumentException("Lookback must be greater than zero, found " + lookbackMicros);
    if (recencyWindowMicros < 0)
      throw new IllegalArgumentException("Recency window cannot be negative, found " + recencyWindowMicros);

    this.lookbackMicros = lookbackMicros;
    this.recencyWindowMicros = recencyWindowMicros;
    this.clockMicros = clockMicros;
  }

  /**
   * Partitions {@code [start, end]} for {@code workerCount} workers.
   */
  public List<TimePartition> partition(final long start, final long end, final long step, final int workerCount) {
    return split(new TimeRange(start, end), workerSpan(start, end, step, workerCount), workerCount);
  }

  /**
   * Returns the length of the range assigned to each worker: a whole number of partition steps, large enough for
   * {@code workerCount} partitions to cover {@code [start, end]}.
   */
  public long workerSpan(final long start, final long end, final long step, final int workerCount) {
    if (step <= 0)
      throw new IllegalArgumentException("Step must be greater than zero, found " + step);
    if (workerCount < 1)
      throw new IllegalArgumentException("At least one worker is required, found " + workerCount);

    final long partitionStep = Math.max(lookbackMicros, step);
    final long steps = Math.max(1, ceilDiv(end - start, partitionStep));

    if (steps > workerCount)
      return Math.multiplyExact(partitionStep, ceilDiv(steps, workerCount));
    return partitionStep;
  }

  /**
   * Walks {@code range} in increments of {@code workerSpan}, emitting at most {@code maxPartitions} partitions. The first
   * partition is always emitted, so an empty or inverted range yields one degenerate partition. When the span is too short to
   * reach the end within {@code maxPartitions} partitions, the last one is stretched to the end of the range.
   */
  public List<TimePartition> split(final TimeRange range, final long workerSpan, final int maxPartitions) {
    if (workerSpan <= 0)
      throw new IllegalArgumentException("Worker span must be greater than zero, found " + workerSpan);

    final long walThreshold = clockMicros.getAsLong() - recencyWindowMicros;

    final List<TimePartition> partitions = new ArrayList<>(Math.max(1, Math.min(maxPartitions, 64)));
    long pointer = range.start();
    while (partitions.size() < maxPartitions) {
      if (!partitions.isEmpty() && pointer >= range.end())
        break;

      final long partitionEnd = pointer > range.end() - workerSpan ? range.end() : pointer + workerSpan;
      partitions.add(new TimePartition(partitions.size(), pointer, partitionEnd, partitionEnd >= walThreshold));

      if (pointer > Long.MAX_VALUE - workerSpan)
        break;
      pointer += workerSpan;
    }

    final TimePartition last = partitions.get(partitions.size() - 1);
    if (last.end() < range.end())
      partitions.set(partitions.size() - 1, new TimePartition(last.index(), last.start(), range.end(), range.end() >= walThreshold));

    return partitions;
  }

  public long getLookbackMicros() {
    return lookbackMicros;
  }

  public long getRecencyWindowMicros() {
    return recencyWindowMicros;
  }

  static long ceilDiv(final long dividend, final long divisor) {
    return -Math.floorDiv(-dividend, divisor);
  }

  private static long currentTimeMicros() {
    return TimeUnit.MILLISECONDS.toMicros(System.currentTimeMillis());
  }
}
