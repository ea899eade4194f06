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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimePartitionerTest {
  private static final long SECOND = 1_000_000L;
  private static final long MINUTE = 60 * SECOND;
  private static final long HOUR   = 60 * MINUTE;

  // clock far ahead of every range, no partition needs the write-ahead buffer
  private static final long NOW = Long.MAX_VALUE / 2;

  private final TimePartitioner partitioner = new TimePartitioner(MINUTE, 1800 * SECOND, () -> NOW);

  @Test
  void oneHourOnFourWorkers() {
    final List<TimePartition> partitions = partitioner.partition(0, HOUR, MINUTE, 4);

    assertThat(partitions).hasSize(4);
    assertThat(partitions.get(0).start()).isZero();
    assertThat(partitions.get(3).end()).isEqualTo(HOUR);
    assertThat(partitions.stream().mapToLong(p -> p.end() - p.start()).sum()).isEqualTo(3_600_000_000L);
    assertThat(partitions).extracting(TimePartition::index).containsExactly(0, 1, 2, 3);
  }

  @Test
  void partitionsAreContiguousAndCoverTheRange() {
    final long[][] cases = { { 0, HOUR, MINUTE, 4 }, { 17, 3 * HOUR + 11, 15 * SECOND, 7 }, { 5 * MINUTE, 6 * MINUTE, SECOND, 3 },
        { 0, 24 * HOUR, 5 * MINUTE, 1 }, { 1000, 1000 + 59 * MINUTE, 2 * MINUTE, 64 }, { 0, 10 * MINUTE, 10 * MINUTE, 2 } };

    for (long[] c : cases) {
      final long start = c[0], end = c[1], step = c[2];
      final int workers = (int) c[3];

      final List<TimePartition> partitions = partitioner.partition(start, end, step, workers);

      assertThat(partitions).as("case %d..%d", start, end).isNotEmpty().hasSizeLessThanOrEqualTo(workers);
      assertThat(partitions.get(0).start()).isEqualTo(start);
      assertThat(partitions.get(partitions.size() - 1).end()).isEqualTo(end);
      for (int i = 1; i < partitions.size(); i++)
        assertThat(partitions.get(i).start()).isEqualTo(partitions.get(i - 1).end());
      for (TimePartition p : partitions)
        assertThat(p.end()).isGreaterThan(p.start());
    }
  }

  @Test
  void shortRangeUsesFewerPartitionsThanWorkers() {
    final List<TimePartition> partitions = partitioner.partition(0, 90 * SECOND, 15 * SECOND, 8);

    assertThat(partitions).hasSize(2);
    assertThat(partitions.get(0).end()).isEqualTo(MINUTE);
    assertThat(partitions.get(1).end()).isEqualTo(90 * SECOND);
  }

  @Test
  void stepLargerThanLookbackDrivesThePartitionStep() {
    assertThat(partitioner.workerSpan(0, HOUR, 10 * MINUTE, 2)).isEqualTo(30 * MINUTE);
    assertThat(partitioner.workerSpan(0, HOUR, 10 * MINUTE, 6)).isEqualTo(10 * MINUTE);
    assertThat(partitioner.workerSpan(0, HOUR, SECOND, 6)).isEqualTo(10 * MINUTE);
  }

  @Test
  void rangeEndingOnAStepBoundaryHasNoEmptyTail() {
    final List<TimePartition> partitions = partitioner.partition(0, 2 * MINUTE, MINUTE, 4);

    assertThat(partitions).hasSize(2);
    assertThat(partitions.get(1).end()).isEqualTo(2 * MINUTE);
  }

  @Test
  void emptyOrInvertedRangeYieldsOneDegeneratePartition() {
    assertThat(partitioner.partition(HOUR, HOUR, MINUTE, 4)).containsExactly(new TimePartition(0, HOUR, HOUR, false));
    assertThat(partitioner.partition(HOUR, HOUR - 1, MINUTE, 4)).containsExactly(new TimePartition(0, HOUR, HOUR - 1, false));
  }

  @Test
  void spanTooShortForTheWorkersStretchesTheLastPartition() {
    final TimeRange aligned = new TimeRange(0, 3660 * SECOND);

    final List<TimePartition> partitions = partitioner.split(aligned, 900 * SECOND, 4);

    assertThat(partitions).hasSize(4);
    assertThat(partitions.get(2).end()).isEqualTo(2700 * SECOND);
    assertThat(partitions.get(3)).isEqualTo(new TimePartition(3, 2700 * SECOND, 3660 * SECOND, false));
  }

  @Test
  void unalignedStartStillCoversTheAlignedEnd() {
    final TimeRange aligned = new TimeRange(30 * SECOND, 3630 * SECOND).alignTo(MINUTE);

    final long span = partitioner.workerSpan(aligned.start(), aligned.end(), MINUTE, 4);
    final List<TimePartition> partitions = partitioner.split(aligned, span, 4);

    assertThat(aligned).isEqualTo(new TimeRange(0, 3660 * SECOND));
    assertThat(partitions.get(0).start()).isZero();
    assertThat(partitions.get(partitions.size() - 1).end()).isEqualTo(3660 * SECOND);
    for (int i = 1; i < partitions.size(); i++)
      assertThat(partitions.get(i).start()).isEqualTo(partitions.get(i - 1).end());
  }

  @Test
  void recentPartitionsNeedTheWriteAheadBuffer() {
    final long now = 10 * HOUR;
    final TimePartitioner recent = new TimePartitioner(MINUTE, 1800 * SECOND, () -> now);

    final List<TimePartition> partitions = recent.partition(8 * HOUR, now, MINUTE, 4);

    assertThat(partitions).extracting(TimePartition::needWal).containsExactly(false, false, true, true);
    assertThat(partitions.get(2).end()).isEqualTo(now - 1800 * SECOND);
  }

  @Test
  void invalidArgumentsAreRejected() {
    assertThatThrownBy(() -> partitioner.partition(0, HOUR, 0, 4)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> partitioner.partition(0, HOUR, -MINUTE, 4)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> partitioner.partition(0, HOUR, MINUTE, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TimePartitioner(0, 0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void alignToStep() {
    assertThat(new TimeRange(61 * SECOND, 119 * SECOND).alignTo(MINUTE)).isEqualTo(new TimeRange(MINUTE, 2 * MINUTE));
    assertThat(new TimeRange(MINUTE, 2 * MINUTE).alignTo(MINUTE)).isEqualTo(new TimeRange(MINUTE, 2 * MINUTE));
    assertThat(new TimeRange(-1, 1).alignTo(10)).isEqualTo(new TimeRange(-10, 10));
  }
}
