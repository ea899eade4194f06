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

/**
 * Closed time interval in microseconds.
 */
public record TimeRange(long start, long end) {

  /**
   * Widens the range to the step grid: start moves down and end moves up to the closest multiple of {@code step}. Workers
   * cache results per aligned step, so two queries over slightly different ranges share cached points.
   */
  public TimeRange alignTo(final long step) {
    if (step <= 0)
      throw new IllegalArgumentException("Step must be greater than zero, found " + step);

    final long alignedStart = Math.floorDiv(start, step) * step;
    final long alignedEnd = -Math.floorDiv(-end, step) * step;
    return new TimeRange(alignedStart, alignedEnd);
  }

  public long length() {
    return end - start;
  }
}
