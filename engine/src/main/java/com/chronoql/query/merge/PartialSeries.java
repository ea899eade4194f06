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

import com.chronoql.query.value.Labels;
import com.chronoql.query.value.Sample;

import java.util.List;
import java.util.Objects;

/**
 * One series as returned by a worker. Depending on the result type it carries the samples of a range ({@code samples}), the
 * sample of an instant ({@code sample}) or a bare scalar value ({@code scalar}); the fields that do not apply are null or empty.
 */
public record PartialSeries(Labels labels, Sample sample, List<Sample> samples, Double scalar) {
  public PartialSeries {
    Objects.requireNonNull(labels, "labels");
    samples = samples != null ? List.copyOf(samples) : List.of();
  }

  public static PartialSeries range(final Labels labels, final List<Sample> samples) {
    return new PartialSeries(labels, null, samples, null);
  }

  public static PartialSeries instant(final Labels labels, final Sample sample) {
    return new PartialSeries(labels, sample, null, null);
  }

  public static PartialSeries scalar(final double value) {
    return new PartialSeries(Labels.EMPTY, null, null, value);
  }
}
