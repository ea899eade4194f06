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
package com.chronoql.query.value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Result of a range query: a set of series over time, a set of series at one instant or one single value.
 */
public sealed interface QueryValue {

  /**
   * Series over time, in canonical label order.
   */
  record Matrix(List<RangeValue> series) implements QueryValue {
    public Matrix {
      final List<RangeValue> sorted = new ArrayList<>(series);
      sorted.sort(Comparator.comparing(RangeValue::labels));
      series = List.copyOf(sorted);
    }
  }

  /**
   * Series at one instant, in canonical label order.
   */
  record Vector(List<InstantValue> samples) implements QueryValue {
    public Vector {
      final List<InstantValue> sorted = new ArrayList<>(samples);
      sorted.sort(Comparator.comparing(InstantValue::labels));
      samples = List.copyOf(sorted);
    }
  }

  record Scalar(Sample sample) implements QueryValue {
    public Scalar {
      Objects.requireNonNull(sample, "sample");
    }
  }
}
