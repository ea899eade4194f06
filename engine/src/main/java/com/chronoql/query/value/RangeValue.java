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

import java.util.List;
import java.util.Objects;

/**
 * A series over time. Samples are sorted by ascending timestamp, with no duplicated timestamp.
 */
public record RangeValue(Labels labels, List<Sample> samples) {
  public RangeValue {
    Objects.requireNonNull(labels, "labels");
    samples = List.copyOf(samples);
    for (int i = 1; i < samples.size(); i++)
      if (samples.get(i).timestamp() <= samples.get(i - 1).timestamp())
        throw new IllegalArgumentException(
            "Samples of " + labels + " must have strictly increasing timestamps, found " + samples.get(i - 1).timestamp() + " then "
                + samples.get(i).timestamp());
  }
}
