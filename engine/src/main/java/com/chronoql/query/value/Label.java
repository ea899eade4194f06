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

import java.util.Objects;

/**
 * One dimension of a time series. Labels order by name first, then by value.
 */
public record Label(String name, String value) implements Comparable<Label> {
  public Label {
    Objects.requireNonNull(name, "label name");
    Objects.requireNonNull(value, "label value");
  }

  @Override
  public int compareTo(final Label other) {
    final int cmp = name.compareTo(other.name);
    return cmp != 0 ? cmp : value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return name + "=\"" + value + "\"";
  }
}
