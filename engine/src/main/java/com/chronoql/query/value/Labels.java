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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of {@link Label}s kept in canonical order (by name, then value). Two instances are equal when they hold the
 * same labels, whatever the order they were built from.
 */
public final class Labels implements Comparable<Labels> {
  public static final Labels EMPTY = new Labels(List.of());

  private final List<Label> labels;
  private       Signature   signature;

  private Labels(final List<Label> sorted) {
    this.labels = sorted;
  }

  public static Labels of(final Collection<Label> labels) {
    if (labels.isEmpty())
      return EMPTY;

    final List<Label> sorted = new ArrayList<>(labels);
    Collections.sort(sorted);

    // a repeated label is kept once
    for (int i = sorted.size() - 1; i > 0; --i)
      if (sorted.get(i).equals(sorted.get(i - 1)))
        sorted.remove(i);

    return new Labels(Collections.unmodifiableList(sorted));
  }

  public static Labels of(final Map<String, String> labels) {
    final List<Label> list = new ArrayList<>(labels.size());
    for (Map.Entry<String, String> entry : labels.entrySet())
      list.add(new Label(entry.getKey(), entry.getValue()));
    return of(list);
  }

  /**
   * Builds a label set from alternating names and values, e.g. {@code Labels.of("__name__", "up", "job", "api")}.
   */
  public static Labels of(final String... namesAndValues) {
    if (namesAndValues.length % 2 != 0)
      throw new IllegalArgumentException("Labels require name/value pairs, got " + namesAndValues.length + " strings");

    final List<Label> list = new ArrayList<>(namesAndValues.length / 2);
    for (int i = 0; i < namesAndValues.length; i += 2)
      list.add(new Label(namesAndValues[i], namesAndValues[i + 1]));
    return of(list);
  }

  public String get(final String name) {
    for (Label label : labels)
      if (label.name().equals(name))
        return label.value();
    return null;
  }

  public int size() {
    return labels.size();
  }

  public boolean isEmpty() {
    return labels.isEmpty();
  }

  public List<Label> asList() {
    return labels;
  }

  public Map<String, String> asMap() {
    final Map<String, String> map = new LinkedHashMap<>(labels.size());
    for (Label label : labels)
      map.put(label.name(), label.value());
    return map;
  }

  /**
   * Returns the grouping key of this label set. Computed once and cached; a benign race may compute it twice.
   */
  public Signature signature() {
    Signature s = signature;
    if (s == null) {
      s = Signature.of(this);
      signature = s;
    }
    return s;
  }

  @Override
  public int compareTo(final Labels other) {
    final int common = Math.min(labels.size(), other.labels.size());
    for (int i = 0; i < common; i++) {
      final int cmp = labels.get(i).compareTo(other.labels.get(i));
      if (cmp != 0)
        return cmp;
    }
    return Integer.compare(labels.size(), other.labels.size());
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Labels))
      return false;
    return labels.equals(((Labels) o).labels);
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public String toString() {
    final StringBuilder buffer = new StringBuilder("{");
    for (int i = 0; i < labels.size(); i++) {
      if (i > 0)
        buffer.append(", ");
      buffer.append(labels.get(i));
    }
    return buffer.append('}').toString();
  }
}
