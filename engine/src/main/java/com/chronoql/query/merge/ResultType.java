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

/**
 * Shape of a partial result as declared by a worker.
 */
public enum ResultType {
  MATRIX("matrix"), VECTOR("vector"), SCALAR("scalar");

  private final String tag;

  ResultType(final String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  /**
   * Parses the tag sent on the wire. An empty tag means the worker had nothing to report and returns null.
   *
   * @throws InvalidResultShapeException if the tag is not one of matrix, vector or scalar
   */
  public static ResultType fromTag(final String tag) {
    if (tag == null || tag.isEmpty())
      return null;

    for (ResultType t : values())
      if (t.tag.equals(tag))
        return t;

    throw new InvalidResultShapeException("invalid result type: " + tag);
  }
}
