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

import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * 64-bit identity of a label set, computed with xxHash64 over the canonical encoding of the labels: every name and value in
 * canonical order, each followed by a {@code 0xFF} separator byte. {@code 0xFF} never occurs in UTF-8, so distinct label sets
 * never share an encoding. Hash collisions between distinct label sets are not handled.
 */
public record Signature(long value) {
  private static final XXHash64 HASH      = XXHashFactory.fastestInstance().hash64();
  private static final long     SEED      = 0L;
  private static final int      SEPARATOR = 0xFF;

  public static Signature of(final Labels labels) {
    final ByteArrayOutputStream encoded = new ByteArrayOutputStream(64);
    for (Label label : labels.asList()) {
      encoded.writeBytes(label.name().getBytes(StandardCharsets.UTF_8));
      encoded.write(SEPARATOR);
      encoded.writeBytes(label.value().getBytes(StandardCharsets.UTF_8));
      encoded.write(SEPARATOR);
    }
    final byte[] buffer = encoded.toByteArray();
    return new Signature(HASH.hash(buffer, 0, buffer.length, SEED));
  }

  @Override
  public String toString() {
    return String.format("%016x", value);
  }
}
