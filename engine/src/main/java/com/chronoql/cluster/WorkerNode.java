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
package com.chronoql.cluster;

import java.util.Objects;

/**
 * An addressable worker. {@code id} is stable across restarts and drives the partition to node mapping, {@code address} is the
 * {@code host:port} of its gRPC endpoint and {@code name} is informational.
 */
public record WorkerNode(long id, String name, String address, RoleGroup roleGroup) {
  public WorkerNode {
    Objects.requireNonNull(address, "address");
    name = name != null ? name : address;
    roleGroup = roleGroup != null ? roleGroup : RoleGroup.INTERACTIVE;
  }

  public WorkerNode(final long id, final String address) {
    this(id, null, address, RoleGroup.INTERACTIVE);
  }

  @Override
  public String toString() {
    return "{" + name + "}" + address + "#" + id;
  }
}
