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
package com.chronoql.server.cluster;

import com.chronoql.cluster.RoleGroup;
import com.chronoql.cluster.WorkerNode;
import com.chronoql.exception.NoWorkersAvailableException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the workers of a query. The list is deduplicated by address and ordered by node id, so the same healthy fleet always
 * gets the same partition to node mapping and the workers' caches keep hitting.
 */
public class NodeSelector {
  public static final String NO_WORKERS_MESSAGE = "no querier node found";

  private final ClusterMembership membership;
  private final RoleGroup         roleGroup;

  public NodeSelector(final ClusterMembership membership) {
    this(membership, RoleGroup.INTERACTIVE);
  }

  public NodeSelector(final ClusterMembership membership, final RoleGroup roleGroup) {
    this.membership = membership;
    this.roleGroup = roleGroup;
  }

  /**
   * @throws NoWorkersAvailableException if the membership has no healthy worker for the role group
   */
  public List<WorkerNode> select() {
    final List<WorkerNode> healthy = membership.getHealthyWorkers(roleGroup);
    if (healthy == null || healthy.isEmpty())
      throw new NoWorkersAvailableException(NO_WORKERS_MESSAGE);

    final List<WorkerNode> byAddress = new ArrayList<>(healthy);
    byAddress.sort(Comparator.comparing(WorkerNode::address));

    final List<WorkerNode> nodes = new ArrayList<>(byAddress.size());
    for (WorkerNode node : byAddress)
      if (nodes.isEmpty() || !nodes.get(nodes.size() - 1).address().equals(node.address()))
        nodes.add(node);

    // stable: nodes sharing an id keep the address order
    nodes.sort(Comparator.comparingLong(WorkerNode::id));
    return nodes;
  }

  public RoleGroup getRoleGroup() {
    return roleGroup;
  }
}
