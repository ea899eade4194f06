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

import com.chronoql.ContextConfiguration;
import com.chronoql.GlobalConfiguration;
import com.chronoql.cluster.RoleGroup;
import com.chronoql.cluster.WorkerNode;
import com.chronoql.exception.ConfigurationException;
import com.chronoql.log.LogManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;

/**
 * Fixed list of workers, all considered healthy. Entries are separated by comma and have the form
 * {@code <id>@[{alias}]<host>[:<port>][/<role-group>]}, for example {@code 1@{querier-1}10.0.0.1:5081/interactive}. The port
 * defaults to {@value HostUtil#WORKER_DEFAULT_PORT} and the role group to interactive.
 */
public class StaticClusterMembership implements ClusterMembership {
  private final List<WorkerNode> workers;

  public StaticClusterMembership(final String workerList) {
    this.workers = Collections.unmodifiableList(parseWorkerList(workerList));
  }

  public static StaticClusterMembership fromConfiguration(final ContextConfiguration configuration) {
    return new StaticClusterMembership(configuration.getValueAsString(GlobalConfiguration.CLUSTER_WORKERS));
  }

  @Override
  public List<WorkerNode> getHealthyWorkers(final RoleGroup roleGroup) {
    final List<WorkerNode> result = new ArrayList<>(workers.size());
    for (WorkerNode worker : workers)
      if (roleGroup == null || worker.roleGroup() == roleGroup)
        result.add(worker);
    return result;
  }

  public List<WorkerNode> getWorkers() {
    return workers;
  }

  static List<WorkerNode> parseWorkerList(final String workerList) {
    final List<WorkerNode> workers = new ArrayList<>();
    if (workerList == null || workerList.isBlank())
      return workers;

    for (String entry : workerList.split(",")) {
      entry = entry.trim();
      if (entry.isEmpty())
        continue;

      try {
        workers.add(parseEntry(entry));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Invalid worker entry '" + entry + "' in " + GlobalConfiguration.CLUSTER_WORKERS.getKey(), e);
      }
    }

    LogManager.instance().log(StaticClusterMembership.class, Level.FINE, "Configured workers: %s", workers);
    return workers;
  }

  private static WorkerNode parseEntry(final String entry) {
    final int at = entry.indexOf('@');
    if (at < 1)
      throw new IllegalArgumentException("Missing worker id");

    final long id = Long.parseLong(entry.substring(0, at).trim());

    String address = entry.substring(at + 1);
    RoleGroup roleGroup = RoleGroup.INTERACTIVE;
    final int slash = address.lastIndexOf('/');
    if (slash > -1) {
      roleGroup = RoleGroup.fromString(address.substring(slash + 1));
      address = address.substring(0, slash);
    }

    final String[] parts = HostUtil.parseHostAddress(address, HostUtil.WORKER_DEFAULT_PORT);
    final int port = Integer.parseInt(parts[1]);
    if (port < 1 || port > 65535)
      throw new IllegalArgumentException("Invalid port " + port);

    return new WorkerNode(id, parts[2], parts[0] + ":" + port, roleGroup);
  }
}
