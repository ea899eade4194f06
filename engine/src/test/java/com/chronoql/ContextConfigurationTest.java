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
package com.chronoql;

import com.chronoql.exception.ConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextConfigurationTest {

  private ContextConfiguration config;

  @BeforeEach
  void setUp() {
    config = new ContextConfiguration();
  }

  @AfterEach
  void tearDown() {
    GlobalConfiguration.resetAll();
  }

  @Test
  void emptyConfigurationFallsBackToGlobals() {
    assertThat(config.isOverridden(GlobalConfiguration.QUERY_TIMEOUT)).isFalse();
    assertThat(config.getValueAsLong(GlobalConfiguration.QUERY_TIMEOUT)).isEqualTo(600L);

    GlobalConfiguration.QUERY_TIMEOUT.setValue(45);
    assertThat(config.getValueAsLong(GlobalConfiguration.QUERY_TIMEOUT)).isEqualTo(45L);
  }

  @Test
  void contextValueOverridesGlobal() {
    config.setValue(GlobalConfiguration.QUERY_TIMEOUT, 5);

    assertThat(config.getValueAsLong(GlobalConfiguration.QUERY_TIMEOUT)).isEqualTo(5L);
    assertThat(GlobalConfiguration.QUERY_TIMEOUT.getValueAsLong()).isEqualTo(600L);
  }

  @Test
  void stringValuesAreConverted() {
    config.setValue(GlobalConfiguration.QUERY_RESULT_CACHE_ENABLED, "false");
    config.setValue(GlobalConfiguration.GRPC_MAX_MESSAGE_SIZE, " 32 ");
    config.setValue(GlobalConfiguration.QUERY_MAX_POINTS_PER_SERIES, "1000");
    config.setValue(GlobalConfiguration.CLUSTER_WORKERS, 7);

    assertThat(config.getValueAsBoolean(GlobalConfiguration.QUERY_RESULT_CACHE_ENABLED)).isFalse();
    assertThat(config.getValueAsInteger(GlobalConfiguration.GRPC_MAX_MESSAGE_SIZE)).isEqualTo(32);
    assertThat(config.getValueAsLong(GlobalConfiguration.QUERY_MAX_POINTS_PER_SERIES)).isEqualTo(1000L);
    assertThat(config.getValueAsString(GlobalConfiguration.CLUSTER_WORKERS)).isEqualTo("7");
  }

  @Test
  void unparsableNumberNamesTheSetting() {
    config.setValue(GlobalConfiguration.QUERY_TIMEOUT, "ten minutes");

    assertThatThrownBy(() -> config.getValueAsLong(GlobalConfiguration.QUERY_TIMEOUT))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining(GlobalConfiguration.QUERY_TIMEOUT.getKey());
  }

  @Test
  void nullValueRestoresTheGlobal() {
    assertThat(config.setValue(GlobalConfiguration.QUERY_TIMEOUT, 5)).isNull();
    assertThat(config.setValue(GlobalConfiguration.QUERY_TIMEOUT, null)).isEqualTo(5);

    assertThat(config.isOverridden(GlobalConfiguration.QUERY_TIMEOUT)).isFalse();
    assertThat(config.getValueAsLong(GlobalConfiguration.QUERY_TIMEOUT)).isEqualTo(600L);
  }

  @Test
  void mapConstructorSkipsNullValues() {
    final Map<GlobalConfiguration, Object> values = new HashMap<>();
    values.put(GlobalConfiguration.QUERY_DEFAULT_LOOKBACK_SECS, 60L);
    values.put(GlobalConfiguration.GRPC_ORG_HEADER_KEY, null);

    final ContextConfiguration fromMap = new ContextConfiguration(values);

    assertThat(fromMap.getValueAsLong(GlobalConfiguration.QUERY_DEFAULT_LOOKBACK_SECS)).isEqualTo(60L);
    assertThat(fromMap.isOverridden(GlobalConfiguration.GRPC_ORG_HEADER_KEY)).isFalse();
  }
}
