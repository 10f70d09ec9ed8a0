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
package com.graphquery;

import com.graphquery.query.groupby.AggregateStorage;
import com.graphquery.query.groupby.GroupingStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

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
    assertThat(config.getContextSize()).isZero();
    assertThat(config.getValueAsInteger(GlobalConfiguration.GROUP_BY_THREADS)).isEqualTo(1);

    GlobalConfiguration.GROUP_BY_THREADS.setValue(5);
    assertThat(config.getValueAsInteger(GlobalConfiguration.GROUP_BY_THREADS)).isEqualTo(5);
  }

  @Test
  void overridesWinOverGlobals() {
    GlobalConfiguration.GROUP_BY_THREADS.setValue(5);
    config.setValue(GlobalConfiguration.GROUP_BY_THREADS, "2");

    assertThat(config.hasValue(GlobalConfiguration.GROUP_BY_THREADS)).isTrue();
    assertThat(config.getValueAsInteger(GlobalConfiguration.GROUP_BY_THREADS)).isEqualTo(2);
    assertThat(GlobalConfiguration.GROUP_BY_THREADS.getValueAsInteger()).isEqualTo(5);
  }

  @Test
  void setValueWithNullRemovesOverride() {
    config.setValue(GlobalConfiguration.GROUP_BY_STORAGE, AggregateStorage.LISTS);
    config.setValue(GlobalConfiguration.GROUP_BY_STORAGE, null);

    assertThat(config.hasValue(GlobalConfiguration.GROUP_BY_STORAGE)).isFalse();
    assertThat(config.getValue(GlobalConfiguration.GROUP_BY_STORAGE)).isEqualTo(GlobalConfiguration.GROUP_BY_STORAGE.getDefValue());
  }

  @Test
  void enumValuesAreParsedCaseInsensitive() {
    config.setValue(GlobalConfiguration.GROUP_BY_STRATEGY, "Global");
    assertThat(config.getValueAsEnum(GlobalConfiguration.GROUP_BY_STRATEGY, GroupingStrategy.class)).isEqualTo(GroupingStrategy.GLOBAL);

    assertThatThrownBy(() -> config.setValue(GlobalConfiguration.GROUP_BY_STRATEGY, "random")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void copyConstructorCopiesOverrides() {
    config.setValue(GlobalConfiguration.GROUP_BY_THREADS, 8);

    final ContextConfiguration copy = new ContextConfiguration(config);
    config.setValue(GlobalConfiguration.GROUP_BY_THREADS, 2);

    assertThat(copy.getValueAsInteger(GlobalConfiguration.GROUP_BY_THREADS)).isEqualTo(8);
    assertThat(new ContextConfiguration((ContextConfiguration) null).getContextSize()).isZero();
  }

  @Test
  void constructorWithMap() {
    final ContextConfiguration fromMap = new ContextConfiguration(Map.of(GlobalConfiguration.GROUP_BY_LOG_TIMINGS.getKey(), true));
    assertThat(fromMap.getValueAsBoolean(GlobalConfiguration.GROUP_BY_LOG_TIMINGS)).isTrue();
  }

  @Test
  void jsonExportAndImport() {
    config.setValue(GlobalConfiguration.GROUP_BY_THREADS, 3);
    config.setValue(GlobalConfiguration.GROUP_BY_STORAGE, AggregateStorage.ARRAYS);

    final ContextConfiguration imported = new ContextConfiguration();
    imported.fromJSON(config.toJSON());

    assertThat(imported.getValueAsInteger(GlobalConfiguration.GROUP_BY_THREADS)).isEqualTo(3);
    assertThat(imported.getValueAsEnum(GlobalConfiguration.GROUP_BY_STORAGE, AggregateStorage.class)).isEqualTo(AggregateStorage.ARRAYS);
    assertThat(imported.getContextSize()).isEqualTo(2);
  }
}
