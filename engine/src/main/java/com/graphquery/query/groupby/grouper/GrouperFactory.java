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
package com.graphquery.query.groupby.grouper;

import com.graphquery.ContextConfiguration;
import com.graphquery.GlobalConfiguration;
import com.graphquery.exception.ConfigurationException;
import com.graphquery.query.expression.Expression;
import com.graphquery.query.groupby.GroupingStrategy;
import com.graphquery.query.groupby.aggregate.Aggregate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the {@link Grouper} of a query. Strategies are registered explicitly, each with the constructor of its grouper. Queries
 * without grouping keys always use the {@link SingleGroupGrouper}.
 */
public final class GrouperFactory {
  @FunctionalInterface
  public interface GrouperConstructor {
    Grouper create(List<Aggregate> aggregates, List<Expression> keys, ContextConfiguration configuration);
  }

  private static final Map<GroupingStrategy, GrouperConstructor> REGISTRY;

  static {
    final Map<GroupingStrategy, GrouperConstructor> registry = new EnumMap<>(GroupingStrategy.class);
    registry.put(GroupingStrategy.LOCAL_MERGE, LocalGroupLocalMerge::new);
    registry.put(GroupingStrategy.GLOBAL_MERGE, LocalGroupGlobalMerge::new);
    registry.put(GroupingStrategy.GLOBAL, GlobalGroup::new);
    REGISTRY = Collections.unmodifiableMap(registry);
  }

  private GrouperFactory() {
  }

  /**
   * Builds a new single-use grouper, validating the configuration.
   *
   * @throws ConfigurationException if the configuration cannot be executed
   */
  public static Grouper create(final List<Aggregate> aggregates, final List<Expression> keys, final ContextConfiguration configuration) {
    if (keys == null || keys.isEmpty())
      return new SingleGroupGrouper(aggregates, configuration);

    final GroupingStrategy strategy;
    try {
      strategy = configuration.getValueAsEnum(GlobalConfiguration.GROUP_BY_STRATEGY, GroupingStrategy.class);
    } catch (final IllegalArgumentException | ClassCastException e) {
      throw new ConfigurationException("Invalid grouping strategy", e);
    }

    final GrouperConstructor constructor = strategy != null ? REGISTRY.get(strategy) : null;
    if (constructor == null)
      throw new ConfigurationException("Grouping strategy " + strategy + " is not supported");

    return constructor.create(aggregates, keys, configuration);
  }
}
