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
package com.graphquery.query.groupby;

import com.graphquery.ContextConfiguration;
import com.graphquery.query.expression.Expression;
import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.groupby.grouper.Grouper;
import com.graphquery.query.groupby.grouper.GrouperFactory;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.result.ResultTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Grouping and aggregation stage of a query. Receives from the query analysis the aggregates of the projection and the grouping-key
 * expressions, and from the matcher the table of matched rows.
 * <p>
 * The configuration (thread count, strategy, storage) is validated here, so an invalid setting fails when the query is prepared.
 * Every {@link #execute(ResultTable)} runs a fresh {@link Grouper}.
 * <p>
 * Example:
 * <pre>{@code
 * final ContextConfiguration cfg = new ContextConfiguration();
 * cfg.setValue(GlobalConfiguration.GROUP_BY_THREADS, 4);
 *
 * final GroupBy groupBy = new GroupBy(List.of(Aggregate.create("sum", value)), List.of(key), cfg);
 * for (final GroupResult group : groupBy.execute(table))
 *   System.out.println(group.getRepresentative() + " " + group.getValue(0));
 * }</pre>
 */
public class GroupBy {
  private final List<Aggregate>      aggregates;
  private final List<Expression>     keys;
  private final ContextConfiguration configuration;

  public GroupBy(final List<Aggregate> aggregates, final List<Expression> keys) {
    this(aggregates, keys, new ContextConfiguration());
  }

  public GroupBy(final List<Aggregate> aggregates, final List<Expression> keys, final ContextConfiguration configuration) {
    this.aggregates = Collections.unmodifiableList(new ArrayList<>(aggregates));
    this.keys = keys != null ? Collections.unmodifiableList(new ArrayList<>(keys)) : Collections.emptyList();
    this.configuration = new ContextConfiguration(configuration);

    // FAIL FAST ON INVALID SETTINGS
    GrouperFactory.create(this.aggregates, this.keys, this.configuration);
  }

  public GroupResults execute(final ResultTable table) {
    final Grouper grouper = GrouperFactory.create(aggregates, keys, configuration);
    return grouper.group(table);
  }

  public List<Aggregate> getAggregates() {
    return aggregates;
  }

  public List<Expression> getKeys() {
    return keys;
  }

  public boolean isGrouped() {
    return !keys.isEmpty();
  }
}
