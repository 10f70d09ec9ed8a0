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

import com.graphquery.query.expression.Expression;
import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.groupby.aggregate.AggregateBucket;
import com.graphquery.query.groupby.key.RowKeyEvaluator;
import com.graphquery.query.result.ResultTable;

import java.util.List;

/**
 * Immutable definitions shared by all the jobs of one grouping run.
 */
final class GroupContext {
  private final ResultTable     table;
  private final List<Aggregate> aggregateList;
  private final Aggregate[]     aggregates;
  private final RowKeyEvaluator template;

  GroupContext(final ResultTable table, final List<Aggregate> aggregates, final List<Expression> keys) {
    this.table = table;
    this.aggregateList = aggregates;
    this.aggregates = aggregates.toArray(new Aggregate[0]);
    this.template = new RowKeyEvaluator(table, keys, false);
  }

  ResultTable getTable() {
    return table;
  }

  List<Aggregate> getAggregateList() {
    return aggregateList;
  }

  Aggregate[] getAggregates() {
    return aggregates;
  }

  /**
   * Non caching evaluator every job and shared dictionary copies its own from.
   */
  RowKeyEvaluator getTemplate() {
    return template;
  }

  AggregateBucket[] newBuckets() {
    final AggregateBucket[] buckets = new AggregateBucket[aggregates.length];
    for (int i = 0; i < buckets.length; i++)
      buckets[i] = aggregates[i].createBucket();
    return buckets;
  }
}
