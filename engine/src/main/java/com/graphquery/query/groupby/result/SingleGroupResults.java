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
package com.graphquery.query.groupby.result;

import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.groupby.aggregate.AggregateBucket;
import com.graphquery.query.result.ResultTable;

import java.util.List;

/**
 * The only group of a query without grouping keys. It exists even when the table is empty: then it has no representative row.
 */
public class SingleGroupResults extends AbstractGroupResults {
  private final AggregateBucket[] buckets;

  public SingleGroupResults(final ResultTable table, final List<Aggregate> aggregates, final AggregateBucket[] buckets) {
    super(table, aggregates);
    this.buckets = buckets;
  }

  @Override
  protected int countGroups() {
    return 1;
  }

  @Override
  protected void collect(final List<GroupResult> target) {
    final Object[] values = newValues();
    for (int i = 0; i < values.length; i++)
      values[i] = aggregates.get(i).getFinal(buckets[i]);
    target.add(new GroupResult(table.getRowCount() > 0 ? table.getRow(0) : null, values));
  }
}
