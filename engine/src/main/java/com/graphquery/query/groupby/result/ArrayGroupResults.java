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
import com.graphquery.query.groupby.aggregate.AggregateArray;
import com.graphquery.query.result.ResultTable;

import java.util.List;

/**
 * Groups whose aggregate state lives in arrays indexed by group ordinal.
 */
public class ArrayGroupResults extends AbstractGroupResults {
  private final GroupSource<Integer> source;
  private final AggregateArray[]     arrays;
  private final int                  groupCount;

  public ArrayGroupResults(final ResultTable table, final List<Aggregate> aggregates, final GroupSource<Integer> source,
      final AggregateArray[] arrays, final int groupCount) {
    super(table, aggregates);
    this.source = source;
    this.arrays = arrays;
    this.groupCount = groupCount;
  }

  @Override
  protected int countGroups() {
    return groupCount;
  }

  @Override
  protected void collect(final List<GroupResult> target) {
    source.forEachGroup((key, position) -> {
      final Object[] values = newValues();
      for (int i = 0; i < values.length; i++)
        values[i] = aggregates.get(i).getFinal(arrays[i], position);
      target.add(new GroupResult(table.getRow(key.getRow()), values));
    });
  }
}
