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

import com.graphquery.query.groupby.aggregate.AggregateArray;
import com.graphquery.query.groupby.aggregate.AggregateBucket;
import com.graphquery.query.groupby.result.ArrayGroupResults;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.result.Row;

/**
 * Job keeping the aggregate state in arrays sized to its row range, which bounds the number of groups it can discover. The arrays
 * grow only when groups of other jobs are merged in.
 */
final class ArrayGroupJob extends OrdinalGroupJob<ArrayGroupJob> {
  private final AggregateArray[] arrays;

  ArrayGroupJob(final GroupContext context, final int start, final int end) {
    super(context, start, end);
    this.arrays = new AggregateArray[aggregates.length];
    for (int a = 0; a < aggregates.length; a++)
      arrays[a] = aggregates[a].createArray(end - start);
  }

  @Override
  protected void apply(final Row row, final int position) {
    for (int a = 0; a < aggregates.length; a++)
      aggregates[a].apply(row, arrays[a], position);
  }

  @Override
  protected void merge(final int intoPosition, final ArrayGroupJob from, final int fromPosition) {
    for (int a = 0; a < aggregates.length; a++) {
      arrays[a].ensureCapacity(intoPosition + 1);
      aggregates[a].merge(arrays[a], intoPosition, from.arrays[a], fromPosition);
    }
  }

  @Override
  protected void mergeThreadSafe(final AggregateBucket[] into, final int fromPosition) {
    for (int a = 0; a < aggregates.length; a++)
      aggregates[a].mergeThreadSafe(into[a], arrays[a], fromPosition);
  }

  @Override
  GroupResults toResults() {
    return new ArrayGroupResults(table, context.getAggregateList(), ordinals(), arrays, groups.size());
  }
}
