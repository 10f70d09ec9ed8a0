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

import com.graphquery.query.groupby.aggregate.AggregateBucket;
import com.graphquery.query.groupby.aggregate.AggregateList;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.groupby.result.ListGroupResults;
import com.graphquery.query.result.Row;

/**
 * Job keeping the aggregate state in growable lists, one per aggregate.
 */
final class ListGroupJob extends OrdinalGroupJob<ListGroupJob> {
  private final AggregateList[] lists;

  ListGroupJob(final GroupContext context, final int start, final int end) {
    super(context, start, end);
    this.lists = new AggregateList[aggregates.length];
    for (int a = 0; a < aggregates.length; a++)
      lists[a] = aggregates[a].createList();
  }

  @Override
  protected void apply(final Row row, final int position) {
    for (int a = 0; a < aggregates.length; a++)
      aggregates[a].apply(row, lists[a], position);
  }

  @Override
  protected void merge(final int intoPosition, final ListGroupJob from, final int fromPosition) {
    for (int a = 0; a < aggregates.length; a++)
      aggregates[a].merge(lists[a], intoPosition, from.lists[a], fromPosition);
  }

  @Override
  protected void mergeThreadSafe(final AggregateBucket[] into, final int fromPosition) {
    for (int a = 0; a < aggregates.length; a++)
      aggregates[a].mergeThreadSafe(into[a], lists[a], fromPosition);
  }

  @Override
  GroupResults toResults() {
    return new ListGroupResults(table, context.getAggregateList(), ordinals(), lists, groups.size());
  }
}
