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
import com.graphquery.query.groupby.key.ConcurrentGroupDictionary;
import com.graphquery.query.groupby.key.GroupKey;
import com.graphquery.query.groupby.result.BucketGroupResults;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.result.Row;
import org.eclipse.collections.api.block.function.Function0;
import org.eclipse.collections.impl.map.strategy.mutable.UnifiedMapWithHashingStrategy;

/**
 * Job keeping one bucket per group and aggregate.
 */
final class BucketGroupJob extends GroupJob<BucketGroupJob> {
  private final UnifiedMapWithHashingStrategy<GroupKey, AggregateBucket[]> groups;
  private final Function0<AggregateBucket[]>                               bucketFactory;

  BucketGroupJob(final GroupContext context, final int start, final int end) {
    super(context, start, end);
    this.groups = new UnifiedMapWithHashingStrategy<>(comparer);
    this.bucketFactory = context::newBuckets;
  }

  @Override
  void scan() {
    for (int i = start; i < end; i++) {
      final GroupKey key = hasher.keyOf(i);
      final AggregateBucket[] buckets = groups.getIfAbsentPut(key, bucketFactory);

      final Row row = table.getRow(i);
      for (int a = 0; a < aggregates.length; a++)
        aggregates[a].apply(row, buckets[a]);
    }
  }

  @Override
  void mergeFrom(final BucketGroupJob other) {
    other.groups.forEachKeyValue((key, theirs) -> {
      final AggregateBucket[] mine = groups.get(key);
      if (mine == null)
        // OWNERSHIP OF THE BUCKETS MOVES TO THIS JOB
        groups.put(key, theirs);
      else
        for (int a = 0; a < aggregates.length; a++)
          aggregates[a].merge(mine[a], theirs[a]);
    });
  }

  @Override
  void mergeInto(final ConcurrentGroupDictionary<AggregateBucket[]> global) {
    groups.forEachKeyValue((key, mine) -> {
      final AggregateBucket[] target = global.getOrAdd(key, mine);
      if (target != mine) {
        checkGroup(key, target);
        for (int a = 0; a < aggregates.length; a++)
          aggregates[a].mergeThreadSafe(target[a], mine[a]);
      }
    });
  }

  @Override
  int size() {
    return groups.size();
  }

  @Override
  GroupResults toResults() {
    return new BucketGroupResults(table, context.getAggregateList(), consumer -> groups.forEachKeyValue(consumer::accept), groups.size());
  }
}
