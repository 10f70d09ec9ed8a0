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
import com.graphquery.query.groupby.result.GroupSource;
import com.graphquery.query.result.Row;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectIntHashMapWithHashingStrategy;

/**
 * Job mapping every group to its ordinal, the order in which the job discovered it. The aggregate state lives in storages indexed by
 * ordinal. Ordinals are private to the job: merging remaps the ordinals of the donor into the ordinal space of the receiver.
 */
abstract class OrdinalGroupJob<J extends OrdinalGroupJob<J>> extends GroupJob<J> {
  protected final ObjectIntHashMapWithHashingStrategy<GroupKey> groups;
  private         AggregateBucket[]                              spare;

  protected OrdinalGroupJob(final GroupContext context, final int start, final int end) {
    super(context, start, end);
    this.groups = new ObjectIntHashMapWithHashingStrategy<>(comparer);
  }

  protected abstract void apply(Row row, int position);

  /**
   * Folds the state of {@code from} at {@code fromPosition} into the state of this job at {@code intoPosition}, which may be new.
   */
  protected abstract void merge(int intoPosition, J from, int fromPosition);

  protected abstract void mergeThreadSafe(AggregateBucket[] into, int fromPosition);

  @Override
  void scan() {
    for (int i = start; i < end; i++) {
      final GroupKey key = hasher.keyOf(i);
      final int position = groups.getIfAbsentPut(key, groups.size());
      apply(table.getRow(i), position);
    }
  }

  @Override
  void mergeFrom(final J other) {
    other.groups.forEachKeyValue((key, theirPosition) -> {
      final int position = groups.getIfAbsentPut(key, groups.size());
      merge(position, other, theirPosition);
    });
  }

  /**
   * Global entries are always buckets: the first job finding a group inserts empty spare buckets, then every job folds its own
   * state into them.
   */
  @Override
  void mergeInto(final ConcurrentGroupDictionary<AggregateBucket[]> global) {
    groups.forEachKeyValue((key, position) -> {
      if (spare == null)
        spare = context.newBuckets();

      final AggregateBucket[] target = global.getOrAdd(key, spare);
      if (target == spare)
        spare = null;
      else
        checkGroup(key, target);

      mergeThreadSafe(target, position);
    });
  }

  @Override
  int size() {
    return groups.size();
  }

  protected GroupSource<Integer> ordinals() {
    return consumer -> groups.forEachKeyValue((key, position) -> consumer.accept(key, position));
  }
}
