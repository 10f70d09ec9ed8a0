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

import com.graphquery.exception.ErrorCode;
import com.graphquery.exception.InternalException;
import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.groupby.aggregate.AggregateBucket;
import com.graphquery.query.groupby.key.ConcurrentGroupDictionary;
import com.graphquery.query.groupby.key.GroupKey;
import com.graphquery.query.groupby.key.RowEqualityComparer;
import com.graphquery.query.groupby.key.RowHasher;
import com.graphquery.query.groupby.key.RowKeyEvaluator;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.result.ResultTable;

/**
 * Work of one worker: a contiguous row range {@code [start, end)} of the shared table, a private hasher and comparer, a private
 * group dictionary and private aggregate storage. A job is scanned once, then either merged into another job of the same kind,
 * drained into the shared dictionary, or turned into the final results. After donating its groups a job must not be used again.
 *
 * @param <J> concrete job type, so jobs merge only with jobs using the same storage
 */
abstract class GroupJob<J extends GroupJob<J>> {
  protected final GroupContext        context;
  protected final ResultTable         table;
  protected final Aggregate[]         aggregates;
  protected final RowHasher           hasher;
  protected final RowEqualityComparer comparer;
  protected final int                 start;
  protected final int                 end;

  protected GroupJob(final GroupContext context, final int start, final int end) {
    this.context = context;
    this.table = context.getTable();
    this.aggregates = context.getAggregates();
    final RowKeyEvaluator evaluator = context.getTemplate().copy(true);
    this.hasher = evaluator.getHasher();
    this.comparer = evaluator.getComparer();
    this.start = start;
    this.end = end;
  }

  /**
   * Groups the rows of the range into the private dictionary.
   */
  abstract void scan();

  /**
   * Moves the groups of {@code other} into this job, merging the aggregates of the groups both jobs found.
   */
  abstract void mergeFrom(J other);

  /**
   * Moves the groups of this job into the shared dictionary with the thread-safe merge operations. Can run concurrently with other
   * jobs doing the same.
   */
  abstract void mergeInto(ConcurrentGroupDictionary<AggregateBucket[]> global);

  /**
   * @return number of groups currently in the private dictionary
   */
  abstract int size();

  abstract GroupResults toResults();

  protected void checkGroup(final GroupKey key, final AggregateBucket[] target) {
    if (target.length != aggregates.length)
      throw new InternalException(ErrorCode.MERGE_INCONSISTENCY,
          "Group " + key + " holds " + target.length + " aggregates in the shared dictionary, expected " + aggregates.length);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + start + "-" + end + ")";
  }
}
