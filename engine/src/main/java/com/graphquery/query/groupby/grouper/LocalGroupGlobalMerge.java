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
import com.graphquery.query.expression.Expression;
import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.groupby.aggregate.AggregateBucket;
import com.graphquery.query.groupby.key.ConcurrentGroupDictionary;
import com.graphquery.query.groupby.result.BucketGroupResults;
import com.graphquery.query.groupby.result.EmptyGroupResults;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.result.ResultTable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;

/**
 * Local-group / global-merge. Every worker groups its row range in a private dictionary, then drains it into one concurrent
 * dictionary shared by all the workers: the first worker adding a group publishes its own buckets, the others fold their state into
 * them with the thread-safe merge. List and array storages are folded into global buckets.
 */
public class LocalGroupGlobalMerge extends Grouper {
  public LocalGroupGlobalMerge(final List<Aggregate> aggregates, final List<Expression> keys, final ContextConfiguration configuration) {
    super(aggregates, keys, configuration);
  }

  @Override
  protected GroupResults execute(final ResultTable table) {
    final int rowCount = table.getRowCount();
    if (rowCount == 0)
      return new EmptyGroupResults(table, aggregates);

    final int[] bounds = splitRows(rowCount, threads);
    final GroupContext context = new GroupContext(table, aggregates, keys);

    switch (storage) {
    case LISTS:
      return run(context, bounds, ListGroupJob::new);
    case ARRAYS:
      return run(context, bounds, ArrayGroupJob::new);
    default:
      return run(context, bounds, BucketGroupJob::new);
    }
  }

  private <J extends GroupJob<J>> GroupResults run(final GroupContext context, final int[] bounds, final JobFactory<J> factory) {
    if (threads == 1) {
      final J job = factory.create(context, bounds[0], bounds[1]);
      job.scan();
      return job.toResults();
    }

    final List<J> jobs = new ArrayList<>(threads);
    for (int i = 0; i < threads; i++)
      jobs.add(factory.create(context, bounds[i], bounds[i + 1]));

    final ConcurrentGroupDictionary<AggregateBucket[]> global = new ConcurrentGroupDictionary<>(context.getTemplate(),
        bounds[1] - bounds[0]);

    final ForkJoinPool pool = createPool();
    try {
      final List<ForkJoinTask<?>> tasks = new ArrayList<>(threads - 1);
      for (int i = 0; i < threads - 1; i++) {
        final J job = jobs.get(i);
        tasks.add(pool.submit(() -> scanAndMerge(job, global)));
      }

      // THE CALLING THREAD RUNS THE LAST JOB
      scanAndMerge(jobs.get(threads - 1), global);

      for (final ForkJoinTask<?> task : tasks)
        task.join();

    } catch (final RuntimeException | Error e) {
      throw workerFailure(e);
    } finally {
      pool.shutdownNow();
    }

    return new BucketGroupResults(context.getTable(), aggregates, global::forEach, global.size());
  }

  private <J extends GroupJob<J>> void scanAndMerge(final J job, final ConcurrentGroupDictionary<AggregateBucket[]> global) {
    job.scan();
    enterMerging();
    job.mergeInto(global);
  }
}
