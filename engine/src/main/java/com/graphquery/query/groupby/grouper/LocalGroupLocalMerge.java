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
import com.graphquery.query.groupby.result.EmptyGroupResults;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.result.ResultTable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveAction;

/**
 * Local-group / local-merge. Every worker groups its row range in a private dictionary, then the jobs are merged pairwise along a
 * balanced binary tree: at every node the left half waits for the right half, which runs concurrently, and folds it into its first
 * job. Subtrees of three jobs or less scan their jobs concurrently and merge them sequentially. Nothing is shared while scanning.
 */
public class LocalGroupLocalMerge extends Grouper {
  public LocalGroupLocalMerge(final List<Aggregate> aggregates, final List<Expression> keys, final ContextConfiguration configuration) {
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
    final List<J> jobs = new ArrayList<>(threads);
    for (int i = 0; i < threads; i++)
      jobs.add(factory.create(context, bounds[i], bounds[i + 1]));

    if (threads == 1) {
      final J job = jobs.get(0);
      job.scan();
      return job.toResults();
    }

    final ForkJoinPool pool = createPool();
    try {
      pool.invoke(new MergeTask<>(jobs, 0, threads));
    } catch (final RuntimeException | Error e) {
      throw workerFailure(e);
    } finally {
      pool.shutdownNow();
    }

    return jobs.get(0).toResults();
  }

  private final class MergeTask<J extends GroupJob<J>> extends RecursiveAction {
    private final List<J> jobs;
    private final int     start;
    private final int     end;

    private MergeTask(final List<J> jobs, final int start, final int end) {
      this.jobs = jobs;
      this.start = start;
      this.end = end;
    }

    @Override
    protected void compute() {
      if (end - start > 3) {
        final int middle = start + (end - start) / 2;

        final MergeTask<J> right = new MergeTask<>(jobs, middle, end);
        right.fork();
        new MergeTask<>(jobs, start, middle).compute();
        right.join();

        merge(middle);
      } else {
        final List<ForkJoinTask<?>> scans = new ArrayList<>(end - start - 1);
        for (int i = start + 1; i < end; i++)
          scans.add(ForkJoinTask.adapt(jobs.get(i)::scan).fork());

        jobs.get(start).scan();
        for (final ForkJoinTask<?> scan : scans)
          scan.join();

        for (int i = start + 1; i < end; i++)
          merge(i);
      }
    }

    private void merge(final int donor) {
      enterMerging();
      jobs.get(start).mergeFrom(jobs.get(donor));
      // THE DONOR IS NOT USED ANYMORE
      jobs.set(donor, null);
    }
  }
}
