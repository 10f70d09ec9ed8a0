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
import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.groupby.aggregate.AggregateBucket;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.groupby.result.SingleGroupResults;
import com.graphquery.query.result.ResultTable;
import com.graphquery.query.result.Row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;

/**
 * Aggregation without grouping keys: the whole table is one group. Every worker folds its range into private buckets, then the
 * partial buckets are merged. {@code count(*)} is answered with the row count, without scanning. The strategy and storage settings
 * do not apply.
 */
public class SingleGroupGrouper extends Grouper {
  private final int[] scannedAggregates;

  public SingleGroupGrouper(final List<Aggregate> aggregates, final ContextConfiguration configuration) {
    super(aggregates, Collections.emptyList(), configuration);

    final List<Integer> scanned = new ArrayList<>();
    for (int i = 0; i < this.aggregates.size(); i++)
      if (!this.aggregates.get(i).isCountOfRows())
        scanned.add(i);
    this.scannedAggregates = scanned.stream().mapToInt(Integer::intValue).toArray();
  }

  @Override
  protected GroupResults execute(final ResultTable table) {
    final int rowCount = table.getRowCount();
    final AggregateBucket[] result;

    if (rowCount == 0)
      result = newBuckets();
    else {
      final int[] bounds = splitRows(rowCount, threads);
      if (threads == 1)
        result = scan(table, bounds[0], bounds[1]);
      else
        result = scanInParallel(table, bounds);
    }

    for (int i = 0; i < result.length; i++)
      if (aggregates.get(i).isCountOfRows()) {
        result[i].setValue(rowCount);
        result[i].addCount(rowCount);
      }

    return new SingleGroupResults(table, aggregates, result);
  }

  private AggregateBucket[] scanInParallel(final ResultTable table, final int[] bounds) {
    final List<AggregateBucket[]> partials = new ArrayList<>(threads);

    final ForkJoinPool pool = createPool();
    try {
      final List<ForkJoinTask<AggregateBucket[]>> tasks = new ArrayList<>(threads - 1);
      for (int i = 0; i < threads - 1; i++) {
        final int start = bounds[i];
        final int end = bounds[i + 1];
        tasks.add(pool.submit(() -> scan(table, start, end)));
      }

      final AggregateBucket[] last = scan(table, bounds[threads - 1], bounds[threads]);
      for (final ForkJoinTask<AggregateBucket[]> task : tasks)
        partials.add(task.join());
      partials.add(last);

    } catch (final RuntimeException | Error e) {
      throw workerFailure(e);
    } finally {
      pool.shutdownNow();
    }

    enterMerging();
    final AggregateBucket[] result = partials.get(0);
    for (int p = 1; p < partials.size(); p++) {
      final AggregateBucket[] partial = partials.get(p);
      for (final int a : scannedAggregates)
        aggregates.get(a).merge(result[a], partial[a]);
    }
    return result;
  }

  private AggregateBucket[] scan(final ResultTable table, final int start, final int end) {
    final AggregateBucket[] buckets = newBuckets();
    final Aggregate[] scanned = new Aggregate[scannedAggregates.length];
    for (int i = 0; i < scanned.length; i++)
      scanned[i] = aggregates.get(scannedAggregates[i]);

    for (int r = start; r < end; r++) {
      final Row row = table.getRow(r);
      for (int i = 0; i < scanned.length; i++)
        scanned[i].apply(row, buckets[scannedAggregates[i]]);
    }
    return buckets;
  }

  private AggregateBucket[] newBuckets() {
    final AggregateBucket[] buckets = new AggregateBucket[aggregates.size()];
    for (int i = 0; i < buckets.length; i++)
      buckets[i] = aggregates.get(i).createBucket();
    return buckets;
  }
}
