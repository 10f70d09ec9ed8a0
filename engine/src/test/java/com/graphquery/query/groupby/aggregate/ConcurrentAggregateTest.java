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
package com.graphquery.query.groupby.aggregate;

import com.graphquery.query.expression.ColumnReference;
import com.graphquery.query.expression.ValueType;
import com.graphquery.query.result.TableResults;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Many threads hit the same bucket and the same array position at the same time.
 */
class ConcurrentAggregateTest {
  private static final int THREADS         = 8;
  private static final int ROWS_PER_THREAD = 5_000;

  private final TableResults table = new TableResults("n", "s");

  private void fillTable() {
    for (int i = 0; i < THREADS * ROWS_PER_THREAD; i++)
      table.addRow(i % 97 == 0 ? null : (long) i - 10_000, "v" + (i % 1000));
  }

  private void race(final Aggregate[] aggregates, final AggregateBucket[] buckets, final AggregateArray[] arrays) throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < THREADS; t++) {
        final int first = t * ROWS_PER_THREAD;
        futures.add(executor.submit(() -> {
          start.await();
          for (int i = first; i < first + ROWS_PER_THREAD; i++)
            for (int a = 0; a < aggregates.length; a++) {
              aggregates[a].applyThreadSafe(table.getRow(i), buckets[a]);
              aggregates[a].applyThreadSafe(table.getRow(i), arrays[a], 1);
            }
          return null;
        }));
      }
      start.countDown();
      for (final Future<?> future : futures)
        future.get(60, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void concurrentUpdatesMatchSequentialResult() throws Exception {
    fillTable();

    final ColumnReference number = new ColumnReference(0, ValueType.INTEGER, "n");
    final ColumnReference text = new ColumnReference(1, ValueType.STRING, "s");
    final Aggregate[] aggregates = new Aggregate[] { Aggregate.create(AggregateFunction.COUNT, null),
        Aggregate.create(AggregateFunction.COUNT, number), Aggregate.create(AggregateFunction.SUM, number),
        Aggregate.create(AggregateFunction.AVG, number), Aggregate.create(AggregateFunction.MIN, number),
        Aggregate.create(AggregateFunction.MAX, number), Aggregate.create(AggregateFunction.MIN, text),
        Aggregate.create(AggregateFunction.MAX, text) };

    final AggregateBucket[] buckets = new AggregateBucket[aggregates.length];
    final AggregateArray[] arrays = new AggregateArray[aggregates.length];
    final AggregateBucket[] expected = new AggregateBucket[aggregates.length];
    for (int a = 0; a < aggregates.length; a++) {
      buckets[a] = aggregates[a].createBucket();
      arrays[a] = aggregates[a].createArray(2);
      expected[a] = aggregates[a].createBucket();
      for (int i = 0; i < table.getRowCount(); i++)
        aggregates[a].apply(table.getRow(i), expected[a]);
    }

    race(aggregates, buckets, arrays);

    for (int a = 0; a < aggregates.length; a++) {
      final Object reference = aggregates[a].getFinal(expected[a]);
      assertThat(reference).as(aggregates[a].toString()).isNotNull();
      assertThat(aggregates[a].getFinal(buckets[a])).as(aggregates[a] + " on bucket").isEqualTo(reference);
      assertThat(aggregates[a].getFinal(arrays[a], 1)).as(aggregates[a] + " on array").isEqualTo(reference);
      assertThat(aggregates[a].getFinal(arrays[a], 0)).as(aggregates[a] + " untouched").isIn(null, 0L);
    }

    assertThat(aggregates[0].getFinal(buckets[0])).isEqualTo((long) THREADS * ROWS_PER_THREAD);
    assertThat(aggregates[4].getFinal(buckets[4])).isEqualTo(-9_999L);
    assertThat(aggregates[7].getFinal(buckets[7])).isEqualTo("v999");
  }

  @Test
  void concurrentMergesIntoOneBucket() throws Exception {
    fillTable();
    final Aggregate max = Aggregate.create(AggregateFunction.MAX, new ColumnReference(0, ValueType.INTEGER));
    final Aggregate sum = Aggregate.create(AggregateFunction.SUM, new ColumnReference(0, ValueType.INTEGER));

    final AggregateBucket[] partialMax = new AggregateBucket[THREADS];
    final AggregateBucket[] partialSum = new AggregateBucket[THREADS];
    for (int t = 0; t < THREADS; t++) {
      partialMax[t] = max.createBucket();
      partialSum[t] = sum.createBucket();
      for (int i = t * ROWS_PER_THREAD; i < (t + 1) * ROWS_PER_THREAD; i++) {
        max.apply(table.getRow(i), partialMax[t]);
        sum.apply(table.getRow(i), partialSum[t]);
      }
    }

    final AggregateBucket globalMax = max.createBucket();
    final AggregateBucket globalSum = sum.createBucket();
    final ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < THREADS; t++) {
        final int thread = t;
        futures.add(executor.submit(() -> {
          start.await();
          max.mergeThreadSafe(globalMax, partialMax[thread]);
          sum.mergeThreadSafe(globalSum, partialSum[thread]);
          return null;
        }));
      }
      start.countDown();
      for (final Future<?> future : futures)
        future.get(60, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    long expectedSum = 0;
    long expectedMax = Long.MIN_VALUE;
    for (int i = 0; i < table.getRowCount(); i++) {
      final Object value = table.getRow(i).getValue(0);
      if (value != null) {
        expectedSum += (Long) value;
        expectedMax = Math.max(expectedMax, (Long) value);
      }
    }
    assertThat(max.getFinal(globalMax)).isEqualTo(expectedMax);
    assertThat(sum.getFinal(globalSum)).isEqualTo(expectedSum);
  }
}
