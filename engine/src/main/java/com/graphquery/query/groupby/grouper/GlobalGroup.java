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
import com.graphquery.GlobalConfiguration;
import com.graphquery.exception.ConfigurationException;
import com.graphquery.query.expression.Expression;
import com.graphquery.query.groupby.AggregateStorage;
import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.groupby.aggregate.AggregateArray;
import com.graphquery.query.groupby.aggregate.AggregateBucket;
import com.graphquery.query.groupby.key.ConcurrentGroupDictionary;
import com.graphquery.query.groupby.key.GroupKey;
import com.graphquery.query.groupby.key.RowHasher;
import com.graphquery.query.groupby.result.ArrayGroupResults;
import com.graphquery.query.groupby.result.BucketGroupResults;
import com.graphquery.query.groupby.result.EmptyGroupResults;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.result.ResultTable;
import com.graphquery.query.result.Row;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Global grouping. There are no private dictionaries: every worker looks up each row of its range in one concurrent dictionary and
 * updates the aggregate state it finds with the thread-safe operations. Fits queries with few distinct groups.
 * <p>
 * With bucket storage the dictionary maps every group to its buckets. With array storage it maps every group to a dense position
 * handed out by a shared counter, and the aggregate state lives in shared arrays: updates run under the read lock, growing the
 * arrays takes the write lock. List storage cannot be shared and is rejected.
 */
public class GlobalGroup extends Grouper {
  private final int arrayInitialSize;

  public GlobalGroup(final List<Aggregate> aggregates, final List<Expression> keys, final ContextConfiguration configuration) {
    super(aggregates, keys, configuration);
    if (storage == AggregateStorage.LISTS)
      throw new ConfigurationException("Global grouping does not support list storage, use buckets or arrays");

    this.arrayInitialSize = configuration.getValueAsInteger(GlobalConfiguration.GROUP_BY_ARRAY_INITIAL_SIZE);
    if (arrayInitialSize < 1)
      throw new ConfigurationException("Initial size of the aggregate arrays must be at least 1, found " + arrayInitialSize);
  }

  @Override
  protected GroupResults execute(final ResultTable table) {
    final int rowCount = table.getRowCount();
    if (rowCount == 0)
      return new EmptyGroupResults(table, aggregates);

    final int[] bounds = splitRows(rowCount, threads);
    final GroupContext context = new GroupContext(table, aggregates, keys);

    if (storage == AggregateStorage.ARRAYS) {
      final SharedArrays shared = new SharedArrays(context);
      runWorkers(bounds, (start, end) -> new ArrayWorker(context, shared, start, end));
      return new ArrayGroupResults(table, aggregates, shared.positions::forEach, shared.arrays, shared.positions.size());
    }

    final ConcurrentGroupDictionary<AggregateBucket[]> global = new ConcurrentGroupDictionary<>(context.getTemplate(), 16);
    runWorkers(bounds, (start, end) -> new BucketWorker(context, global, start, end));
    return new BucketGroupResults(table, aggregates, global::forEach, global.size());
  }

  private void runWorkers(final int[] bounds, final WorkerFactory factory) {
    if (threads == 1) {
      factory.create(bounds[0], bounds[1]).run();
      return;
    }

    final ForkJoinPool pool = createPool();
    try {
      final List<ForkJoinTask<?>> tasks = new ArrayList<>(threads - 1);
      for (int i = 0; i < threads - 1; i++)
        tasks.add(pool.submit(factory.create(bounds[i], bounds[i + 1])));

      // THE CALLING THREAD RUNS THE LAST RANGE
      factory.create(bounds[threads - 1], bounds[threads]).run();

      for (final ForkJoinTask<?> task : tasks)
        task.join();

    } catch (final RuntimeException | Error e) {
      throw workerFailure(e);
    } finally {
      pool.shutdownNow();
    }
  }

  @FunctionalInterface
  private interface WorkerFactory {
    Runnable create(int start, int end);
  }

  private static final class BucketWorker implements Runnable {
    private final GroupContext                                 context;
    private final ConcurrentGroupDictionary<AggregateBucket[]> global;
    private final RowHasher                                    hasher;
    private final int                                          start;
    private final int                                          end;

    private BucketWorker(final GroupContext context, final ConcurrentGroupDictionary<AggregateBucket[]> global, final int start,
        final int end) {
      this.context = context;
      this.global = global;
      this.hasher = context.getTemplate().copy(true).getHasher();
      this.start = start;
      this.end = end;
    }

    @Override
    public void run() {
      final ResultTable table = context.getTable();
      final Aggregate[] aggregates = context.getAggregates();

      AggregateBucket[] spare = context.newBuckets();
      for (int i = start; i < end; i++) {
        final GroupKey key = hasher.keyOf(i);
        final AggregateBucket[] buckets = global.getOrAdd(key, spare);
        if (buckets == spare)
          spare = context.newBuckets();

        final Row row = table.getRow(i);
        for (int a = 0; a < aggregates.length; a++)
          aggregates[a].applyThreadSafe(row, buckets[a]);
      }
    }
  }

  /**
   * Positions and arrays shared by the array workers.
   */
  private final class SharedArrays {
    private final ConcurrentGroupDictionary<Integer> positions;
    private final AggregateArray[]                   arrays;
    private final AtomicInteger                      nextPosition = new AtomicInteger();
    private final ReentrantReadWriteLock             lock         = new ReentrantReadWriteLock();
    private volatile int                             capacity;

    private SharedArrays(final GroupContext context) {
      final Aggregate[] aggregates = context.getAggregates();
      this.positions = new ConcurrentGroupDictionary<>(context.getTemplate(), arrayInitialSize);
      this.arrays = new AggregateArray[aggregates.length];
      for (int a = 0; a < aggregates.length; a++)
        arrays[a] = aggregates[a].createArray(arrayInitialSize);
      this.capacity = arrayInitialSize;
    }

    private int positionOf(final GroupKey key) {
      final int position = positions.computeIfAbsent(key, k -> nextPosition.getAndIncrement());
      if (position >= capacity)
        grow(position);
      return position;
    }

    private void grow(final int position) {
      lock.writeLock().lock();
      try {
        int newCapacity = capacity;
        while (newCapacity <= position)
          newCapacity = newCapacity > Integer.MAX_VALUE / 2 ? Integer.MAX_VALUE : newCapacity * 2;

        if (newCapacity > capacity) {
          for (final AggregateArray array : arrays)
            array.ensureCapacity(newCapacity);
          capacity = newCapacity;
        }
      } finally {
        lock.writeLock().unlock();
      }
    }
  }

  private static final class ArrayWorker implements Runnable {
    private final GroupContext context;
    private final SharedArrays shared;
    private final RowHasher    hasher;
    private final int          start;
    private final int          end;

    private ArrayWorker(final GroupContext context, final SharedArrays shared, final int start, final int end) {
      this.context = context;
      this.shared = shared;
      this.hasher = context.getTemplate().copy(true).getHasher();
      this.start = start;
      this.end = end;
    }

    @Override
    public void run() {
      final ResultTable table = context.getTable();
      final Aggregate[] aggregates = context.getAggregates();
      final AggregateArray[] arrays = shared.arrays;

      for (int i = start; i < end; i++) {
        final int position = shared.positionOf(hasher.keyOf(i));
        final Row row = table.getRow(i);

        shared.lock.readLock().lock();
        try {
          for (int a = 0; a < aggregates.length; a++)
            aggregates[a].applyThreadSafe(row, arrays[a], position);
        } finally {
          shared.lock.readLock().unlock();
        }
      }
    }
  }
}
