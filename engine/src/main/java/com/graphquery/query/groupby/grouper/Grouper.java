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
import com.graphquery.exception.GraphQueryException;
import com.graphquery.exception.GroupingException;
import com.graphquery.log.LogManager;
import com.graphquery.query.expression.Expression;
import com.graphquery.query.groupby.AggregateStorage;
import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.result.ResultTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;

/**
 * Base of the grouping algorithms. A grouper splits the rows of the table among {@code threads} workers, builds the groups and
 * hands back the final {@link GroupResults}.
 * <p>
 * Settings are read from the {@link ContextConfiguration} and validated at construction, before any worker starts. The row count
 * is known only when {@link #group(ResultTable)} is called: a thread count leaving a worker without rows is rejected then, before
 * scanning. A grouper is single-use.
 */
public abstract class Grouper {
  protected final List<Aggregate>               aggregates;
  protected final List<Expression>              keys;
  protected final AggregateStorage              storage;
  protected final int                           threads;
  protected final boolean                       logTimings;
  private final   AtomicReference<GrouperState> state = new AtomicReference<>(GrouperState.IDLE);

  protected Grouper(final List<Aggregate> aggregates, final List<Expression> keys, final ContextConfiguration configuration) {
    if (aggregates == null)
      throw new ConfigurationException("Aggregate list not specified");
    for (final Aggregate aggregate : aggregates)
      if (aggregate == null)
        throw new ConfigurationException("Aggregate list contains a null entry");

    this.aggregates = Collections.unmodifiableList(new ArrayList<>(aggregates));
    this.keys = keys != null ? Collections.unmodifiableList(new ArrayList<>(keys)) : Collections.emptyList();

    try {
      this.threads = configuration.getValueAsInteger(GlobalConfiguration.GROUP_BY_THREADS);
      this.storage = configuration.getValueAsEnum(GlobalConfiguration.GROUP_BY_STORAGE, AggregateStorage.class);
    } catch (final IllegalArgumentException | ClassCastException e) {
      throw new ConfigurationException("Invalid grouping configuration", e);
    }
    this.logTimings = configuration.getValueAsBoolean(GlobalConfiguration.GROUP_BY_LOG_TIMINGS);

    if (threads < 1)
      throw new ConfigurationException("Grouping thread count must be at least 1, found " + threads);
    if (storage == null)
      throw new ConfigurationException("Aggregate storage not specified");
  }

  /**
   * Groups the rows of the table. Can be called only once.
   *
   * @throws IllegalStateException  if the grouper was already used
   * @throws ConfigurationException if a worker would be left without rows
   * @throws GroupingException      if a worker failed
   */
  public final GroupResults group(final ResultTable table) {
    if (!state.compareAndSet(GrouperState.IDLE, GrouperState.SCANNING))
      throw new IllegalStateException("Grouper instances are single-use, current state is " + state.get());

    try {
      final long begin = System.nanoTime();
      final GroupResults results = execute(table);

      final Level level = logTimings ? Level.INFO : Level.FINE;
      LogManager.instance()
          .log(this, level, "Grouped %d rows into %d groups in %dms (storage=%s threads=%d keys=%s)", table.getRowCount(), results.size(),
              (System.nanoTime() - begin) / 1_000_000, storage, threads, keys);
      return results;

    } finally {
      state.set(GrouperState.FINALIZED);
    }
  }

  public GrouperState getState() {
    return state.get();
  }

  public int getThreads() {
    return threads;
  }

  public AggregateStorage getStorage() {
    return storage;
  }

  public List<Aggregate> getAggregates() {
    return aggregates;
  }

  protected abstract GroupResults execute(ResultTable table);

  protected void enterMerging() {
    state.compareAndSet(GrouperState.SCANNING, GrouperState.MERGING);
  }

  /**
   * Splits {@code rowCount} rows in {@code threads} contiguous ranges of {@code rowCount / threads} rows, the last one taking the
   * remainder.
   *
   * @return {@code threads + 1} boundaries: range {@code i} is {@code [bounds[i], bounds[i + 1])}
   *
   * @throws ConfigurationException if a range would be empty
   */
  protected static int[] splitRows(final int rowCount, final int threads) {
    final int share = rowCount / threads;
    if (share == 0)
      throw new ConfigurationException(
          "Cannot split " + rowCount + " rows among " + threads + " grouping threads: every thread needs at least one row");

    final int[] bounds = new int[threads + 1];
    for (int i = 0; i < threads; i++)
      bounds[i] = i * share;
    bounds[threads] = rowCount;
    return bounds;
  }

  protected ForkJoinPool createPool() {
    final AtomicInteger threadCounter = new AtomicInteger(0);
    return new ForkJoinPool(threads, pool -> {
      final ForkJoinWorkerThread t = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
      t.setName("GraphQuery-GroupBy-" + threadCounter.getAndIncrement());
      t.setDaemon(true);
      return t;
    }, null, false);
  }

  /**
   * Logs a failure of a worker and converts it to the exception surfaced to the caller.
   */
  protected RuntimeException workerFailure(final Throwable e) {
    LogManager.instance().log(this, Level.SEVERE, "Error during grouping with %d threads", e, threads);
    if (e instanceof GraphQueryException)
      return (GraphQueryException) e;
    if (e instanceof Error)
      throw (Error) e;
    return new GroupingException("Error during grouping", e);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{storage=" + storage + ", threads=" + threads + ", state=" + state.get() + "}";
  }
}
