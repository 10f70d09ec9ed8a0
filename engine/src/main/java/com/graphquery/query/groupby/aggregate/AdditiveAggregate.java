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

import com.graphquery.query.expression.Expression;
import com.graphquery.query.result.Row;

/**
 * Base of the aggregates computed by addition: every contributing row adds its contribution to the running value and increments
 * the element counter. Thread-safe paths use atomic fetch-and-add on both slots.
 */
public abstract class AdditiveAggregate extends Aggregate {
  protected AdditiveAggregate(final AggregateFunction function, final Expression expression) {
    super(function, expression);
  }

  /**
   * @return the amount to add for the row, or null if the row does not contribute
   */
  protected abstract Long contribution(Row row);

  /**
   * Computes the final value from the running value and the number of contributing rows.
   */
  protected abstract Object finish(long value, long count);

  @Override
  public StorageSlots getSlots() {
    return StorageSlots.VALUE_AND_COUNT;
  }

  @Override
  public void apply(final Row row, final AggregateBucket bucket) {
    final Long delta = contribution(row);
    if (delta != null) {
      bucket.addValue(delta);
      bucket.addCount(1);
    }
  }

  @Override
  public void applyThreadSafe(final Row row, final AggregateBucket bucket) {
    final Long delta = contribution(row);
    if (delta != null) {
      bucket.addValueAtomic(delta);
      bucket.addCountAtomic(1);
    }
  }

  @Override
  public void merge(final AggregateBucket into, final AggregateBucket from) {
    into.addValue(from.getValue());
    into.addCount(from.getCount());
  }

  @Override
  public void mergeThreadSafe(final AggregateBucket into, final AggregateBucket from) {
    if (from.getCount() == 0)
      return;
    into.addValueAtomic(from.getValue());
    into.addCountAtomic(from.getCount());
  }

  @Override
  public Object getFinal(final AggregateBucket bucket) {
    return finish(bucket.getValue(), bucket.getCount());
  }

  @Override
  public void apply(final Row row, final AggregateList list, final int position) {
    list.ensureSize(position + 1);
    final Long delta = contribution(row);
    if (delta != null) {
      list.addValue(position, delta);
      list.addCount(position, 1);
    }
  }

  @Override
  public void merge(final AggregateList into, final int intoPosition, final AggregateList from, final int fromPosition) {
    into.ensureSize(intoPosition + 1);
    into.addValue(intoPosition, from.getValue(fromPosition));
    into.addCount(intoPosition, from.getCount(fromPosition));
  }

  @Override
  public void mergeThreadSafe(final AggregateBucket into, final AggregateList from, final int fromPosition) {
    final long count = from.getCount(fromPosition);
    if (count == 0)
      return;
    into.addValueAtomic(from.getValue(fromPosition));
    into.addCountAtomic(count);
  }

  @Override
  public Object getFinal(final AggregateList list, final int position) {
    return finish(list.getValue(position), list.getCount(position));
  }

  @Override
  public void apply(final Row row, final AggregateArray array, final int position) {
    final Long delta = contribution(row);
    if (delta != null) {
      array.addValue(position, delta);
      array.addCount(position, 1);
    }
  }

  @Override
  public void applyThreadSafe(final Row row, final AggregateArray array, final int position) {
    final Long delta = contribution(row);
    if (delta != null) {
      array.addValueAtomic(position, delta);
      array.addCountAtomic(position, 1);
    }
  }

  @Override
  public void merge(final AggregateArray into, final int intoPosition, final AggregateArray from, final int fromPosition) {
    into.addValue(intoPosition, from.getValue(fromPosition));
    into.addCount(intoPosition, from.getCount(fromPosition));
  }

  @Override
  public void mergeThreadSafe(final AggregateBucket into, final AggregateArray from, final int fromPosition) {
    final long count = from.getCount(fromPosition);
    if (count == 0)
      return;
    into.addValueAtomic(from.getValue(fromPosition));
    into.addCountAtomic(count);
  }

  @Override
  public Object getFinal(final AggregateArray array, final int position) {
    return finish(array.getValue(position), array.getCount(position));
  }
}
