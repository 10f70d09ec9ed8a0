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
 * Minimum or maximum of an integer expression. The value slot is meaningful only once the set flag is raised, so a group without
 * contributing rows reports null instead of zero.
 * <p>
 * Concurrent updates: the first value is stored under the monitor of the storage unit, exactly once, writing the value before the
 * volatile flag. Later values go through a compare-and-swap loop that gives up as soon as the candidate no longer improves the
 * current extremum.
 */
public class IntegerMinMax extends Aggregate {
  private final boolean max;

  public IntegerMinMax(final AggregateFunction function, final Expression expression) {
    super(function, expression);
    if (function != AggregateFunction.MIN && function != AggregateFunction.MAX)
      throw new IllegalArgumentException("Function " + function + " is not min or max");
    this.max = function == AggregateFunction.MAX;
  }

  @Override
  public StorageSlots getSlots() {
    return StorageSlots.VALUE_AND_FLAG;
  }

  protected boolean improves(final long current, final long candidate) {
    return max ? candidate > current : candidate < current;
  }

  @Override
  public void apply(final Row row, final AggregateBucket bucket) {
    final Long value = (Long) expression.evaluate(row);
    if (value != null)
      fold(bucket, value);
  }

  @Override
  public void applyThreadSafe(final Row row, final AggregateBucket bucket) {
    final Long value = (Long) expression.evaluate(row);
    if (value != null)
      foldThreadSafe(bucket, value);
  }

  @Override
  public void merge(final AggregateBucket into, final AggregateBucket from) {
    if (from.isSet())
      fold(into, from.getValue());
  }

  @Override
  public void mergeThreadSafe(final AggregateBucket into, final AggregateBucket from) {
    if (from.isSet())
      foldThreadSafe(into, from.getValue());
  }

  @Override
  public Object getFinal(final AggregateBucket bucket) {
    return bucket.isSet() ? bucket.getValue() : null;
  }

  @Override
  public void apply(final Row row, final AggregateList list, final int position) {
    list.ensureSize(position + 1);
    final Long value = (Long) expression.evaluate(row);
    if (value != null)
      fold(list, position, value);
  }

  @Override
  public void merge(final AggregateList into, final int intoPosition, final AggregateList from, final int fromPosition) {
    into.ensureSize(intoPosition + 1);
    if (from.isSet(fromPosition))
      fold(into, intoPosition, from.getValue(fromPosition));
  }

  @Override
  public void mergeThreadSafe(final AggregateBucket into, final AggregateList from, final int fromPosition) {
    if (from.isSet(fromPosition))
      foldThreadSafe(into, from.getValue(fromPosition));
  }

  @Override
  public Object getFinal(final AggregateList list, final int position) {
    return list.isSet(position) ? list.getValue(position) : null;
  }

  @Override
  public void apply(final Row row, final AggregateArray array, final int position) {
    final Long value = (Long) expression.evaluate(row);
    if (value != null)
      fold(array, position, value);
  }

  @Override
  public void applyThreadSafe(final Row row, final AggregateArray array, final int position) {
    final Long value = (Long) expression.evaluate(row);
    if (value == null)
      return;

    if (!array.isSetVolatile(position)) {
      synchronized (array) {
        if (!array.isSetVolatile(position)) {
          array.setValue(position, value);
          array.markSetVolatile(position);
          return;
        }
      }
    }

    while (true) {
      final long current = array.getValueVolatile(position);
      if (!improves(current, value) || array.compareAndSetValue(position, current, value))
        return;
    }
  }

  @Override
  public void merge(final AggregateArray into, final int intoPosition, final AggregateArray from, final int fromPosition) {
    if (from.isSet(fromPosition))
      fold(into, intoPosition, from.getValue(fromPosition));
  }

  @Override
  public void mergeThreadSafe(final AggregateBucket into, final AggregateArray from, final int fromPosition) {
    if (from.isSet(fromPosition))
      foldThreadSafe(into, from.getValue(fromPosition));
  }

  @Override
  public Object getFinal(final AggregateArray array, final int position) {
    return array.isSet(position) ? array.getValue(position) : null;
  }

  private void fold(final AggregateBucket bucket, final long value) {
    if (!bucket.isSet()) {
      bucket.setValue(value);
      bucket.markSet();
    } else if (improves(bucket.getValue(), value))
      bucket.setValue(value);
  }

  private void foldThreadSafe(final AggregateBucket bucket, final long value) {
    if (!bucket.isSet()) {
      synchronized (bucket) {
        if (!bucket.isSet()) {
          bucket.setValue(value);
          bucket.markSet();
          return;
        }
      }
    }

    while (true) {
      final long current = bucket.getValueVolatile();
      if (!improves(current, value) || bucket.compareAndSetValue(current, value))
        return;
    }
  }

  private void fold(final AggregateList list, final int position, final long value) {
    if (!list.isSet(position)) {
      list.setValue(position, value);
      list.markSet(position);
    } else if (improves(list.getValue(position), value))
      list.setValue(position, value);
  }

  private void fold(final AggregateArray array, final int position, final long value) {
    if (!array.isSet(position)) {
      array.setValue(position, value);
      array.markSet(position);
    } else if (improves(array.getValue(position), value))
      array.setValue(position, value);
  }
}
