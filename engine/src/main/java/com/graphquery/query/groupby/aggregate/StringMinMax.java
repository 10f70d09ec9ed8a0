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
 * Minimum or maximum of a string expression in natural {@link String} order. Same protocol as {@link IntegerMinMax} applied to the
 * reference slot: the compare-and-swap compares references, which is correct because a slot only ever moves to a new candidate
 * instance.
 */
public class StringMinMax extends Aggregate {
  private final boolean max;

  public StringMinMax(final AggregateFunction function, final Expression expression) {
    super(function, expression);
    if (function != AggregateFunction.MIN && function != AggregateFunction.MAX)
      throw new IllegalArgumentException("Function " + function + " is not min or max");
    this.max = function == AggregateFunction.MAX;
  }

  @Override
  public StorageSlots getSlots() {
    return StorageSlots.REFERENCE_AND_FLAG;
  }

  protected boolean improves(final String current, final String candidate) {
    final int comparison = candidate.compareTo(current);
    return max ? comparison > 0 : comparison < 0;
  }

  @Override
  public void apply(final Row row, final AggregateBucket bucket) {
    final String value = (String) expression.evaluate(row);
    if (value != null)
      fold(bucket, value);
  }

  @Override
  public void applyThreadSafe(final Row row, final AggregateBucket bucket) {
    final String value = (String) expression.evaluate(row);
    if (value != null)
      foldThreadSafe(bucket, value);
  }

  @Override
  public void merge(final AggregateBucket into, final AggregateBucket from) {
    if (from.isSet())
      fold(into, (String) from.getReference());
  }

  @Override
  public void mergeThreadSafe(final AggregateBucket into, final AggregateBucket from) {
    if (from.isSet())
      foldThreadSafe(into, (String) from.getReference());
  }

  @Override
  public Object getFinal(final AggregateBucket bucket) {
    return bucket.isSet() ? bucket.getReference() : null;
  }

  @Override
  public void apply(final Row row, final AggregateList list, final int position) {
    list.ensureSize(position + 1);
    final String value = (String) expression.evaluate(row);
    if (value != null)
      fold(list, position, value);
  }

  @Override
  public void merge(final AggregateList into, final int intoPosition, final AggregateList from, final int fromPosition) {
    into.ensureSize(intoPosition + 1);
    if (from.isSet(fromPosition))
      fold(into, intoPosition, (String) from.getReference(fromPosition));
  }

  @Override
  public void mergeThreadSafe(final AggregateBucket into, final AggregateList from, final int fromPosition) {
    if (from.isSet(fromPosition))
      foldThreadSafe(into, (String) from.getReference(fromPosition));
  }

  @Override
  public Object getFinal(final AggregateList list, final int position) {
    return list.isSet(position) ? list.getReference(position) : null;
  }

  @Override
  public void apply(final Row row, final AggregateArray array, final int position) {
    final String value = (String) expression.evaluate(row);
    if (value != null)
      fold(array, position, value);
  }

  @Override
  public void applyThreadSafe(final Row row, final AggregateArray array, final int position) {
    final String value = (String) expression.evaluate(row);
    if (value == null)
      return;

    if (!array.isSetVolatile(position)) {
      synchronized (array) {
        if (!array.isSetVolatile(position)) {
          array.setReference(position, value);
          array.markSetVolatile(position);
          return;
        }
      }
    }

    while (true) {
      final String current = (String) array.getReferenceVolatile(position);
      if (!improves(current, value) || array.compareAndSetReference(position, current, value))
        return;
    }
  }

  @Override
  public void merge(final AggregateArray into, final int intoPosition, final AggregateArray from, final int fromPosition) {
    if (from.isSet(fromPosition))
      fold(into, intoPosition, (String) from.getReference(fromPosition));
  }

  @Override
  public void mergeThreadSafe(final AggregateBucket into, final AggregateArray from, final int fromPosition) {
    if (from.isSet(fromPosition))
      foldThreadSafe(into, (String) from.getReference(fromPosition));
  }

  @Override
  public Object getFinal(final AggregateArray array, final int position) {
    return array.isSet(position) ? array.getReference(position) : null;
  }

  private void fold(final AggregateBucket bucket, final String value) {
    if (!bucket.isSet()) {
      bucket.setReference(value);
      bucket.markSet();
    } else if (improves((String) bucket.getReference(), value))
      bucket.setReference(value);
  }

  private void foldThreadSafe(final AggregateBucket bucket, final String value) {
    if (!bucket.isSet()) {
      synchronized (bucket) {
        if (!bucket.isSet()) {
          bucket.setReference(value);
          bucket.markSet();
          return;
        }
      }
    }

    while (true) {
      final String current = (String) bucket.getReferenceVolatile();
      if (!improves(current, value) || bucket.compareAndSetReference(current, value))
        return;
    }
  }

  private void fold(final AggregateList list, final int position, final String value) {
    if (!list.isSet(position)) {
      list.setReference(position, value);
      list.markSet(position);
    } else if (improves((String) list.getReference(position), value))
      list.setReference(position, value);
  }

  private void fold(final AggregateArray array, final int position, final String value) {
    if (!array.isSet(position)) {
      array.setReference(position, value);
      array.markSet(position);
    } else if (improves((String) array.getReference(position), value))
      array.setReference(position, value);
  }
}
