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
package com.graphquery.query.groupby.key;

import com.graphquery.query.expression.Expression;
import com.graphquery.query.result.ResultTable;
import com.graphquery.query.result.Row;

import java.util.List;
import java.util.Objects;

/**
 * Evaluates the grouping-key expressions of the rows of a result table. Owns the hash-combine logic and the values cached from the
 * last hashed row, and exposes them through two views: {@link RowHasher} builds the {@link GroupKey} of a row, and
 * {@link RowEqualityComparer} compares the key values of two rows, reading the cached values instead of evaluating them again when
 * one side is the row just hashed.
 * <p>
 * A caching evaluator belongs to one thread. Every worker takes its own {@link #copy(boolean)}, which shares the immutable
 * expressions and owns fresh cache slots. A non caching copy keeps no state and can be shared by any number of threads.
 */
public final class RowKeyEvaluator {
  private static final int SEED = 5381;

  private final ResultTable         table;
  private final Expression[]        expressions;
  private final boolean             cacheResults;
  private final Object[]            cachedValues;
  private       int                 cachedRow = -1;
  private final RowHasher           hasher;
  private final RowEqualityComparer comparer;

  public RowKeyEvaluator(final ResultTable table, final List<Expression> expressions, final boolean cacheResults) {
    this(table, expressions.toArray(new Expression[0]), cacheResults);
  }

  private RowKeyEvaluator(final ResultTable table, final Expression[] expressions, final boolean cacheResults) {
    if (expressions.length == 0)
      throw new IllegalArgumentException("At least one grouping expression is required");
    this.table = table;
    this.expressions = expressions;
    this.cacheResults = cacheResults;
    this.cachedValues = cacheResults ? new Object[expressions.length] : null;
    this.hasher = new RowHasher(this);
    this.comparer = new RowEqualityComparer(this);
  }

  /**
   * Returns an evaluator over the same table and expressions with its own cache. The views of the copy point to the copy.
   */
  public RowKeyEvaluator copy(final boolean cacheResults) {
    return new RowKeyEvaluator(table, expressions, cacheResults);
  }

  public RowHasher getHasher() {
    return hasher;
  }

  public RowEqualityComparer getComparer() {
    return comparer;
  }

  public ResultTable getTable() {
    return table;
  }

  public int getExpressionCount() {
    return expressions.length;
  }

  public boolean isCachingResults() {
    return cacheResults;
  }

  /**
   * Combines the hashes of the key values of the row, null values hashing to 0. When caching, the evaluated values are kept for
   * the next comparisons involving this row.
   */
  int hash(final int rowIndex) {
    final Row row = table.getRow(rowIndex);

    int hash = SEED;
    if (cacheResults) {
      cachedRow = -1;
      for (int i = 0; i < expressions.length; i++) {
        final Object value = expressions[i].evaluate(row);
        cachedValues[i] = value;
        hash = combine(hash, value);
      }
      cachedRow = rowIndex;
    } else
      for (final Expression expression : expressions)
        hash = combine(hash, expression.evaluate(row));

    return hash;
  }

  /**
   * @return true if every key expression evaluates to equal values on the two rows
   */
  boolean rowsEqual(final int rowIndexA, final int rowIndexB) {
    if (rowIndexA == rowIndexB)
      return true;

    Row rowA = null;
    Row rowB = null;
    for (int i = 0; i < expressions.length; i++) {
      final Object valueA;
      if (cacheResults && rowIndexA == cachedRow)
        valueA = cachedValues[i];
      else {
        if (rowA == null)
          rowA = table.getRow(rowIndexA);
        valueA = expressions[i].evaluate(rowA);
      }

      final Object valueB;
      if (cacheResults && rowIndexB == cachedRow)
        valueB = cachedValues[i];
      else {
        if (rowB == null)
          rowB = table.getRow(rowIndexB);
        valueB = expressions[i].evaluate(rowB);
      }

      if (!Objects.equals(valueA, valueB))
        return false;
    }
    return true;
  }

  static int combine(final int hash, final Object value) {
    return ((hash << 5) + hash) ^ (value != null ? value.hashCode() : 0);
  }
}
