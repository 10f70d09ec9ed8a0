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

import com.graphquery.exception.ConfigurationException;
import com.graphquery.exception.ErrorCode;
import com.graphquery.query.expression.Expression;
import com.graphquery.query.expression.ValueType;
import com.graphquery.query.result.Row;

/**
 * Aggregate function bound to its expression. Instances are stateless and shared by all the workers: the partial state lives in
 * the storage units passed to every call.
 * <p>
 * Every storage representation has its own overloads so the grouper picks the representation once and never casts per row:
 * <ul>
 *   <li>{@link AggregateBucket}: one cell per group. {@code applyThreadSafe} and {@code mergeThreadSafe} may run concurrently on the
 *   same bucket.</li>
 *   <li>{@link AggregateList}: growable, indexed by the group ordinal of the owning worker. Single-threaded only.</li>
 *   <li>{@link AggregateArray}: pre-sized, indexed by group ordinal. {@code applyThreadSafe} may run concurrently on the same
 *   position.</li>
 * </ul>
 * Merging a list or array position into a bucket covers the case where local and global storages differ.
 * <p>
 * A row where the expression evaluates to null does not contribute.
 */
public abstract class Aggregate {
  protected final AggregateFunction function;
  protected final Expression        expression;

  protected Aggregate(final AggregateFunction function, final Expression expression) {
    this.function = function;
    this.expression = expression;
  }

  /**
   * Creates the aggregate for a function and its expression.
   *
   * @param expression the argument, or null for {@code count(*)}
   *
   * @throws ConfigurationException if the expression is missing for a function other than count, or its type is not accepted
   */
  public static Aggregate create(final AggregateFunction function, final Expression expression) {
    if (function == null)
      throw new ConfigurationException(ErrorCode.QUERY_UNKNOWN_FUNCTION, "Aggregate function not specified");

    if (expression == null && function != AggregateFunction.COUNT)
      throw new ConfigurationException("Aggregate function '" + function.getName() + "' requires an expression");

    switch (function) {
    case COUNT:
      return new Count(expression);
    case SUM:
      checkType(function, expression, ValueType.INTEGER);
      return new Sum(expression);
    case AVG:
      checkType(function, expression, ValueType.INTEGER);
      return new Avg(expression);
    case MIN:
    case MAX:
      if (expression.getType() == ValueType.STRING)
        return new StringMinMax(function, expression);
      checkType(function, expression, ValueType.INTEGER);
      return new IntegerMinMax(function, expression);
    default:
      throw new ConfigurationException(ErrorCode.QUERY_UNKNOWN_FUNCTION, "Unsupported aggregate function '" + function + "'");
    }
  }

  public static Aggregate create(final String functionName, final Expression expression) {
    return create(AggregateFunction.fromName(functionName), expression);
  }

  private static void checkType(final AggregateFunction function, final Expression expression, final ValueType expected) {
    if (expression.getType() != expected)
      throw new ConfigurationException(ErrorCode.QUERY_TYPE_MISMATCH,
          "Aggregate function '" + function.getName() + "' does not accept expression '" + expression.getName() + "' of type "
              + expression.getType());
  }

  public AggregateFunction getFunction() {
    return function;
  }

  /**
   * @return the argument or null for {@code count(*)}
   */
  public Expression getExpression() {
    return expression;
  }

  /**
   * @return true if the aggregate counts the rows themselves, so its value is the number of rows in the group
   */
  public boolean isCountOfRows() {
    return false;
  }

  public abstract StorageSlots getSlots();

  public AggregateBucket createBucket() {
    return new AggregateBucket();
  }

  public AggregateList createList() {
    return new AggregateList(getSlots());
  }

  public AggregateArray createArray(final int capacity) {
    return new AggregateArray(getSlots(), capacity);
  }

  // BUCKETS
  public abstract void apply(Row row, AggregateBucket bucket);

  public abstract void applyThreadSafe(Row row, AggregateBucket bucket);

  public abstract void merge(AggregateBucket into, AggregateBucket from);

  public abstract void mergeThreadSafe(AggregateBucket into, AggregateBucket from);

  public abstract Object getFinal(AggregateBucket bucket);

  // LISTS
  public abstract void apply(Row row, AggregateList list, int position);

  public abstract void merge(AggregateList into, int intoPosition, AggregateList from, int fromPosition);

  public abstract void mergeThreadSafe(AggregateBucket into, AggregateList from, int fromPosition);

  public abstract Object getFinal(AggregateList list, int position);

  // ARRAYS
  public abstract void apply(Row row, AggregateArray array, int position);

  public abstract void applyThreadSafe(Row row, AggregateArray array, int position);

  public abstract void merge(AggregateArray into, int intoPosition, AggregateArray from, int fromPosition);

  public abstract void mergeThreadSafe(AggregateBucket into, AggregateArray from, int fromPosition);

  public abstract Object getFinal(AggregateArray array, int position);

  @Override
  public String toString() {
    return function.getName() + "(" + (expression != null ? expression.getName() : "*") + ")";
  }
}
