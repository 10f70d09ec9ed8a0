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
 * Keeps the running sum and the number of contributing rows. The division happens only when the final value is read, so partial
 * states merge exactly.
 */
public class Avg extends AdditiveAggregate {
  public Avg(final Expression expression) {
    super(AggregateFunction.AVG, expression);
  }

  @Override
  protected Long contribution(final Row row) {
    return (Long) expression.evaluate(row);
  }

  @Override
  protected Object finish(final long value, final long count) {
    return count > 0 ? (double) value / count : null;
  }
}
