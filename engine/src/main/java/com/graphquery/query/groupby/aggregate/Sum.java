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

public class Sum extends AdditiveAggregate {
  public Sum(final Expression expression) {
    super(AggregateFunction.SUM, expression);
  }

  @Override
  protected Long contribution(final Row row) {
    return (Long) expression.evaluate(row);
  }

  /**
   * @return the total, or null if no row of the group had a value
   */
  @Override
  protected Object finish(final long value, final long count) {
    return count > 0 ? value : null;
  }
}
