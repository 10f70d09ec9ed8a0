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
package com.graphquery.query.expression;

import com.graphquery.query.result.Row;

/**
 * Scalar expression evaluated against a matched row. Expressions are immutable and safe to evaluate from many threads.
 */
public interface Expression {
  /**
   * Type of the values returned by {@link #evaluate(Row)}.
   */
  ValueType getType();

  /**
   * Evaluates the expression on the row.
   *
   * @return the value, or null when it cannot be produced for this row (missing property, value of another type). A null result is
   * a per-row miss, never an error.
   */
  Object evaluate(Row row);

  /**
   * Text of the expression as it appeared in the query, used for headers and messages.
   */
  String getName();
}
