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
 * Reads one column of the row.
 */
public class ColumnReference implements Expression {
  private final int       column;
  private final ValueType type;
  private final String    name;

  public ColumnReference(final int column, final ValueType type) {
    this(column, type, "$" + column);
  }

  public ColumnReference(final int column, final ValueType type, final String name) {
    if (column < 0)
      throw new IllegalArgumentException("Invalid column " + column);
    this.column = column;
    this.type = type;
    this.name = name;
  }

  @Override
  public ValueType getType() {
    return type;
  }

  @Override
  public Object evaluate(final Row row) {
    if (column >= row.getColumnCount())
      return null;
    return type.coerce(row.getValue(column));
  }

  @Override
  public String getName() {
    return name;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public String toString() {
    return name;
  }
}
