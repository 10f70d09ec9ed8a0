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

import java.util.Map;

/**
 * Reads a property of a matched element, as in {@code x.age}. The row column bound to the variable holds the properties of the
 * element as a map. A missing property, or a column that is not an element, is a miss.
 */
public class VariablePropertyReference implements Expression {
  private final int       column;
  private final String    variable;
  private final String    property;
  private final ValueType type;

  public VariablePropertyReference(final int column, final String variable, final String property, final ValueType type) {
    if (column < 0)
      throw new IllegalArgumentException("Invalid column " + column);
    this.column = column;
    this.variable = variable;
    this.property = property;
    this.type = type;
  }

  @Override
  public ValueType getType() {
    return type;
  }

  @Override
  public Object evaluate(final Row row) {
    if (column >= row.getColumnCount())
      return null;

    final Object element = row.getValue(column);
    if (!(element instanceof Map))
      return null;

    return type.coerce(((Map<?, ?>) element).get(property));
  }

  @Override
  public String getName() {
    return variable + "." + property;
  }

  public String getProperty() {
    return property;
  }

  @Override
  public String toString() {
    return getName();
  }
}
