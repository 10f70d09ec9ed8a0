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
package com.graphquery.query.result;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In memory {@link ResultTable} where every row is an array of column values. Rows are appended by the producer and then read
 * concurrently by the consumers.
 */
public class TableResults implements ResultTable {
  private final String[]       columnNames;
  private final List<Object[]> rows;

  public TableResults(final String... columnNames) {
    this(16, columnNames);
  }

  public TableResults(final int initialCapacity, final String... columnNames) {
    if (columnNames.length == 0)
      throw new IllegalArgumentException("A table needs at least one column");
    this.columnNames = columnNames.clone();
    this.rows = new ArrayList<>(initialCapacity);
  }

  /**
   * Appends a row. The number of values must match the number of columns.
   *
   * @return the index of the new row
   */
  public int addRow(final Object... values) {
    if (values.length != columnNames.length)
      throw new IllegalArgumentException("Expected " + columnNames.length + " values but found " + values.length);
    rows.add(values.clone());
    return rows.size() - 1;
  }

  public int getColumnIndex(final String columnName) {
    for (int i = 0; i < columnNames.length; i++)
      if (columnNames[i].equals(columnName))
        return i;
    throw new IllegalArgumentException("Column '" + columnName + "' not found in " + Arrays.toString(columnNames));
  }

  public String getColumnName(final int column) {
    return columnNames[column];
  }

  public int getColumnCount() {
    return columnNames.length;
  }

  @Override
  public int getRowCount() {
    return rows.size();
  }

  @Override
  public Row getRow(final int index) {
    if (index < 0 || index >= rows.size())
      throw new IndexOutOfBoundsException("Row " + index + " out of range 0-" + rows.size());
    return new TableRow(index, rows.get(index));
  }

  private static final class TableRow implements Row {
    private final int      index;
    private final Object[] values;

    private TableRow(final int index, final Object[] values) {
      this.index = index;
      this.values = values;
    }

    @Override
    public int getIndex() {
      return index;
    }

    @Override
    public int getColumnCount() {
      return values.length;
    }

    @Override
    public Object getValue(final int column) {
      return values[column];
    }

    @Override
    public String toString() {
      return "#" + index + Arrays.toString(values);
    }
  }
}
