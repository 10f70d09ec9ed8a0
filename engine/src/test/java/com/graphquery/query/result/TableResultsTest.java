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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableResultsTest {
  @Test
  void addAndReadRows() {
    final TableResults table = new TableResults("a", "b");
    assertThat(table.addRow(1, "x")).isEqualTo(0);
    assertThat(table.addRow(2, null)).isEqualTo(1);

    assertThat(table.getRowCount()).isEqualTo(2);
    assertThat(table.getColumnCount()).isEqualTo(2);
    assertThat(table.getColumnIndex("b")).isEqualTo(1);
    assertThat(table.getColumnName(0)).isEqualTo("a");

    final Row row = table.getRow(1);
    assertThat(row.getIndex()).isEqualTo(1);
    assertThat(row.getValue(0)).isEqualTo(2);
    assertThat(row.getValue(1)).isNull();
  }

  @Test
  void invalidAccess() {
    final TableResults table = new TableResults("a");
    table.addRow(1);

    assertThatThrownBy(() -> table.addRow(1, 2)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> table.getColumnIndex("z")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> table.getRow(1)).isInstanceOf(IndexOutOfBoundsException.class);
  }
}
