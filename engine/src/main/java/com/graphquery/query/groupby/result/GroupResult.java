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
package com.graphquery.query.groupby.result;

import com.graphquery.query.result.Row;

import java.util.Arrays;

/**
 * One group of the result: a representative row and the final value of every aggregate, in the order they were requested. Values
 * are {@link Long} (count, sum, integer min/max), {@link Double} (avg), {@link String} (string min/max) or null for no value.
 */
public final class GroupResult {
  private final Row      representative;
  private final Object[] values;

  public GroupResult(final Row representative, final Object[] values) {
    this.representative = representative;
    this.values = values;
  }

  /**
   * @return one of the rows of the group, or null for the single group of an empty table
   */
  public Row getRepresentative() {
    return representative;
  }

  /**
   * @return index of the representative row, or -1 if there is none
   */
  public int getRepresentativeIndex() {
    return representative != null ? representative.getIndex() : -1;
  }

  public Object getValue(final int aggregateIndex) {
    return values[aggregateIndex];
  }

  public int getValueCount() {
    return values.length;
  }

  public Object[] getValues() {
    return values.clone();
  }

  @Override
  public String toString() {
    return "GroupResult{row=" + getRepresentativeIndex() + ", values=" + Arrays.toString(values) + "}";
  }
}
