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

import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.result.ResultTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Materializes the groups the first time they are read and keeps them, so the terminal storage is read exactly once.
 */
public abstract class AbstractGroupResults implements GroupResults {
  protected final  ResultTable       table;
  protected final  List<Aggregate>   aggregates;
  private volatile List<GroupResult> groups;

  protected AbstractGroupResults(final ResultTable table, final List<Aggregate> aggregates) {
    this.table = table;
    this.aggregates = Collections.unmodifiableList(new ArrayList<>(aggregates));
  }

  /**
   * Appends to {@code target} one result per group.
   */
  protected abstract void collect(List<GroupResult> target);

  /**
   * Number of groups, available before materialization.
   */
  protected abstract int countGroups();

  @Override
  public int size() {
    final List<GroupResult> current = groups;
    return current != null ? current.size() : countGroups();
  }

  @Override
  public List<Aggregate> getAggregates() {
    return aggregates;
  }

  @Override
  public Iterator<GroupResult> iterator() {
    return materialize().iterator();
  }

  /**
   * @return all the groups as an unmodifiable list
   */
  public List<GroupResult> toList() {
    return materialize();
  }

  private List<GroupResult> materialize() {
    List<GroupResult> current = groups;
    if (current == null) {
      synchronized (this) {
        current = groups;
        if (current == null) {
          final List<GroupResult> collected = new ArrayList<>(countGroups());
          collect(collected);
          current = Collections.unmodifiableList(collected);
          groups = current;
        }
      }
    }
    return current;
  }

  protected Object[] newValues() {
    return new Object[aggregates.size()];
  }
}
